package com.rms.possync.core.model;

/**
 * Informational error event. Never fatal; the tagged transport degrades and recovers on its own.
 */
public record SyncError(Transport transport, Throwable cause) {
}
