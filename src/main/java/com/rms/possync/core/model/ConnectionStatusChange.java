package com.rms.possync.core.model;

/**
 * Aggregate connection status published on every transport transition.
 */
public record ConnectionStatusChange(ConnectionState status, SyncPath activePath) {
}
