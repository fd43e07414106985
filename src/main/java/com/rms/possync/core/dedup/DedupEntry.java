package com.rms.possync.core.dedup;

/**
 * An id applied recently, with the scheduler time (epoch millis) it was first seen.
 */
public record DedupEntry(String messageId, long insertedAt) {
}
