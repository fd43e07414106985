package com.rms.possync.core.message;

/**
 * Inbound frame that cannot be turned into a {@link SyncMessage}: not JSON, not an object,
 * no usable {@code type}, or fields of the wrong shape for its type.
 */
public class MalformedFrameException extends RuntimeException {

    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
