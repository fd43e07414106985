package com.rms.possync.core.message;

/**
 * Well-formed frame whose {@code type} is not part of the vocabulary this build understands.
 * Newer peers may send these; they are ignored, not treated as corruption.
 */
public class UnknownMessageTypeException extends RuntimeException {

    private final String type;

    public UnknownMessageTypeException(String type) {
        super("Unknown message type: " + type);
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
