package com.rms.possync.lan;

/**
 * The LAN role could not be established (server failed to bind, no host found).
 * The service keeps running on the cloud path.
 */
public class LanSetupException extends RuntimeException {

    public LanSetupException(String message) {
        super(message);
    }

    public LanSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
