package com.rms.possync.cloud;

/**
 * Informational cloud socket failure. Recovery happens through the reconnect schedule.
 */
public class CloudChannelException extends RuntimeException {

    public CloudChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
