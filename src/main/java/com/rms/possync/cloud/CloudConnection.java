package com.rms.possync.cloud;

/**
 * One cloud socket opened by a {@link CloudTransport}.
 */
public interface CloudConnection {

    boolean isOpen();

    /**
     * Queues a text frame.
     *
     * @return {@code false} if the connection is not open or refused the frame
     */
    boolean send(String frame);

    /**
     * Initiates a close handshake. Idempotent.
     */
    void close(int code, String reason);

    /**
     * Socket events. A connection reports {@link #onClose} at most once; {@link #onError} is
     * always followed by {@link #onClose}.
     */
    interface Listener {

        void onOpen();

        void onMessage(String frame);

        void onError(Throwable error);

        void onClose(int code, String reason);
    }
}
