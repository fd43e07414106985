package com.rms.possync.cloud;

import java.net.URI;

/**
 * Factory for cloud sockets. Injected into {@link CloudChannelManager} so tests can replace the
 * network with an in-memory fake.
 */
public interface CloudTransport {

    /**
     * Starts opening a socket to {@code uri}.
     *
     * <p>Events may arrive on any thread. A handshake that fails immediately may report
     * {@code onError} and {@code onClose} before this call returns.</p>
     *
     * @throws RuntimeException if the attempt cannot even be started (bad URI, client shut down)
     */
    CloudConnection open(URI uri, CloudConnection.Listener listener);
}
