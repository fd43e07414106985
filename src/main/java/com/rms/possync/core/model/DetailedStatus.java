package com.rms.possync.core.model;

/**
 * Snapshot of both transports plus the derived path, as served by the admin endpoint.
 */
public record DetailedStatus(Cloud cloud, Lan lan, SyncPath activePath) {

    public record Cloud(ConnectionState status, int reconnectAttempts, boolean reconnectPending) {
    }

    public record Lan(ConnectionState status, LanRole role, boolean serverRunning, int connectedClients) {
    }
}
