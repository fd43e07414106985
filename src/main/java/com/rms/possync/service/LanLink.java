package com.rms.possync.service;

import com.rms.possync.core.model.ConnectionState;
import com.rms.possync.core.model.DetailedStatus;
import com.rms.possync.core.model.LanRole;

/**
 * Mutable LAN-side state of one service instance. Self-guarded leaf; never calls out.
 */
final class LanLink {

    private LanRole role = LanRole.none;
    private ConnectionState state = ConnectionState.disconnected;
    private boolean serverRunning;
    private int connectedClients;

    synchronized LanRole role() {
        return role;
    }

    synchronized void role(LanRole role) {
        this.role = role;
    }

    synchronized ConnectionState state() {
        return state;
    }

    /**
     * @return {@code true} if the state actually changed
     */
    synchronized boolean state(ConnectionState next) {
        if (state == next) {
            return false;
        }
        state = next;
        return true;
    }

    synchronized void serverRunning(boolean running) {
        this.serverRunning = running;
    }

    synchronized boolean serverRunning() {
        return serverRunning;
    }

    synchronized int clientConnected() {
        return ++connectedClients;
    }

    synchronized int clientDisconnected() {
        connectedClients = Math.max(0, connectedClients - 1);
        return connectedClients;
    }

    synchronized int connectedClients() {
        return connectedClients;
    }

    /** Host with at least one dependent attached. */
    synchronized boolean canBroadcast() {
        return role == LanRole.server && serverRunning && connectedClients > 0;
    }

    synchronized void reset() {
        role = LanRole.none;
        state = ConnectionState.disconnected;
        serverRunning = false;
        connectedClients = 0;
    }

    synchronized DetailedStatus.Lan snapshot() {
        return new DetailedStatus.Lan(state, role, serverRunning, connectedClients);
    }
}
