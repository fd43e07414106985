package com.rms.possync.service;

import com.rms.possync.core.model.ConnectionState;
import com.rms.possync.core.model.ConnectionStatusChange;
import com.rms.possync.core.model.SyncPath;

/**
 * Folds the two transport states into the single status consumers see.
 *
 * <table>
 *   <caption>status</caption>
 *   <tr><td>either connected</td><td>connected</td></tr>
 *   <tr><td>else either connecting</td><td>connecting</td></tr>
 *   <tr><td>else</td><td>disconnected</td></tr>
 * </table>
 */
public final class StatusAggregator {

    private StatusAggregator() {
    }

    public static ConnectionState aggregate(ConnectionState cloud, ConnectionState lan) {
        if (cloud == ConnectionState.connected || lan == ConnectionState.connected) {
            return ConnectionState.connected;
        }
        if (cloud == ConnectionState.connecting || lan == ConnectionState.connecting) {
            return ConnectionState.connecting;
        }
        return ConnectionState.disconnected;
    }

    public static SyncPath activePath(ConnectionState cloud, ConnectionState lan) {
        boolean c = cloud == ConnectionState.connected;
        boolean l = lan == ConnectionState.connected;
        if (c && l) {
            return SyncPath.both;
        }
        if (c) {
            return SyncPath.cloud;
        }
        return l ? SyncPath.lan : SyncPath.none;
    }

    public static ConnectionStatusChange snapshot(ConnectionState cloud, ConnectionState lan) {
        return new ConnectionStatusChange(aggregate(cloud, lan), activePath(cloud, lan));
    }
}
