package com.rms.possync.core.model;

/**
 * Declared operating mode of the device this service runs on.
 *
 * <p>Only {@link #pos} and {@link #manager} host the LAN server. Every other mode
 * is a LAN dependent.</p>
 */
public enum DeviceMode {

    owner,

    pos,

    kds,

    bds,

    aggregator,

    customer,

    manager;

    public boolean hostsLanServer() {
        return this == pos || this == manager;
    }
}
