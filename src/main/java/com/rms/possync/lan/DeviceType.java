package com.rms.possync.lan;

/**
 * Device classes that take part in the LAN mesh.
 */
public enum DeviceType {
    pos,
    kds,
    bds,
    manager
}
