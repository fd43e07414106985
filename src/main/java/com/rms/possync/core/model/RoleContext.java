package com.rms.possync.core.model;

import com.rms.possync.lan.DeviceType;

import java.util.Objects;

/**
 * Role of this instance, derived once at initialization.
 *
 * @param tenantId      tenant whose cloud room and LAN mesh this device joins
 * @param deviceMode    declared operating mode
 * @param lanRole       server, client or none
 * @param lanDeviceType device type announced when connecting as a LAN client ({@code null} unless client)
 */
public record RoleContext(String tenantId, DeviceMode deviceMode, LanRole lanRole, DeviceType lanDeviceType) {

    public RoleContext {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(deviceMode, "deviceMode");
        Objects.requireNonNull(lanRole, "lanRole");
    }

    /**
     * Derives the role for a device.
     *
     * @param lanCapable whether this host has a LAN collaborator at all
     */
    public static RoleContext derive(String tenantId, DeviceMode mode, boolean lanCapable) {
        if (!lanCapable) {
            return new RoleContext(tenantId, mode, LanRole.none, null);
        }
        if (mode.hostsLanServer()) {
            return new RoleContext(tenantId, mode, LanRole.server, null);
        }
        DeviceType type = switch (mode) {
            case kds -> DeviceType.kds;
            case bds -> DeviceType.bds;
            default -> DeviceType.manager;
        };
        return new RoleContext(tenantId, mode, LanRole.client, type);
    }

    public boolean isServer() {
        return lanRole == LanRole.server;
    }
}
