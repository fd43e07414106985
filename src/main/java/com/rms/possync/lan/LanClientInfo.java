package com.rms.possync.lan;

import java.time.Instant;

/**
 * A dependent device attached to this host's LAN server.
 */
public record LanClientInfo(String clientId, DeviceType deviceType, Instant connectedAt, String ipAddress) {
}
