package com.rms.possync.lan;

import java.time.Instant;

/**
 * Result of joining a LAN host as a client.
 */
public record LanClientStatus(boolean connected, String serverAddress, Instant connectedAt, DeviceType deviceType) {
}
