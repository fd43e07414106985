package com.rms.possync.core.model;

/**
 * Per-transport outcome of one outbound broadcast.
 *
 * @param cloud whether the frame was handed to an open cloud socket
 * @param lan   number of LAN clients the message reached (0 when not sent over LAN)
 */
public record BroadcastResult(boolean cloud, int lan) {

    public static final BroadcastResult NOT_SENT = new BroadcastResult(false, 0);

    public static BroadcastResult cloudOnly(boolean cloud) {
        return new BroadcastResult(cloud, 0);
    }
}
