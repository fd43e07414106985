package com.rms.possync.lan;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Named handlers for events raised by a {@link LanChannel}. All methods default to no-ops.
 */
public interface LanEventListener {

    default void onOrderCreated(JsonNode order, JsonNode kitchenOrder) {
    }

    default void onOrderStatusUpdate(String orderId, String status) {
    }

    default void onSyncState(List<JsonNode> activeOrders) {
    }

    /** Client link to the host is up. */
    default void onConnected() {
    }

    /** Client link to the host dropped. */
    default void onDisconnected() {
    }

    default void onClientConnected(LanClientInfo client) {
    }

    default void onClientDisconnected(String clientId) {
    }
}
