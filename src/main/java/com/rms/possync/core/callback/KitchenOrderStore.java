package com.rms.possync.core.callback;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Local kitchen-order state the router applies inbound orders to. Persistence, if any, is the
 * implementation's side effect.
 */
public interface KitchenOrderStore {

    void addOrder(JsonNode kitchenOrder);

    void updateOrderStatus(String orderId, String status);

    void moveToCompleted(String orderId);

    void updateItemStatus(String orderId, String itemId, String status);

    /** Replaces the whole active set with a snapshot. */
    void setActiveOrders(List<JsonNode> activeOrders);
}
