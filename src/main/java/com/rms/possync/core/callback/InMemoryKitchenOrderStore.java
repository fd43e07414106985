package com.rms.possync.core.callback;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rms.possync.core.dedup.OrderIdentity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Insertion-ordered in-memory store of active and completed kitchen orders.
 *
 * <p>Used when no device-local store is wired, and by tests.</p>
 */
public class InMemoryKitchenOrderStore implements KitchenOrderStore {

    private final Map<String, ObjectNode> active = new LinkedHashMap<>();
    private final Map<String, ObjectNode> completed = new LinkedHashMap<>();

    @Override
    public synchronized void addOrder(JsonNode kitchenOrder) {
        OrderIdentity.ofKitchenOrder(kitchenOrder)
                .ifPresent(id -> active.put(id, ((ObjectNode) kitchenOrder).deepCopy()));
    }

    @Override
    public synchronized void updateOrderStatus(String orderId, String status) {
        ObjectNode order = active.get(orderId);
        if (order != null) {
            order.put("status", status);
        }
    }

    @Override
    public synchronized void moveToCompleted(String orderId) {
        ObjectNode order = active.remove(orderId);
        if (order != null) {
            order.put("status", "completed");
            completed.put(orderId, order);
        }
    }

    @Override
    public synchronized void updateItemStatus(String orderId, String itemId, String status) {
        ObjectNode order = active.get(orderId);
        if (order == null || !order.path("items").isArray()) {
            return;
        }
        for (JsonNode item : order.get("items")) {
            if (item.isObject() && itemId.equals(item.path("id").asText(null))) {
                ((ObjectNode) item).put("status", status);
            }
        }
    }

    @Override
    public synchronized void setActiveOrders(List<JsonNode> activeOrders) {
        active.clear();
        activeOrders.forEach(this::addOrder);
    }

    public synchronized Optional<JsonNode> find(String orderId) {
        ObjectNode o = active.get(orderId);
        return Optional.ofNullable(o != null ? o.deepCopy() : null);
    }

    public synchronized List<JsonNode> activeOrders() {
        return new ArrayList<>(active.values());
    }

    public synchronized List<JsonNode> completedOrders() {
        return new ArrayList<>(completed.values());
    }
}
