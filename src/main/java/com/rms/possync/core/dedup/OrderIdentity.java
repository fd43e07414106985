package com.rms.possync.core.dedup;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Reconstructs the dedup key of an order-bearing payload.
 *
 * <p>The kitchen order id wins; the POS order's {@code orderId} is the fallback.</p>
 */
public final class OrderIdentity {

    private OrderIdentity() {
    }

    public static Optional<String> resolve(JsonNode order, JsonNode kitchenOrder) {
        Optional<String> id = text(kitchenOrder, "id");
        return id.isPresent() ? id : text(order, "orderId");
    }

    public static Optional<String> ofKitchenOrder(JsonNode kitchenOrder) {
        return resolve(null, kitchenOrder);
    }

    private static Optional<String> text(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) {
            return Optional.empty();
        }
        String s = v.asText();
        return s.isBlank() ? Optional.empty() : Optional.of(s);
    }
}
