package com.rms.possync.core.callback;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rms.possync.support.Frames;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryKitchenOrderStoreTest {

    private final InMemoryKitchenOrderStore store = new InMemoryKitchenOrderStore();

    @Test
    void keepsInsertionOrderAndCopiesInput() {
        ObjectNode k2 = Frames.kitchenOrder("K-2");
        store.addOrder(k2);
        store.addOrder(Frames.kitchenOrder("K-1"));
        k2.put("status", "tampered");

        assertThat(store.activeOrders()).extracting(o -> o.path("id").asText()).containsExactly("K-2", "K-1");
        assertThat(store.find("K-2").orElseThrow().path("status").asText()).isEqualTo("pending");
    }

    @Test
    void completingMovesTheOrder() {
        store.addOrder(Frames.kitchenOrder("K-1"));

        store.moveToCompleted("K-1");
        store.moveToCompleted("K-404");

        assertThat(store.activeOrders()).isEmpty();
        assertThat(store.completedOrders()).singleElement()
                .satisfies(o -> assertThat(o.path("status").asText()).isEqualTo("completed"));
    }

    @Test
    void unknownOrdersAreIgnored() {
        store.updateOrderStatus("K-404", "ready");
        store.updateItemStatus("K-404", "i1", "ready");

        assertThat(store.activeOrders()).isEmpty();
    }

    @Test
    void snapshotReplacesActiveSet() {
        store.addOrder(Frames.kitchenOrder("K-1"));

        store.setActiveOrders(List.of(Frames.kitchenOrder("K-7")));

        assertThat(store.find("K-1")).isEmpty();
        assertThat(store.find("K-7")).isPresent();
    }
}
