package com.rms.possync.core.dedup;

import com.rms.possync.support.Frames;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OrderIdentityTest {

    @Test
    void kitchenOrderIdWins() {
        assertThat(OrderIdentity.resolve(Frames.json("{\"orderId\":\"P-1\"}"), Frames.json("{\"id\":\"K-1\"}")))
                .contains("K-1");
    }

    @Test
    void fallsBackToPosOrderId() {
        assertThat(OrderIdentity.resolve(Frames.json("{\"orderId\":\"P-1\"}"), Frames.json("{\"items\":[]}")))
                .contains("P-1");
        assertThat(OrderIdentity.resolve(Frames.json("{\"orderId\":\"P-1\"}"), null)).contains("P-1");
    }

    @Test
    void blankOrStructuredIdsDoNotCount() {
        assertThat(OrderIdentity.resolve(Frames.json("{\"orderId\":\"  \"}"), Frames.json("{\"id\":{\"x\":1}}")))
                .isEmpty();
        assertThat(OrderIdentity.ofKitchenOrder(Frames.json("[1,2]"))).isEmpty();
    }

    @Test
    void numericIdIsReadAsText() {
        assertThat(OrderIdentity.ofKitchenOrder(Frames.json("{\"id\":17}"))).contains("17");
    }
}
