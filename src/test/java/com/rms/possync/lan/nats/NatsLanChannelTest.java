package com.rms.possync.lan.nats;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.possync.config.OrderSyncProperties;
import com.rms.possync.lan.DeviceType;
import com.rms.possync.lan.LanClientInfo;
import com.rms.possync.lan.LanClientStatus;
import com.rms.possync.lan.LanEventListener;
import com.rms.possync.lan.LanSetupException;
import com.rms.possync.support.Frames;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.Message;
import io.nats.client.MessageHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NatsLanChannelTest {

    private static final String PREFIX = "possync.lan.tenant-1.";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final Connection connection = mock(Connection.class);
    private final Dispatcher dispatcher = mock(Dispatcher.class);
    private final List<String> events = new ArrayList<>();

    private OrderSyncProperties.Lan props;
    private NatsLanChannel channel;

    @BeforeEach
    void setUp() {
        when(connection.createDispatcher(any(MessageHandler.class))).thenReturn(dispatcher);
        props = new OrderSyncProperties.Lan();
        props.setClientId("pos-1");
        props.setNatsUrl("nats://192.168.1.10:4222");
        channel = new NatsLanChannel(props, Frames.MAPPER, options -> connection,
                Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC));
        channel.subscribe(new LanEventListener() {
            @Override
            public void onOrderCreated(JsonNode order, JsonNode kitchenOrder) {
                events.add("order:" + kitchenOrder.path("id").asText());
            }

            @Override
            public void onOrderStatusUpdate(String orderId, String status) {
                events.add("status:" + orderId + ":" + status);
            }

            @Override
            public void onSyncState(List<JsonNode> activeOrders) {
                events.add("snapshot:" + activeOrders.size());
            }

            @Override
            public void onClientConnected(LanClientInfo client) {
                events.add("joined:" + client.clientId() + ":" + client.deviceType());
            }

            @Override
            public void onClientDisconnected(String clientId) {
                events.add("left:" + clientId);
            }
        });
    }

    private static Message message(String subject, String json) {
        Message m = mock(Message.class);
        when(m.getSubject()).thenReturn(subject);
        when(m.getData()).thenReturn(json.getBytes(StandardCharsets.UTF_8));
        return m;
    }

    @Test
    void hostSubscribesToPresenceAndOrderSubjects() {
        String address = channel.startServer("tenant-1").block(TIMEOUT);

        assertThat(address).isEqualTo("nats://192.168.1.10:4222");
        verify(dispatcher).subscribe(PREFIX + "clients.join");
        verify(dispatcher).subscribe(PREFIX + "clients.leave");
        verify(dispatcher).subscribe(PREFIX + "orders.created");
        verify(dispatcher).subscribe(PREFIX + "orders.status");
    }

    @Test
    void hostTracksDependentsByPresence() {
        channel.startServer("tenant-1").block(TIMEOUT);
        String join = "{\"from\":\"kds-7\",\"client\":{\"clientId\":\"kds-7\",\"deviceType\":\"kds\","
                + "\"connectedAt\":\"2024-03-01T10:00:00Z\"}}";

        channel.onMessage(message(PREFIX + "clients.join", join));
        channel.onMessage(message(PREFIX + "clients.join", join));
        assertThat(channel.connectedClients()).isEqualTo(1);

        channel.onMessage(message(PREFIX + "clients.leave", "{\"from\":\"kds-7\",\"clientId\":\"kds-7\"}"));

        assertThat(events).containsExactly("joined:kds-7:kds", "left:kds-7");
        assertThat(channel.connectedClients()).isZero();
    }

    @Test
    void broadcastPublishesWithSenderIdAndReportsReach() {
        channel.startServer("tenant-1").block(TIMEOUT);
        channel.onMessage(message(PREFIX + "clients.join", "{\"client\":{\"clientId\":\"kds-7\",\"deviceType\":\"kds\"}}"));

        Integer reached = channel.broadcastOrder(Frames.posOrder("P-1"), Frames.kitchenOrder("K-1")).block(TIMEOUT);

        assertThat(reached).isEqualTo(1);
        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(connection).publish(eq(PREFIX + "orders.created"), body.capture());
        JsonNode sent = Frames.json(new String(body.getValue(), StandardCharsets.UTF_8));
        assertThat(sent.path("from").asText()).isEqualTo("pos-1");
        assertThat(sent.path("kitchenOrder").path("id").asText()).isEqualTo("K-1");
    }

    @Test
    void statusBroadcastCarriesTimestamp() {
        channel.startServer("tenant-1").block(TIMEOUT);

        channel.broadcastOrderStatus("K-1", "ready").block(TIMEOUT);

        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(connection).publish(eq(PREFIX + "orders.status"), body.capture());
        JsonNode sent = Frames.json(new String(body.getValue(), StandardCharsets.UTF_8));
        assertThat(sent.path("status").asText()).isEqualTo("ready");
        assertThat(sent.path("updatedAt").asText()).isEqualTo("2024-03-01T10:00:00Z");
    }

    @Test
    void broadcastBeforeStartFails() {
        StepVerifier.create(channel.broadcastOrder(null, Frames.kitchenOrder("K-1")))
                .expectError(IllegalStateException.class)
                .verify(TIMEOUT);
    }

    @Test
    void ownPublishesAreIgnored() {
        channel.startServer("tenant-1").block(TIMEOUT);

        channel.onMessage(message(PREFIX + "orders.created", "{\"from\":\"pos-1\",\"kitchenOrder\":{\"id\":\"K-1\"}}"));
        channel.onMessage(message(PREFIX + "orders.created", "{\"from\":\"pos-2\",\"kitchenOrder\":{\"id\":\"K-2\"}}"));

        assertThat(events).containsExactly("order:K-2");
    }

    @Test
    void foreignTenantAndGarbageAreDropped() {
        channel.startServer("tenant-1").block(TIMEOUT);

        channel.onMessage(message("possync.lan.tenant-2.orders.created", "{\"kitchenOrder\":{\"id\":\"K-1\"}}"));
        channel.onMessage(message(PREFIX + "orders.created", "not json"));
        channel.onMessage(message(PREFIX + "orders.status", "[1]"));

        assertThat(events).isEmpty();
    }

    @Test
    void clientJoinAnnouncesItselfAndReceivesUpdates() {
        LanClientStatus status = channel.connectAsClient(DeviceType.bds, "tenant-1").block(TIMEOUT);

        assertThat(status).isNotNull();
        assertThat(status.connected()).isTrue();
        assertThat(status.deviceType()).isEqualTo(DeviceType.bds);
        verify(dispatcher).subscribe(PREFIX + "sync.state");
        ArgumentCaptor<byte[]> join = ArgumentCaptor.forClass(byte[].class);
        verify(connection).publish(eq(PREFIX + "clients.join"), join.capture());
        JsonNode client = Frames.json(new String(join.getValue(), StandardCharsets.UTF_8)).path("client");
        assertThat(client.path("clientId").asText()).isEqualTo("pos-1");
        assertThat(client.path("deviceType").asText()).isEqualTo("bds");

        channel.onMessage(message(PREFIX + "orders.status", "{\"from\":\"pos-9\",\"orderId\":\"K-1\",\"status\":\"ready\"}"));
        channel.onMessage(message(PREFIX + "sync.state", "{\"from\":\"pos-9\",\"activeOrders\":[{\"id\":\"K-1\"},{\"id\":\"K-2\"}]}"));

        assertThat(events).containsExactly("status:K-1:ready", "snapshot:2");
    }

    @Test
    void clientIgnoresPresenceTraffic() {
        channel.connectAsClient(DeviceType.kds, "tenant-1").block(TIMEOUT);

        channel.onMessage(message(PREFIX + "clients.join", "{\"client\":{\"clientId\":\"kds-8\"}}"));

        assertThat(events).isEmpty();
    }

    @Test
    void unreachableHostMeansNoClientSession() {
        NatsLanChannel offline = new NatsLanChannel(props, Frames.MAPPER, options -> {
            throw new IOException("Unable to connect to NATS servers");
        }, Clock.systemUTC());

        StepVerifier.create(offline.connectAsClient(DeviceType.kds, "tenant-1"))
                .verifyComplete();
    }

    @Test
    void unreachableBrokerFailsServerStart() {
        NatsLanChannel offline = new NatsLanChannel(props, Frames.MAPPER, options -> {
            throw new IOException("Connection refused");
        }, Clock.systemUTC());

        StepVerifier.create(offline.startServer("tenant-1"))
                .expectError(LanSetupException.class)
                .verify(TIMEOUT);
    }

    @Test
    void interruptedJoinFailsAndKeepsTheInterruptFlag() {
        NatsLanChannel interrupted = new NatsLanChannel(props, Frames.MAPPER, options -> {
            throw new InterruptedException("worker stopping");
        }, Clock.systemUTC());
        AtomicBoolean flagged = new AtomicBoolean();

        StepVerifier.create(interrupted.connectAsClient(DeviceType.kds, "tenant-1")
                        .doOnError(e -> flagged.set(Thread.currentThread().isInterrupted())))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(LanSetupException.class)
                        .hasCauseInstanceOf(InterruptedException.class))
                .verify(TIMEOUT);

        assertThat(flagged).isTrue();
    }

    @Test
    void disconnectSendsLeaveAndCloses() throws Exception {
        channel.connectAsClient(DeviceType.kds, "tenant-1").block(TIMEOUT);

        channel.disconnect().block(TIMEOUT);

        verify(connection).publish(eq(PREFIX + "clients.leave"), any(byte[].class));
        verify(connection).close();
    }

    @Test
    void stopServerForgetsClients() throws Exception {
        channel.startServer("tenant-1").block(TIMEOUT);
        channel.onMessage(message(PREFIX + "clients.join", "{\"client\":{\"clientId\":\"kds-7\"}}"));

        channel.stopServer().block(TIMEOUT);

        assertThat(channel.connectedClients()).isZero();
        verify(connection).close();
        verify(connection, never()).publish(anyString(), any(byte[].class));
    }

    @Test
    void unsubscribedListenerHearsNothing() {
        List<String> late = new ArrayList<>();
        Disposable d = channel.subscribe(new LanEventListener() {
            @Override
            public void onOrderCreated(JsonNode order, JsonNode kitchenOrder) {
                late.add(kitchenOrder.path("id").asText());
            }
        });
        channel.startServer("tenant-1").block(TIMEOUT);
        d.dispose();

        channel.onMessage(message(PREFIX + "orders.created", "{\"kitchenOrder\":{\"id\":\"K-3\"}}"));

        assertThat(late).isEmpty();
        assertThat(events).containsExactly("order:K-3");
    }
}
