package com.rms.possync.lan.nats;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rms.possync.config.OrderSyncProperties;
import com.rms.possync.lan.DeviceType;
import com.rms.possync.lan.LanChannel;
import com.rms.possync.lan.LanClientInfo;
import com.rms.possync.lan.LanClientStatus;
import com.rms.possync.lan.LanEventListener;
import com.rms.possync.lan.LanSetupException;
import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Dispatcher;
import io.nats.client.Message;
import io.nats.client.Nats;
import io.nats.client.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * {@link LanChannel} over a NATS broker running on the LAN host.
 *
 * <h2>Topology</h2>
 * <ul>
 *   <li>The host device runs (or sits next to) a NATS server; {@link #startServer} connects to it
 *       and tracks dependents through {@code clients.join} / {@code clients.leave} presence
 *       messages.</li>
 *   <li>Dependents connect with a bounded timeout, announce themselves, and listen for order,
 *       status and snapshot subjects.</li>
 *   <li>Every payload carries the sender's {@code from} id so a device ignores its own publishes.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Blocking NATS calls run on {@link Schedulers#boundedElastic()}; listener callbacks run on the
 * NATS dispatcher thread.
 */
public class NatsLanChannel implements LanChannel {

    private static final Logger log = LoggerFactory.getLogger(NatsLanChannel.class);

    static final String FROM = "from";

    /**
     * Opens a NATS connection. Replaced in tests.
     */
    @FunctionalInterface
    public interface Connector {
        Connection connect(Options options) throws IOException, InterruptedException;
    }

    private final OrderSyncProperties.Lan props;
    private final ObjectMapper mapper;
    private final Connector connector;
    private final String clientId;
    private final Clock clock;

    private final List<LanEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Set<String> clients = ConcurrentHashMap.newKeySet();
    private final AtomicReference<Session> session = new AtomicReference<>();

    public NatsLanChannel(OrderSyncProperties.Lan props, ObjectMapper mapper) {
        this(props, mapper, Nats::connect, Clock.systemUTC());
    }

    public NatsLanChannel(OrderSyncProperties.Lan props, ObjectMapper mapper, Connector connector, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.clientId = props.getClientId() == null || props.getClientId().isBlank()
                ? UUID.randomUUID().toString()
                : props.getClientId();
    }

    public String clientId() {
        return clientId;
    }

    public int connectedClients() {
        return clients.size();
    }

    // -------------------------------------------------------------------------
    // Roles
    // -------------------------------------------------------------------------

    @Override
    public Mono<String> startServer(String tenantId) {
        return Mono.fromCallable(() -> {
                    LanSubject subjects = LanSubject.of(props.getSubjectPrefix(), tenantId);
                    Connection c;
                    try {
                        c = connector.connect(options(true));
                    } catch (IOException e) {
                        throw new LanSetupException("Cannot reach LAN broker at " + props.getNatsUrl(), e);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new LanSetupException("Interrupted while connecting to LAN broker", e);
                    }
                    Dispatcher d = c.createDispatcher(this::onMessage);
                    d.subscribe(subjects.subject(LanSubject.Kind.CLIENT_JOIN));
                    d.subscribe(subjects.subject(LanSubject.Kind.CLIENT_LEAVE));
                    d.subscribe(subjects.subject(LanSubject.Kind.ORDER_CREATED));
                    d.subscribe(subjects.subject(LanSubject.Kind.ORDER_STATUS));
                    replace(new Session(c, subjects, true, null));
                    clients.clear();
                    String address = c.getConnectedUrl() == null ? props.getNatsUrl() : c.getConnectedUrl();
                    log.info("LAN host ready address={}", address);
                    return address;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> stopServer() {
        return Mono.fromRunnable(() -> {
                    Session s = session.getAndSet(null);
                    clients.clear();
                    if (s != null) {
                        closeQuietly(s.connection);
                        log.info("LAN host stopped");
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public Mono<LanClientStatus> connectAsClient(DeviceType deviceType, String tenantId) {
        return Mono.fromCallable(() -> {
                    LanSubject subjects = LanSubject.of(props.getSubjectPrefix(), tenantId);
                    Connection c;
                    try {
                        c = connector.connect(options(false));
                    } catch (IOException e) {
                        log.info("No LAN host reachable url={} err={}", props.getNatsUrl(), e.getMessage());
                        return null;
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new LanSetupException("Interrupted while joining LAN host", e);
                    }
                    Dispatcher d = c.createDispatcher(this::onMessage);
                    d.subscribe(subjects.subject(LanSubject.Kind.ORDER_CREATED));
                    d.subscribe(subjects.subject(LanSubject.Kind.ORDER_STATUS));
                    d.subscribe(subjects.subject(LanSubject.Kind.SYNC_STATE));
                    replace(new Session(c, subjects, false, deviceType));

                    Instant now = clock.instant();
                    publish(c, subjects.subject(LanSubject.Kind.CLIENT_JOIN),
                            envelope().putPOJO("client", new LanClientInfo(clientId, deviceType, now, null)));
                    String address = c.getConnectedUrl() == null ? props.getNatsUrl() : c.getConnectedUrl();
                    log.info("Joined LAN host address={} deviceType={}", address, deviceType);
                    return new LanClientStatus(true, address, now, deviceType);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> disconnect() {
        return Mono.fromRunnable(() -> {
                    Session s = session.getAndSet(null);
                    if (s == null) {
                        return;
                    }
                    try {
                        publish(s.connection, s.subjects.subject(LanSubject.Kind.CLIENT_LEAVE),
                                envelope().put("clientId", clientId));
                        s.connection.flush(Duration.ofMillis(500));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        log.debug("LAN leave notice interrupted");
                    } catch (Exception e) {
                        log.debug("LAN leave notice not delivered err={}", e.toString());
                    }
                    closeQuietly(s.connection);
                    log.info("Left LAN host");
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    // -------------------------------------------------------------------------
    // Broadcast
    // -------------------------------------------------------------------------

    @Override
    public Mono<Integer> broadcastOrder(JsonNode order, JsonNode kitchenOrder) {
        return Mono.fromCallable(() -> {
            Session s = requireSession();
            ObjectNode body = envelope();
            body.set("order", order);
            body.set("kitchenOrder", kitchenOrder);
            publish(s.connection, s.subjects.subject(LanSubject.Kind.ORDER_CREATED), body);
            return clients.size();
        });
    }

    @Override
    public Mono<Integer> broadcastOrderStatus(String orderId, String status) {
        return Mono.fromCallable(() -> {
            Session s = requireSession();
            ObjectNode body = envelope().put("orderId", orderId).put("status", status);
            body.put("updatedAt", clock.instant().toString());
            publish(s.connection, s.subjects.subject(LanSubject.Kind.ORDER_STATUS), body);
            return clients.size();
        });
    }

    @Override
    public Disposable subscribe(LanEventListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    void onMessage(Message msg) {
        Session s = session.get();
        if (s == null) {
            return;
        }
        LanSubject.Kind kind = s.subjects.tryParse(msg.getSubject());
        if (kind == null) {
            return;
        }
        JsonNode body;
        try {
            body = mapper.readTree(new String(msg.getData(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Dropping malformed LAN message subject={} err={}", msg.getSubject(), e.getMessage());
            return;
        }
        if (body == null || !body.isObject() || clientId.equals(body.path(FROM).asText(null))) {
            return;
        }

        switch (kind) {
            case ORDER_CREATED -> fire(l -> l.onOrderCreated(body.get("order"), body.get("kitchenOrder")));
            case ORDER_STATUS -> fire(l -> l.onOrderStatusUpdate(body.path("orderId").asText(null),
                    body.path("status").asText(null)));
            case SYNC_STATE -> {
                List<JsonNode> orders = new ArrayList<>();
                body.path("activeOrders").forEach(orders::add);
                fire(l -> l.onSyncState(orders));
            }
            case CLIENT_JOIN -> {
                if (!s.server) {
                    return;
                }
                LanClientInfo info;
                try {
                    info = mapper.treeToValue(body.get("client"), LanClientInfo.class);
                } catch (IOException | IllegalArgumentException e) {
                    log.warn("Dropping malformed LAN join err={}", e.getMessage());
                    return;
                }
                LanClientInfo joined = info;
                if (joined != null && joined.clientId() != null && clients.add(joined.clientId())) {
                    fire(l -> l.onClientConnected(joined));
                }
            }
            case CLIENT_LEAVE -> {
                String id = body.path("clientId").asText(null);
                if (s.server && id != null && clients.remove(id)) {
                    fire(l -> l.onClientDisconnected(id));
                }
            }
        }
    }

    private void onConnectionEvent(Connection conn, ConnectionListener.Events type, boolean server) {
        if (server) {
            log.info("LAN broker event type={}", type);
            return;
        }
        switch (type) {
            case RECONNECTED -> fire(LanEventListener::onConnected);
            case DISCONNECTED -> fire(LanEventListener::onDisconnected);
            default -> log.debug("LAN connection event type={}", type);
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private Options options(boolean server) {
        return Options.builder()
                .server(props.getNatsUrl())
                .connectionName("possync-" + (server ? "host" : "client") + "-" + clientId)
                .connectionTimeout(props.getConnectTimeout())
                .maxReconnects(-1)
                .connectionListener((conn, type) -> onConnectionEvent(conn, type, server))
                .build();
    }

    private ObjectNode envelope() {
        return mapper.createObjectNode().put(FROM, clientId);
    }

    private void publish(Connection c, String subject, ObjectNode body) throws IOException {
        c.publish(subject, mapper.writeValueAsBytes(body));
    }

    private Session requireSession() {
        Session s = session.get();
        if (s == null) {
            throw new IllegalStateException("LAN channel is not started");
        }
        return s;
    }

    private void replace(Session next) {
        Session prev = session.getAndSet(next);
        if (prev != null) {
            closeQuietly(prev.connection);
        }
    }

    private void fire(Consumer<LanEventListener> call) {
        for (LanEventListener l : listeners) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                log.warn("LAN listener failed err={}", e.toString(), e);
            }
        }
    }

    private static void closeQuietly(Connection c) {
        try {
            c.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.debug("LAN connection close failed err={}", e.toString());
        }
    }

    private record Session(Connection connection, LanSubject subjects, boolean server, DeviceType deviceType) {
    }
}
