package com.rms.possync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.possync.cloud.CloudChannelManager;
import com.rms.possync.cloud.CloudTransport;
import com.rms.possync.cloud.ReconnectBackoff;
import com.rms.possync.config.OrderSyncProperties;
import com.rms.possync.core.callback.KitchenOrderStore;
import com.rms.possync.core.callback.SyncCallbacks;
import com.rms.possync.core.dedup.DedupCache;
import com.rms.possync.core.message.SyncMessage;
import com.rms.possync.core.message.SyncMessageCodec;
import com.rms.possync.core.model.BroadcastResult;
import com.rms.possync.core.model.ConnectionState;
import com.rms.possync.core.model.ConnectionStatusChange;
import com.rms.possync.core.model.DetailedStatus;
import com.rms.possync.core.model.LanRole;
import com.rms.possync.core.model.RoleContext;
import com.rms.possync.core.model.SyncError;
import com.rms.possync.core.model.SyncPath;
import com.rms.possync.core.model.Transport;
import com.rms.possync.lan.LanChannel;
import com.rms.possync.lan.LanClientInfo;
import com.rms.possync.lan.LanClientStatus;
import com.rms.possync.lan.LanEventListener;
import com.rms.possync.lan.LanSetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Multi-path order/state sync for one device.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #initialize(String, SyncCallbacks)} derives the {@link RoleContext}, connects the
 *       cloud channel and takes exactly one LAN role (host, dependent, or none).</li>
 *   <li>{@link #shutdown()} closes the cloud socket cleanly, cancels every timer, tells the LAN
 *       collaborator to stop or disconnect, and clears dedup state, tenant and callbacks before it
 *       returns.</li>
 *   <li>The instance may be initialized again after a shutdown.</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * Transport events arrive on I/O threads and timers fire on the injected {@link Scheduler}. All
 * of it is serialized on one monitor owned by this instance, which the {@link CloudChannelManager}
 * shares. Results from a LAN setup that belongs to an earlier initialization are discarded.
 *
 * <h2>Subscribers</h2>
 * One {@link SyncCallbacks} registry is active at a time. Any number of extra subscribers can use
 * {@link #messages()}, {@link #connectionChanges()} and {@link #errors()}.
 */
public class OrderSyncService implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(OrderSyncService.class);

    private final Object lock = new Object();

    private final OrderSyncProperties props;
    private final LanChannel lan;
    private final DedupCache dedup;
    private final SyncEventBus bus = new SyncEventBus();
    private final LanLink lanLink = new LanLink();
    private final CloudChannelManager cloud;
    private final MessageRouter router;
    private final SyncBroadcaster broadcaster;

    private String tenantId;
    private RoleContext role;
    private SyncCallbacks callbacks = SyncCallbacks.NONE;
    private long generation;
    private Disposable lanSetup;
    private Disposable lanSubscription;

    /**
     * @param lan LAN collaborator, or {@code null} on hosts without one (role is then {@code none})
     */
    public OrderSyncService(OrderSyncProperties props,
                            CloudTransport cloudTransport,
                            LanChannel lan,
                            Scheduler scheduler,
                            KitchenOrderStore store,
                            SyncMessageCodec codec,
                            ReconnectBackoff backoff) {
        this.props = Objects.requireNonNull(props, "props");
        this.lan = lan;
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(codec, "codec");

        OrderSyncProperties.Cloud c = props.getCloud();
        this.dedup = new DedupCache(scheduler, props.getDedup().getTtl());
        this.cloud = new CloudChannelManager(
                cloudTransport,
                c.getWsBase(),
                scheduler,
                backoff,
                c.getHeartbeatInterval(),
                codec.encode(new SyncMessage.Ping()),
                c.getSendPollInterval(),
                c.getSendPolls(),
                lock,
                new CloudEvents());
        this.router = new MessageRouter(codec, dedup, store, this::currentCallbacks, bus);
        this.broadcaster = new SyncBroadcaster(cloud, lan, lanLink, codec, dedup, scheduler);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    public void initialize(String tenantId, SyncCallbacks callbacks) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        synchronized (lock) {
            if (this.tenantId != null) {
                log.warn("Re-initializing order sync; shutting down tenant={} first", mask(this.tenantId));
                shutdown();
            }
            generation++;
            this.tenantId = tenantId;
            this.callbacks = callbacks == null ? SyncCallbacks.NONE : callbacks;
            this.role = RoleContext.derive(tenantId, props.getDeviceMode(), lan != null);
            lanLink.role(role.lanRole());

            log.info("Initializing order sync tenant={} mode={} lanRole={}",
                    mask(tenantId), role.deviceMode(), role.lanRole());

            cloud.setTenant(tenantId);
            cloud.connect();
            startLan(generation);
        }
    }

    public void shutdown() {
        synchronized (lock) {
            generation++;
            RoleContext previous = role;
            // callbacks go first so teardown transitions reach stream subscribers only
            callbacks = SyncCallbacks.NONE;

            cloud.disconnect();
            cloud.setTenant(null);

            dispose(lanSetup);
            dispose(lanSubscription);
            lanSetup = null;
            lanSubscription = null;
            if (previous != null && lan != null) {
                stopLan(previous.lanRole());
            }
            setLanState(ConnectionState.disconnected);
            lanLink.reset();

            dedup.clear();
            tenantId = null;
            role = null;
            log.info("Order sync shut down");
        }
    }

    @Override
    public void destroy() {
        shutdown();
        bus.complete();
    }

    public boolean isInitialized() {
        synchronized (lock) {
            return tenantId != null;
        }
    }

    public Optional<RoleContext> roleContext() {
        synchronized (lock) {
            return Optional.ofNullable(role);
        }
    }

    /** Manual cloud connect; also cancels a pending reconnect timer. */
    public void connectCloud() {
        cloud.connect();
    }

    // -------------------------------------------------------------------------
    // Broadcast API
    // -------------------------------------------------------------------------

    public Mono<BroadcastResult> broadcastOrder(JsonNode order, JsonNode kitchenOrder) {
        return broadcaster.broadcastOrder(order, kitchenOrder);
    }

    public Mono<BroadcastResult> broadcastStatusUpdate(String orderId, String status, String orderNumber,
                                                       Integer tableNumber, String orderType) {
        return broadcaster.broadcastStatusUpdate(orderId, status, orderNumber, tableNumber, orderType);
    }

    public Mono<BroadcastResult> broadcastItemStatusUpdate(String orderId, String itemId, String status,
                                                           String orderNumber, Integer tableNumber, String itemName) {
        return broadcaster.broadcastItemStatusUpdate(orderId, itemId, status, orderNumber, tableNumber, itemName);
    }

    public Mono<BroadcastResult> broadcastStaffSync(List<JsonNode> staff) {
        return broadcaster.broadcastStaffSync(staff);
    }

    public Mono<BroadcastResult> broadcastStaffAdded(JsonNode staff) {
        return broadcaster.broadcastStaffAdded(staff);
    }

    public Mono<BroadcastResult> broadcastStaffUpdated(String staffId, JsonNode updates) {
        return broadcaster.broadcastStaffUpdated(staffId, updates);
    }

    public Mono<BroadcastResult> broadcastStaffRemoved(String staffId) {
        return broadcaster.broadcastStaffRemoved(staffId);
    }

    public Mono<BroadcastResult> broadcastFloorPlanSync(List<JsonNode> sections, List<JsonNode> tables,
                                                        List<JsonNode> assignments) {
        return broadcaster.broadcastFloorPlanSync(sections, tables, assignments);
    }

    public Mono<BroadcastResult> broadcastSectionAdded(JsonNode section) {
        return broadcaster.broadcastSectionAdded(section);
    }

    public Mono<BroadcastResult> broadcastSectionRemoved(String sectionId) {
        return broadcaster.broadcastSectionRemoved(sectionId);
    }

    public Mono<BroadcastResult> broadcastTableAdded(JsonNode table) {
        return broadcaster.broadcastTableAdded(table);
    }

    public Mono<BroadcastResult> broadcastTableRemoved(String tableId) {
        return broadcaster.broadcastTableRemoved(tableId);
    }

    public Mono<BroadcastResult> broadcastTableStatusUpdated(String tableId, String status) {
        return broadcaster.broadcastTableStatusUpdated(tableId, status);
    }

    public Mono<BroadcastResult> broadcastStaffAssigned(JsonNode assignment) {
        return broadcaster.broadcastStaffAssigned(assignment);
    }

    public Mono<BroadcastResult> broadcastServiceRequest(JsonNode request) {
        return broadcaster.broadcastServiceRequest(request);
    }

    public Mono<BroadcastResult> broadcastServiceRequestAcknowledged(String requestId, String staffId,
                                                                     String staffName) {
        return broadcaster.broadcastServiceRequestAcknowledged(requestId, staffId, staffName);
    }

    public Mono<BroadcastResult> broadcastServiceRequestResolved(String requestId) {
        return broadcaster.broadcastServiceRequestResolved(requestId);
    }

    public Mono<BroadcastResult> broadcastItemReady(String orderId, String itemId, String itemName,
                                                    String orderNumber, Integer tableNumber, String assignedStaffId) {
        return broadcaster.broadcastItemReady(orderId, itemId, itemName, orderNumber, tableNumber, assignedStaffId);
    }

    public Mono<BroadcastResult> requestSync() {
        return broadcaster.requestSync();
    }

    // -------------------------------------------------------------------------
    // Status
    // -------------------------------------------------------------------------

    public ConnectionState getConnectionStatus() {
        synchronized (lock) {
            return StatusAggregator.aggregate(cloud.state(), lanLink.state());
        }
    }

    public SyncPath getActiveSyncPath() {
        synchronized (lock) {
            return StatusAggregator.activePath(cloud.state(), lanLink.state());
        }
    }

    public DetailedStatus getDetailedStatus() {
        synchronized (lock) {
            ConnectionState c = cloud.state();
            DetailedStatus.Lan l = lanLink.snapshot();
            return new DetailedStatus(
                    new DetailedStatus.Cloud(c, cloud.reconnectAttempts(), cloud.reconnectPending()),
                    l,
                    StatusAggregator.activePath(c, l.status()));
        }
    }

    public boolean isCloudConnected() {
        return cloud.state() == ConnectionState.connected;
    }

    public boolean isLanConnected() {
        return lanLink.state() == ConnectionState.connected;
    }

    // -------------------------------------------------------------------------
    // Subscriptions
    // -------------------------------------------------------------------------

    public Flux<SyncMessage> messages() {
        return bus.messages();
    }

    public <T extends SyncMessage> Flux<T> messages(Class<T> kind) {
        return bus.messages(kind);
    }

    public Flux<ConnectionStatusChange> connectionChanges() {
        return bus.statusChanges();
    }

    public Flux<SyncError> errors() {
        return bus.errors();
    }

    // -------------------------------------------------------------------------
    // LAN role (caller holds lock)
    // -------------------------------------------------------------------------

    private void startLan(long gen) {
        if (role.lanRole() == LanRole.none) {
            log.info("LAN sync not available on this host; cloud only");
            return;
        }
        lanSubscription = lan.subscribe(new LanEvents(gen));
        setLanState(ConnectionState.connecting);

        String tenant = role.tenantId();
        if (role.isServer()) {
            log.info("Starting LAN server tenant={}", mask(tenant));
            lanSetup = Mono.defer(() -> lan.startServer(tenant))
                    .switchIfEmpty(Mono.error(new LanSetupException("LAN server reported no address")))
                    .subscribe(
                            address -> onLanServerStarted(gen, address),
                            err -> onLanSetupFailed(gen, err, "LAN server failed to start"));
        } else {
            log.info("Connecting to LAN host deviceType={}", role.lanDeviceType());
            lanSetup = Mono.defer(() -> lan.connectAsClient(role.lanDeviceType(), tenant))
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .subscribe(
                            status -> onLanClientResult(gen, status),
                            err -> onLanSetupFailed(gen, err, "LAN connection failed"));
        }
    }

    private void stopLan(LanRole previousRole) {
        Mono<Void> stop = switch (previousRole) {
            case server -> Mono.defer(lan::stopServer);
            case client -> Mono.defer(lan::disconnect);
            case none -> Mono.empty();
        };
        stop.subscribe(
                v -> { },
                err -> log.warn("LAN teardown failed role={} err={}", previousRole, err.toString()));
    }

    private void onLanServerStarted(long gen, String address) {
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            log.info("LAN server started address={}", address);
            lanLink.serverRunning(true);
            setLanState(ConnectionState.connected);
        }
    }

    private void onLanClientResult(long gen, Optional<LanClientStatus> status) {
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            if (status.isPresent() && status.get().connected()) {
                log.info("Connected to LAN host address={}", status.get().serverAddress());
                setLanState(ConnectionState.connected);
            } else {
                log.info("No LAN host found; continuing on cloud only");
                setLanState(ConnectionState.disconnected);
                raiseError(new LanSetupException("No LAN host found"), Transport.lan);
            }
        }
    }

    private void onLanSetupFailed(long gen, Throwable err, String what) {
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            log.error("{} err={}", what, err.toString());
            setLanState(ConnectionState.disconnected);
            raiseError(err instanceof LanSetupException ? err : new LanSetupException(what, err), Transport.lan);
        }
    }

    private void setLanState(ConnectionState next) {
        if (lanLink.state(next)) {
            notifyStatus();
        }
    }

    // -------------------------------------------------------------------------
    // Notification (caller holds lock)
    // -------------------------------------------------------------------------

    private void notifyStatus() {
        ConnectionStatusChange change = StatusAggregator.snapshot(cloud.state(), lanLink.state());
        log.info("Connection status={} path={}", change.status(), change.activePath());
        invoke("onConnectionChange", cb -> cb.onConnectionChange(change.status(), change.activePath()));
        bus.publishStatus(change);
    }

    private void raiseError(Throwable error, Transport transport) {
        invoke("onError", cb -> cb.onError(error, transport));
        bus.publishError(new SyncError(transport, error));
    }

    private void invoke(String handler, Consumer<SyncCallbacks> call) {
        try {
            call.accept(callbacks);
        } catch (RuntimeException e) {
            log.warn("Callback {} failed err={}", handler, e.toString(), e);
        }
    }

    private SyncCallbacks currentCallbacks() {
        synchronized (lock) {
            return callbacks;
        }
    }

    private static void dispose(Disposable d) {
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
    }

    /**
     * Masks an identifier for INFO logs: keeps first and last character.
     */
    static String mask(String v) {
        if (v == null) {
            return "";
        }
        if (v.length() <= 2) {
            return "***";
        }
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }

    // -------------------------------------------------------------------------
    // Transport listeners
    // -------------------------------------------------------------------------

    private final class CloudEvents implements CloudChannelManager.Listener {

        @Override
        public void onStateChange(ConnectionState state) {
            notifyStatus();
        }

        @Override
        public void onOpened() {
            // catch up from peers right away
            broadcaster.requestSync().subscribe(
                    r -> log.debug("Sync requested on connect cloud={}", r.cloud()),
                    err -> log.warn("Sync request on connect failed err={}", err.toString()));
        }

        @Override
        public void onFrame(String frame) {
            router.routeFrame(frame, Transport.cloud);
        }

        @Override
        public void onError(Throwable error) {
            raiseError(error, Transport.cloud);
        }
    }

    /**
     * LAN collaborator events for one initialization; stale once {@link #generation} moves on.
     */
    private final class LanEvents implements LanEventListener {

        private final long gen;

        LanEvents(long gen) {
            this.gen = gen;
        }

        @Override
        public void onOrderCreated(JsonNode order, JsonNode kitchenOrder) {
            synchronized (lock) {
                if (live()) {
                    router.route(new SyncMessage.OrderCreated(order, kitchenOrder), Transport.lan);
                }
            }
        }

        @Override
        public void onOrderStatusUpdate(String orderId, String status) {
            synchronized (lock) {
                if (live()) {
                    router.route(new SyncMessage.OrderStatusUpdate(orderId, status, null, null, null), Transport.lan);
                }
            }
        }

        @Override
        public void onSyncState(List<JsonNode> activeOrders) {
            synchronized (lock) {
                if (live()) {
                    router.route(new SyncMessage.SyncState(activeOrders), Transport.lan);
                }
            }
        }

        @Override
        public void onConnected() {
            synchronized (lock) {
                if (live()) {
                    log.info("LAN link up");
                    setLanState(ConnectionState.connected);
                }
            }
        }

        @Override
        public void onDisconnected() {
            synchronized (lock) {
                if (live()) {
                    log.info("LAN link down");
                    setLanState(ConnectionState.disconnected);
                }
            }
        }

        @Override
        public void onClientConnected(LanClientInfo client) {
            synchronized (lock) {
                if (live()) {
                    int n = lanLink.clientConnected();
                    log.info("LAN client connected deviceType={} clients={}",
                            client == null ? null : client.deviceType(), n);
                }
            }
        }

        @Override
        public void onClientDisconnected(String clientId) {
            synchronized (lock) {
                if (live()) {
                    int n = lanLink.clientDisconnected();
                    log.info("LAN client disconnected clientId={} clients={}", clientId, n);
                }
            }
        }

        private boolean live() {
            return gen == generation;
        }
    }
}
