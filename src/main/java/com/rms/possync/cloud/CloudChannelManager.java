package com.rms.possync.cloud;

import com.rms.possync.core.model.ConnectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Owns the single per-tenant cloud socket and its connect / retry / heartbeat state machine.
 *
 * <h2>State machine</h2>
 * <pre>
 *   disconnected ──connect()──▶ connecting ──open──▶ connected
 *        ▲                          │                    │
 *        └──────────close───────────┴────────close───────┘
 * </pre>
 * <ul>
 *   <li>{@link #connect()} is a no-op without a tenant or when already connecting/connected.</li>
 *   <li>On open the attempt counter resets to 0, the heartbeat starts and the owner is told to
 *       request a catch-up sync.</li>
 *   <li>On error an informational error is raised; the close that follows drives the transition.</li>
 *   <li>On close a reconnect is scheduled with {@link ReconnectBackoff} until the attempt budget
 *       is spent. Running out is not fatal.</li>
 *   <li>Events from a superseded socket (closed by {@link #disconnect()} or replaced by a newer
 *       attempt) are ignored.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Every mutation happens under the owner's {@code lock}; listener calls are made while holding it.
 * All timers (reconnect, heartbeat, send polls) run on the injected {@link Scheduler}.
 */
public class CloudChannelManager {

    private static final Logger log = LoggerFactory.getLogger(CloudChannelManager.class);

    public static final int NORMAL_CLOSURE = 1000;
    public static final String SHUTDOWN_REASON = "Client shutdown";

    public static final Duration DEFAULT_SEND_POLL_INTERVAL = Duration.ofMillis(500);
    public static final int DEFAULT_SEND_POLLS = 6;

    /**
     * Callbacks into the owning service.
     */
    public interface Listener {

        void onStateChange(ConnectionState state);

        /** Socket is open and the state is already {@code connected}. */
        void onOpened();

        void onFrame(String frame);

        void onError(Throwable error);
    }

    private final CloudTransport transport;
    private final String wsBase;
    private final Scheduler scheduler;
    private final ReconnectBackoff backoff;
    private final Duration heartbeatInterval;
    private final String heartbeatFrame;
    private final Duration sendPollInterval;
    private final int sendPolls;
    private final Object lock;
    private final Listener listener;

    private String tenantId;
    private ConnectionState state = ConnectionState.disconnected;
    private Attempt current;
    private int reconnectAttempts;
    private Disposable reconnectTimer;
    private Disposable heartbeat;
    private Sinks.One<Boolean> session = Sinks.one();

    public CloudChannelManager(CloudTransport transport,
                               String wsBase,
                               Scheduler scheduler,
                               ReconnectBackoff backoff,
                               Duration heartbeatInterval,
                               String heartbeatFrame,
                               Duration sendPollInterval,
                               int sendPolls,
                               Object lock,
                               Listener listener) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.wsBase = Objects.requireNonNull(wsBase, "wsBase");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.heartbeatInterval = heartbeatInterval == null ? Duration.ZERO : heartbeatInterval;
        this.heartbeatFrame = heartbeatFrame;
        this.sendPollInterval = Objects.requireNonNull(sendPollInterval, "sendPollInterval");
        this.sendPolls = sendPolls;
        this.lock = Objects.requireNonNull(lock, "lock");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public void setTenant(String tenantId) {
        synchronized (lock) {
            this.tenantId = tenantId;
        }
    }

    public URI endpointFor(String tenant) {
        return UriComponentsBuilder.fromUriString(wsBase)
                .path("/ws/orders/{tenantId}")
                .buildAndExpand(tenant)
                .encode()
                .toUri();
    }

    public void connect() {
        synchronized (lock) {
            if (tenantId == null) {
                log.debug("Cloud connect skipped: no tenant");
                return;
            }
            if (state != ConnectionState.disconnected) {
                return;
            }
            if (reconnectTimer != null) {
                // a pre-empted retry still counts towards the budget
                reconnectAttempts++;
            }
            cancelReconnect();

            URI uri = endpointFor(tenantId);
            Attempt attempt = new Attempt();
            current = attempt;
            setState(ConnectionState.connecting);
            log.info("Cloud connecting uri={} attempt={}", uri, reconnectAttempts);
            try {
                attempt.connection = transport.open(uri, attempt);
            } catch (RuntimeException e) {
                log.error("Cloud connect failed uri={} err={}", uri, e.toString());
                current = null;
                listener.onError(new CloudChannelException("Cloud WebSocket connect failed", e));
                setState(ConnectionState.disconnected);
                scheduleReconnect();
            }
        }
    }

    /**
     * Clean close: cancels every timer, closes the socket with {@value #NORMAL_CLOSURE}
     * "{@value #SHUTDOWN_REASON}" and resets the attempt counter. Pending {@link #ensureOpen()}
     * polls resolve {@code false} at once.
     */
    public void disconnect() {
        synchronized (lock) {
            cancelReconnect();
            stopHeartbeat();
            Sinks.One<Boolean> ended = session;
            session = Sinks.one();
            ended.tryEmitValue(Boolean.TRUE);
            Attempt attempt = current;
            current = null;
            if (attempt != null && attempt.connection != null) {
                try {
                    attempt.connection.close(NORMAL_CLOSURE, SHUTDOWN_REASON);
                } catch (RuntimeException e) {
                    log.debug("Cloud close failed (socket already gone): {}", e.toString());
                }
            }
            reconnectAttempts = 0;
            setState(ConnectionState.disconnected);
        }
    }

    public boolean isOpen() {
        synchronized (lock) {
            Attempt a = current;
            return state == ConnectionState.connected && a != null && a.connection != null && a.connection.isOpen();
        }
    }

    /**
     * Sends one frame if the socket is open right now.
     */
    public boolean send(String frame) {
        synchronized (lock) {
            if (!isOpen()) {
                return false;
            }
            try {
                return current.connection.send(frame);
            } catch (RuntimeException e) {
                log.warn("Cloud send failed err={}", e.toString());
                return false;
            }
        }
    }

    /**
     * Resolves {@code true} once the socket is open. If it is not open on subscription, calls
     * {@link #connect()} and polls at the send-poll interval up to the poll budget, then resolves
     * {@code false}. A {@link #disconnect()} while polling also resolves {@code false}, so a frame
     * queued for one tenant never reaches the socket of the next. Never errors.
     */
    public Mono<Boolean> ensureOpen() {
        return Mono.defer(() -> {
            if (isOpen()) {
                return Mono.just(true);
            }
            Sinks.One<Boolean> owner;
            synchronized (lock) {
                if (tenantId == null) {
                    return Mono.just(false);
                }
                owner = session;
            }
            connect();
            return Flux.interval(sendPollInterval, scheduler)
                    .take(sendPolls)
                    .takeUntilOther(owner.asMono())
                    .map(tick -> isOpen())
                    .takeUntil(Boolean::booleanValue)
                    .last(false);
        });
    }

    public ConnectionState state() {
        synchronized (lock) {
            return state;
        }
    }

    public int reconnectAttempts() {
        synchronized (lock) {
            return reconnectAttempts;
        }
    }

    public boolean reconnectPending() {
        synchronized (lock) {
            return reconnectTimer != null && !reconnectTimer.isDisposed();
        }
    }

    // -------------------------------------------------------------------------
    // Internals (caller holds lock)
    // -------------------------------------------------------------------------

    private void setState(ConnectionState next) {
        if (state == next) {
            return;
        }
        state = next;
        listener.onStateChange(next);
    }

    private void scheduleReconnect() {
        if (tenantId == null) {
            return;
        }
        if (backoff.exhausted(reconnectAttempts)) {
            log.warn("Cloud reconnect attempts exhausted attempts={}; continuing without cloud", reconnectAttempts);
            return;
        }
        Duration delay = backoff.delayFor(reconnectAttempts);
        log.info("Cloud reconnect scheduled attempt={} delayMs={}", reconnectAttempts + 1, delay.toMillis());
        reconnectTimer = scheduler.schedule(this::fireReconnect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void fireReconnect() {
        synchronized (lock) {
            if (reconnectTimer == null) {
                return;
            }
            reconnectTimer = null;
            reconnectAttempts++;
            connect();
        }
    }

    private void cancelReconnect() {
        if (reconnectTimer != null) {
            reconnectTimer.dispose();
            reconnectTimer = null;
        }
    }

    private void startHeartbeat() {
        stopHeartbeat();
        if (heartbeatFrame == null || heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            return;
        }
        long periodMs = heartbeatInterval.toMillis();
        heartbeat = scheduler.schedulePeriodically(() -> {
            if (!send(heartbeatFrame)) {
                log.debug("Heartbeat skipped: cloud not open");
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    private void stopHeartbeat() {
        if (heartbeat != null) {
            heartbeat.dispose();
            heartbeat = null;
        }
    }

    /**
     * Listener bound to one socket; drops events once it is no longer {@link #current}.
     */
    private final class Attempt implements CloudConnection.Listener {

        private CloudConnection connection;

        @Override
        public void onOpen() {
            synchronized (lock) {
                if (current != this) {
                    return;
                }
                reconnectAttempts = 0;
                setState(ConnectionState.connected);
                log.info("Cloud connected tenant={}", tenantId);
                startHeartbeat();
                listener.onOpened();
            }
        }

        @Override
        public void onMessage(String frame) {
            synchronized (lock) {
                if (current != this) {
                    return;
                }
                listener.onFrame(frame);
            }
        }

        @Override
        public void onError(Throwable error) {
            synchronized (lock) {
                if (current != this) {
                    return;
                }
                log.warn("Cloud socket error err={}", String.valueOf(error));
                listener.onError(new CloudChannelException("Cloud WebSocket error", error));
            }
        }

        @Override
        public void onClose(int code, String reason) {
            synchronized (lock) {
                if (current != this) {
                    return;
                }
                current = null;
                stopHeartbeat();
                log.info("Cloud disconnected code={} reason={}", code, reason);
                setState(ConnectionState.disconnected);
                scheduleReconnect();
            }
        }
    }
}
