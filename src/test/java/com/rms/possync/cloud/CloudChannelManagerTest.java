package com.rms.possync.cloud;

import com.rms.possync.core.model.ConnectionState;
import com.rms.possync.support.FakeCloudTransport;
import com.rms.possync.support.FakeCloudTransport.FakeConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CloudChannelManagerTest {

    private static final String PING = "{\"type\":\"ping\"}";

    private final Object lock = new Object();
    private final List<ConnectionState> states = new ArrayList<>();
    private final List<Throwable> errors = new ArrayList<>();
    private final List<String> frames = new ArrayList<>();
    private int opened;

    private VirtualTimeScheduler vts;
    private FakeCloudTransport transport;
    private CloudChannelManager manager;

    @BeforeEach
    void setUp() {
        vts = VirtualTimeScheduler.create();
        transport = new FakeCloudTransport();
        manager = newManager(Duration.ofSeconds(30));
    }

    private CloudChannelManager newManager(Duration heartbeat) {
        ReconnectBackoff backoff = new ReconnectBackoff(ReconnectBackoff.DEFAULT_BASE, ReconnectBackoff.DEFAULT_MAX,
                ReconnectBackoff.DEFAULT_JITTER, ReconnectBackoff.DEFAULT_MAX_ATTEMPTS, bound -> 0L);
        return new CloudChannelManager(transport, "wss://sync.example.com", vts, backoff, heartbeat, PING,
                CloudChannelManager.DEFAULT_SEND_POLL_INTERVAL, CloudChannelManager.DEFAULT_SEND_POLLS, lock,
                new CloudChannelManager.Listener() {
                    @Override
                    public void onStateChange(ConnectionState state) {
                        states.add(state);
                    }

                    @Override
                    public void onOpened() {
                        opened++;
                    }

                    @Override
                    public void onFrame(String frame) {
                        frames.add(frame);
                    }

                    @Override
                    public void onError(Throwable error) {
                        errors.add(error);
                    }
                });
    }

    @Test
    void endpointIsPerTenant() {
        assertThat(manager.endpointFor("rest 42").toString()).isEqualTo("wss://sync.example.com/ws/orders/rest%2042");
    }

    @Test
    void connectWithoutTenantDoesNothing() {
        manager.connect();

        assertThat(transport.openCount()).isZero();
        assertThat(manager.state()).isEqualTo(ConnectionState.disconnected);
    }

    @Test
    void openMovesToConnectedAndForwardsFrames() {
        manager.setTenant("t-1");
        manager.connect();
        assertThat(manager.state()).isEqualTo(ConnectionState.connecting);
        assertThat(transport.last().uri().getPath()).isEqualTo("/ws/orders/t-1");

        transport.last().accept();
        transport.last().deliver("{\"type\":\"pong\"}");

        assertThat(states).containsExactly(ConnectionState.connecting, ConnectionState.connected);
        assertThat(opened).isEqualTo(1);
        assertThat(manager.isOpen()).isTrue();
        assertThat(frames).containsExactly("{\"type\":\"pong\"}");
    }

    @Test
    void secondConnectWhileConnectingIsIgnored() {
        manager.setTenant("t-1");
        manager.connect();
        manager.connect();

        assertThat(transport.openCount()).isEqualTo(1);
    }

    @Test
    void stopsAfterTenReconnectTimers() {
        manager.setTenant("t-1");
        manager.connect();

        for (int close = 1; close <= 10; close++) {
            transport.last().drop(1006);
            assertThat(manager.reconnectPending()).as("timer after close %d", close).isTrue();
            vts.advanceTimeBy(Duration.ofSeconds(30));
            assertThat(transport.openCount()).isEqualTo(close + 1);
        }

        transport.last().drop(1006);

        assertThat(manager.reconnectPending()).isFalse();
        assertThat(manager.reconnectAttempts()).isEqualTo(10);
        vts.advanceTimeBy(Duration.ofMinutes(10));
        assertThat(transport.openCount()).isEqualTo(11);
        assertThat(manager.state()).isEqualTo(ConnectionState.disconnected);
    }

    @Test
    void reconnectDelaysGrowExponentially() {
        manager.setTenant("t-1");
        manager.connect();

        transport.last().drop(1006);
        vts.advanceTimeBy(Duration.ofMillis(999));
        assertThat(transport.openCount()).isEqualTo(1);
        vts.advanceTimeBy(Duration.ofMillis(1));
        assertThat(transport.openCount()).isEqualTo(2);

        transport.last().drop(1006);
        vts.advanceTimeBy(Duration.ofMillis(1999));
        assertThat(transport.openCount()).isEqualTo(2);
        vts.advanceTimeBy(Duration.ofMillis(1));
        assertThat(transport.openCount()).isEqualTo(3);
    }

    @Test
    void successfulOpenResetsTheAttemptCounter() {
        manager.setTenant("t-1");
        manager.connect();
        transport.last().drop(1006);
        vts.advanceTimeBy(Duration.ofSeconds(1));
        transport.last().drop(1006);
        vts.advanceTimeBy(Duration.ofSeconds(2));
        assertThat(manager.reconnectAttempts()).isEqualTo(2);

        transport.last().accept();

        assertThat(manager.reconnectAttempts()).isZero();
    }

    @Test
    void manualConnectCancelsPendingTimer() {
        manager.setTenant("t-1");
        manager.connect();
        transport.last().drop(1006);
        assertThat(manager.reconnectPending()).isTrue();

        manager.connect();

        assertThat(manager.reconnectPending()).isFalse();
        assertThat(transport.openCount()).isEqualTo(2);
        vts.advanceTimeBy(Duration.ofMinutes(1));
        assertThat(transport.openCount()).isEqualTo(2);
    }

    @Test
    void preemptedRetryStillCountsTowardsTheBackoff() {
        manager.setTenant("t-1");
        manager.connect();
        transport.last().drop(1006);

        manager.connect();
        assertThat(manager.reconnectAttempts()).isEqualTo(1);

        transport.last().drop(1006);
        vts.advanceTimeBy(Duration.ofMillis(1_999));
        assertThat(transport.openCount()).isEqualTo(2);
        vts.advanceTimeBy(Duration.ofMillis(1));
        assertThat(transport.openCount()).isEqualTo(3);
        assertThat(manager.reconnectAttempts()).isEqualTo(2);
    }

    @Test
    void disconnectResolvesPendingSendWaitWithoutFurtherPolls() {
        manager.setTenant("t-1");
        manager.connect();
        transport.last().drop(1006);

        AtomicReference<Boolean> open = new AtomicReference<>();
        manager.ensureOpen().subscribe(open::set);
        vts.advanceTimeBy(Duration.ofMillis(200));
        assertThat(open.get()).isNull();

        manager.disconnect();

        assertThat(open.get()).isFalse();
        vts.advanceTimeBy(Duration.ofMinutes(5));
        assertThat(transport.openCount()).isEqualTo(2);
        assertThat(manager.state()).isEqualTo(ConnectionState.disconnected);
    }

    @Test
    void sendWaitStartedAfterDisconnectStillWorks() {
        manager.setTenant("t-1");
        manager.connect();
        manager.disconnect();
        manager.connect();

        AtomicReference<Boolean> open = new AtomicReference<>();
        manager.ensureOpen().subscribe(open::set);
        transport.last().accept();
        vts.advanceTimeBy(Duration.ofMillis(500));

        assertThat(open.get()).isTrue();
    }

    @Test
    void failedOpenIsReportedAndRetried() {
        manager.setTenant("t-1");
        transport.failOpensWith(new IllegalStateException("dns failure"));

        manager.connect();

        assertThat(errors).singleElement().isInstanceOf(CloudChannelException.class);
        assertThat(manager.state()).isEqualTo(ConnectionState.disconnected);
        assertThat(manager.reconnectPending()).isTrue();
    }

    @Test
    void socketErrorIsInformationalUntilClose() {
        manager.setTenant("t-1");
        manager.connect();
        transport.last().accept();

        transport.last().error(new RuntimeException("tls alert"));

        assertThat(errors).hasSize(1);
        assertThat(manager.state()).isEqualTo(ConnectionState.connected);
    }

    @Test
    void heartbeatPingsWhileOpen() {
        manager.setTenant("t-1");
        manager.connect();
        FakeConnection c = transport.last();
        c.accept();

        vts.advanceTimeBy(Duration.ofSeconds(29));
        assertThat(c.sent()).isEmpty();
        vts.advanceTimeBy(Duration.ofSeconds(31));

        assertThat(c.sent()).containsExactly(PING, PING);
    }

    @Test
    void heartbeatStopsOnClose() {
        manager.setTenant("t-1");
        manager.connect();
        FakeConnection c = transport.last();
        c.accept();
        c.drop(1006);

        vts.advanceTimeBy(Duration.ofSeconds(90));

        assertThat(c.sent()).isEmpty();
    }

    @Test
    void zeroHeartbeatIntervalDisablesPings() {
        CloudChannelManager quiet = newManager(Duration.ZERO);
        quiet.setTenant("t-1");
        quiet.connect();
        transport.last().accept();

        vts.advanceTimeBy(Duration.ofMinutes(5));

        assertThat(transport.last().sent()).isEmpty();
    }

    @Test
    void disconnectClosesCleanlyAndCancelsEverything() {
        manager.setTenant("t-1");
        manager.connect();
        FakeConnection c = transport.last();
        c.accept();

        manager.disconnect();

        assertThat(c.closeCode()).isEqualTo(CloudChannelManager.NORMAL_CLOSURE);
        assertThat(c.closeReason()).isEqualTo("Client shutdown");
        assertThat(manager.state()).isEqualTo(ConnectionState.disconnected);
        assertThat(manager.reconnectPending()).isFalse();
        vts.advanceTimeBy(Duration.ofMinutes(10));
        assertThat(transport.openCount()).isEqualTo(1);
        assertThat(c.sent()).isEmpty();
    }

    @Test
    void eventsFromSupersededSocketAreIgnored() {
        manager.setTenant("t-1");
        manager.connect();
        FakeConnection old = transport.last();
        manager.disconnect();

        old.accept();
        old.deliver("{\"type\":\"pong\"}");

        assertThat(manager.state()).isEqualTo(ConnectionState.disconnected);
        assertThat(frames).isEmpty();
        assertThat(opened).isZero();
    }

    @Test
    void sendRefusedWhenNotOpen() {
        manager.setTenant("t-1");
        manager.connect();

        assertThat(manager.send("{}")).isFalse();
    }

    @Test
    void ensureOpenGivesUpAfterSixPolls() {
        manager.setTenant("t-1");
        AtomicReference<Boolean> result = new AtomicReference<>();

        manager.ensureOpen().subscribe(result::set);
        assertThat(transport.openCount()).isEqualTo(1);

        vts.advanceTimeBy(Duration.ofMillis(2_999));
        assertThat(result.get()).isNull();
        vts.advanceTimeBy(Duration.ofMillis(1));

        assertThat(result.get()).isFalse();
        assertThat(transport.openCount()).isEqualTo(1);
    }

    @Test
    void ensureOpenResolvesOnTheFirstPollAfterOpen() {
        manager.setTenant("t-1");
        AtomicReference<Boolean> result = new AtomicReference<>();

        manager.ensureOpen().subscribe(result::set);
        vts.advanceTimeBy(Duration.ofMillis(1_200));
        transport.last().accept();
        assertThat(result.get()).isNull();
        vts.advanceTimeBy(Duration.ofMillis(300));

        assertThat(result.get()).isTrue();
    }

    @Test
    void ensureOpenWithoutTenantFailsFast() {
        AtomicReference<Boolean> result = new AtomicReference<>();

        manager.ensureOpen().subscribe(result::set);

        assertThat(result.get()).isFalse();
        assertThat(transport.openCount()).isZero();
    }
}
