package com.rms.possync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.possync.cloud.CloudChannelManager;
import com.rms.possync.core.dedup.DedupCache;
import com.rms.possync.core.dedup.OrderIdentity;
import com.rms.possync.core.message.SyncMessage;
import com.rms.possync.core.message.SyncMessageCodec;
import com.rms.possync.core.model.BroadcastResult;
import com.rms.possync.lan.LanChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Outbound operations. Each one serializes a domain event and sends it on the transports its
 * kind is eligible for.
 *
 * <h2>Path policy</h2>
 * <ul>
 *   <li>Orders and order status: cloud, plus LAN when this device hosts the LAN server and has at
 *       least one client attached.</li>
 *   <li>Everything else: cloud only. {@code item_ready} over LAN is reserved.</li>
 * </ul>
 *
 * <h2>Failure semantics</h2>
 * <ul>
 *   <li>A closed cloud socket triggers one reconnect and a bounded poll (see
 *       {@link CloudChannelManager#ensureOpen()}); if it stays closed the frame is dropped, not queued.</li>
 *   <li>Returned {@link Mono}s never error. The {@link BroadcastResult} says what got through.</li>
 *   <li>Staff payloads are redacted by {@link StaffRedactor} before encoding.</li>
 * </ul>
 */
public class SyncBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(SyncBroadcaster.class);

    private final CloudChannelManager cloud;
    private final LanChannel lan;
    private final LanLink lanLink;
    private final SyncMessageCodec codec;
    private final DedupCache dedup;
    private final Scheduler clock;

    SyncBroadcaster(CloudChannelManager cloud, LanChannel lan, LanLink lanLink, SyncMessageCodec codec,
                    DedupCache dedup, Scheduler clock) {
        this.cloud = Objects.requireNonNull(cloud, "cloud");
        this.lan = lan;
        this.lanLink = Objects.requireNonNull(lanLink, "lanLink");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.dedup = Objects.requireNonNull(dedup, "dedup");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // -------------------------------------------------------------------------
    // Orders (cloud + LAN)
    // -------------------------------------------------------------------------

    public Mono<BroadcastResult> broadcastOrder(JsonNode order, JsonNode kitchenOrder) {
        return Mono.defer(() -> {
            // our own order must not be re-applied when a peer relays it back
            OrderIdentity.resolve(order, kitchenOrder).ifPresent(dedup::markIfAbsent);
            return sendCloud(new SyncMessage.BroadcastOrder(order, kitchenOrder))
                    .flatMap(cloudOk -> sendLan(() -> lan.broadcastOrder(order, kitchenOrder), "order")
                            .map(clients -> new BroadcastResult(cloudOk, clients)));
        });
    }

    public Mono<BroadcastResult> broadcastStatusUpdate(String orderId, String status, String orderNumber,
                                                       Integer tableNumber, String orderType) {
        return sendCloud(new SyncMessage.StatusUpdate(orderId, status, orderNumber, tableNumber, orderType))
                .flatMap(cloudOk -> sendLan(() -> lan.broadcastOrderStatus(orderId, status), "status")
                        .map(clients -> new BroadcastResult(cloudOk, clients)));
    }

    // -------------------------------------------------------------------------
    // Cloud-only kinds
    // -------------------------------------------------------------------------

    public Mono<BroadcastResult> broadcastItemStatusUpdate(String orderId, String itemId, String status,
                                                           String orderNumber, Integer tableNumber, String itemName) {
        return cloudOnly(new SyncMessage.ItemStatusUpdate(orderId, itemId, status, orderNumber, tableNumber, itemName));
    }

    public Mono<BroadcastResult> broadcastStaffSync(List<JsonNode> staff) {
        return Mono.defer(() -> cloudOnly(new SyncMessage.StaffSync(StaffRedactor.redactAll(staff), now())));
    }

    public Mono<BroadcastResult> broadcastStaffAdded(JsonNode staff) {
        return Mono.defer(() -> cloudOnly(new SyncMessage.StaffAdded(StaffRedactor.redact(staff))));
    }

    public Mono<BroadcastResult> broadcastStaffUpdated(String staffId, JsonNode updates) {
        return Mono.defer(() -> cloudOnly(new SyncMessage.StaffUpdated(staffId, StaffRedactor.redactUpdate(updates))));
    }

    public Mono<BroadcastResult> broadcastStaffRemoved(String staffId) {
        return cloudOnly(new SyncMessage.StaffRemoved(staffId));
    }

    public Mono<BroadcastResult> broadcastFloorPlanSync(List<JsonNode> sections, List<JsonNode> tables,
                                                        List<JsonNode> assignments) {
        return Mono.defer(() -> cloudOnly(new SyncMessage.FloorPlanSync(sections, tables, assignments, now())));
    }

    public Mono<BroadcastResult> broadcastSectionAdded(JsonNode section) {
        return cloudOnly(new SyncMessage.SectionAdded(section));
    }

    public Mono<BroadcastResult> broadcastSectionRemoved(String sectionId) {
        return cloudOnly(new SyncMessage.SectionRemoved(sectionId));
    }

    public Mono<BroadcastResult> broadcastTableAdded(JsonNode table) {
        return cloudOnly(new SyncMessage.TableAdded(table));
    }

    public Mono<BroadcastResult> broadcastTableRemoved(String tableId) {
        return cloudOnly(new SyncMessage.TableRemoved(tableId));
    }

    public Mono<BroadcastResult> broadcastTableStatusUpdated(String tableId, String status) {
        return cloudOnly(new SyncMessage.TableStatusUpdated(tableId, status));
    }

    public Mono<BroadcastResult> broadcastStaffAssigned(JsonNode assignment) {
        return cloudOnly(new SyncMessage.StaffAssigned(assignment));
    }

    public Mono<BroadcastResult> broadcastServiceRequest(JsonNode request) {
        return cloudOnly(new SyncMessage.ServiceRequestRaised(request));
    }

    public Mono<BroadcastResult> broadcastServiceRequestAcknowledged(String requestId, String staffId,
                                                                     String staffName) {
        return cloudOnly(new SyncMessage.ServiceRequestAcknowledged(requestId, staffId, staffName));
    }

    public Mono<BroadcastResult> broadcastServiceRequestResolved(String requestId) {
        return cloudOnly(new SyncMessage.ServiceRequestResolved(requestId));
    }

    public Mono<BroadcastResult> broadcastItemReady(String orderId, String itemId, String itemName,
                                                    String orderNumber, Integer tableNumber, String assignedStaffId) {
        return cloudOnly(new SyncMessage.ItemReady(orderId, itemId, itemName, orderNumber, tableNumber, assignedStaffId));
    }

    /** Pull: asks peers to send their state. */
    public Mono<BroadcastResult> requestSync() {
        return cloudOnly(new SyncMessage.RequestSync());
    }

    // -------------------------------------------------------------------------
    // Transport plumbing
    // -------------------------------------------------------------------------

    private Mono<BroadcastResult> cloudOnly(SyncMessage message) {
        return sendCloud(message).map(BroadcastResult::cloudOnly);
    }

    private Mono<Boolean> sendCloud(SyncMessage message) {
        String type = message.messageType().wire();
        String frame;
        try {
            frame = codec.encode(message);
        } catch (RuntimeException e) {
            log.error("Unable to encode outbound type={} err={}", type, e.toString(), e);
            return Mono.just(false);
        }
        return cloud.ensureOpen()
                .map(open -> {
                    if (!open) {
                        log.warn("Cloud not connected; dropped outbound type={}", type);
                        return false;
                    }
                    boolean sent = cloud.send(frame);
                    if (sent) {
                        log.debug("Sent type={} via cloud", type);
                    } else {
                        log.warn("Cloud send refused type={}", type);
                    }
                    return sent;
                })
                .onErrorResume(e -> {
                    log.warn("Cloud send failed type={} err={}", type, e.toString());
                    return Mono.just(false);
                });
    }

    private Mono<Integer> sendLan(Supplier<Mono<Integer>> call, String what) {
        if (lan == null || !lanLink.canBroadcast()) {
            return Mono.just(0);
        }
        return Mono.defer(call)
                .defaultIfEmpty(0)
                .doOnNext(n -> {
                    if (n > 0) {
                        log.info("LAN broadcast {} clients={}", what, n);
                    }
                })
                .onErrorResume(e -> {
                    log.warn("LAN broadcast {} failed err={}", what, e.toString());
                    return Mono.just(0);
                });
    }

    private Instant now() {
        return Instant.ofEpochMilli(clock.now(TimeUnit.MILLISECONDS));
    }
}
