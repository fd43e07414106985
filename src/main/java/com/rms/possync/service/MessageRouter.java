package com.rms.possync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.possync.core.callback.KitchenOrderStore;
import com.rms.possync.core.callback.SyncCallbacks;
import com.rms.possync.core.dedup.DedupCache;
import com.rms.possync.core.dedup.OrderIdentity;
import com.rms.possync.core.message.MalformedFrameException;
import com.rms.possync.core.message.SyncMessage;
import com.rms.possync.core.message.SyncMessageCodec;
import com.rms.possync.core.message.UnknownMessageTypeException;
import com.rms.possync.core.model.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Applies inbound messages from either transport.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Order-bearing messages ({@code order_created}, {@code qr_order_created}, snapshot orders)
 *       pass the {@link DedupCache} first; a seen id is logged and dropped no matter which transport
 *       delivered it first.</li>
 *   <li>Everything else is applied as-is. Those handlers set state rather than accumulate it.</li>
 *   <li>Unknown types, malformed frames and outbound-only kinds are logged and dropped.</li>
 *   <li>Store and callback failures are logged; nothing propagates to the transport.</li>
 * </ul>
 *
 * <p>Applied messages are also published on the {@link SyncEventBus}.</p>
 */
public class MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    static final String COMPLETED = "completed";

    private final SyncMessageCodec codec;
    private final DedupCache dedup;
    private final KitchenOrderStore store;
    private final Supplier<SyncCallbacks> callbacks;
    private final SyncEventBus bus;

    public MessageRouter(SyncMessageCodec codec, DedupCache dedup, KitchenOrderStore store,
                         Supplier<SyncCallbacks> callbacks, SyncEventBus bus) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.dedup = Objects.requireNonNull(dedup, "dedup");
        this.store = Objects.requireNonNull(store, "store");
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
        this.bus = Objects.requireNonNull(bus, "bus");
    }

    /**
     * Decodes and applies one raw frame.
     *
     * @return {@code true} if the frame was applied
     */
    public boolean routeFrame(String frame, Transport source) {
        SyncMessage message;
        try {
            message = codec.decode(frame);
        } catch (UnknownMessageTypeException e) {
            log.warn("Ignoring unknown message type={} source={}", e.getType(), source);
            return false;
        } catch (MalformedFrameException e) {
            log.warn("Dropping malformed frame source={} err={}", source, e.getMessage());
            return false;
        }
        return route(message, source);
    }

    /**
     * Applies an already decoded message.
     *
     * @return {@code true} if the message was applied, {@code false} if dropped
     */
    public boolean route(SyncMessage message, Transport source) {
        boolean applied;
        try {
            applied = message.accept(new Application(source));
        } catch (RuntimeException e) {
            log.error("Failed to apply message type={} source={} err={}",
                    message.messageType().wire(), source, e.toString(), e);
            return false;
        }
        if (applied) {
            bus.publishMessage(message);
        }
        return applied;
    }

    /**
     * Per-delivery visitor; carries the source transport for logging and snapshot policy.
     */
    private final class Application implements SyncMessage.Visitor<Boolean> {

        private final Transport source;

        Application(Transport source) {
            this.source = source;
        }

        @Override
        public Boolean visit(SyncMessage.OrderCreated m) {
            Optional<String> id = OrderIdentity.resolve(m.order(), m.kitchenOrder());
            if (!claim(id, "order_created")) {
                return false;
            }
            addToStore(m.kitchenOrder());
            invoke("onOrderCreated", cb -> cb.onOrderCreated(m.order(), m.kitchenOrder()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.QrOrderCreated m) {
            Optional<String> id = OrderIdentity.resolve(m.order(), m.kitchenOrder());
            if (!claim(id, "qr_order_created")) {
                return false;
            }
            addToStore(m.kitchenOrder());
            invoke("onQrOrderCreated", cb -> cb.onQrOrderCreated(m.order(), m.tableInfo(), m.kitchenOrder()));
            invoke("onOrderCreated", cb -> cb.onOrderCreated(m.order(), m.kitchenOrder()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.OrderStatusUpdate m) {
            if (m.orderId() == null || m.status() == null) {
                log.warn("Dropping order_status_update without orderId/status source={}", source);
                return false;
            }
            log.info("Order status update orderId={} status={} source={}", m.orderId(), m.status(), source);
            // TODO: concurrent updates from two devices resolve as last-write-observed; carry an updatedAt and compare before applying
            if (COMPLETED.equals(m.status())) {
                toStore(() -> store.moveToCompleted(m.orderId()));
            } else {
                toStore(() -> store.updateOrderStatus(m.orderId(), m.status()));
            }
            invoke("onOrderStatusUpdate", cb -> cb.onOrderStatusUpdate(m.orderId(), m.status(), m));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.ItemStatusUpdate m) {
            if (m.orderId() == null || m.itemId() == null) {
                log.warn("Dropping item_status_update without orderId/itemId source={}", source);
                return false;
            }
            toStore(() -> store.updateItemStatus(m.orderId(), m.itemId(), m.status()));
            invoke("onItemStatusUpdate", cb -> cb.onItemStatusUpdate(m));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.SyncState m) {
            List<JsonNode> orders = m.activeOrders();
            log.info("Sync state received orders={} source={}", orders.size(), source);
            if (source == Transport.cloud) {
                // authoritative snapshot: replace, then remember every id so relays are suppressed
                toStore(() -> store.setActiveOrders(orders));
                orders.forEach(o -> OrderIdentity.ofKitchenOrder(o).ifPresent(dedup::markIfAbsent));
                invoke("onSyncState", cb -> cb.onSyncState(orders));
                return true;
            }
            List<JsonNode> fresh = new ArrayList<>();
            for (JsonNode o : orders) {
                Optional<String> id = OrderIdentity.ofKitchenOrder(o);
                if (id.isPresent() && dedup.markIfAbsent(id.get())) {
                    addToStore(o);
                    fresh.add(o);
                }
            }
            if (!fresh.isEmpty()) {
                invoke("onSyncState", cb -> cb.onSyncState(fresh));
            }
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.StaffSync m) {
            invoke("onStaffSync", cb -> cb.onStaffSync(m.staff()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.StaffAdded m) {
            if (m.staff() == null) {
                return false;
            }
            invoke("onStaffAdded", cb -> cb.onStaffAdded(m.staff()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.StaffUpdated m) {
            invoke("onStaffUpdated", cb -> cb.onStaffUpdated(m.staffId(), m.updates()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.StaffRemoved m) {
            invoke("onStaffRemoved", cb -> cb.onStaffRemoved(m.staffId()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.FloorPlanSync m) {
            invoke("onFloorPlanSync", cb -> cb.onFloorPlanSync(m.sections(), m.tables(), m.assignments()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.SectionAdded m) {
            if (m.section() == null) {
                return false;
            }
            invoke("onSectionAdded", cb -> cb.onSectionAdded(m.section()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.SectionRemoved m) {
            invoke("onSectionRemoved", cb -> cb.onSectionRemoved(m.sectionId()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.TableAdded m) {
            if (m.table() == null) {
                return false;
            }
            invoke("onTableAdded", cb -> cb.onTableAdded(m.table()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.TableRemoved m) {
            invoke("onTableRemoved", cb -> cb.onTableRemoved(m.tableId()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.TableStatusUpdated m) {
            invoke("onTableStatusUpdated", cb -> cb.onTableStatusUpdated(m.tableId(), m.status()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.StaffAssigned m) {
            if (m.assignment() == null) {
                return false;
            }
            invoke("onStaffAssigned", cb -> cb.onStaffAssigned(m.assignment()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.SyncRequested m) {
            log.info("Sync requested requester={} deviceType={}", m.requesterId(), m.deviceType());
            invoke("onSyncRequested", cb -> cb.onSyncRequested(m.requesterId(), m.deviceType()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.ServiceRequestRaised m) {
            if (m.request() == null) {
                return false;
            }
            invoke("onServiceRequest", cb -> cb.onServiceRequest(m.request()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.ServiceRequestAcknowledged m) {
            invoke("onServiceRequestAcknowledged",
                    cb -> cb.onServiceRequestAcknowledged(m.requestId(), m.staffId(), m.staffName()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.ServiceRequestResolved m) {
            invoke("onServiceRequestResolved", cb -> cb.onServiceRequestResolved(m.requestId()));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.ItemReady m) {
            invoke("onItemReady", cb -> cb.onItemReady(m));
            return true;
        }

        @Override
        public Boolean visit(SyncMessage.Pong m) {
            log.trace("Heartbeat pong source={}", source);
            return false;
        }

        @Override
        public Boolean visit(SyncMessage.BroadcastOrder m) {
            return outboundOnly(m);
        }

        @Override
        public Boolean visit(SyncMessage.StatusUpdate m) {
            return outboundOnly(m);
        }

        @Override
        public Boolean visit(SyncMessage.RequestSync m) {
            return outboundOnly(m);
        }

        @Override
        public Boolean visit(SyncMessage.Ping m) {
            return outboundOnly(m);
        }

        private boolean outboundOnly(SyncMessage m) {
            log.debug("Ignoring outbound-only message type={} source={}", m.messageType().wire(), source);
            return false;
        }

        private boolean claim(Optional<String> id, String kind) {
            if (id.isEmpty()) {
                log.debug("No order id on {} source={}; applying without dedup", kind, source);
                return true;
            }
            if (!dedup.markIfAbsent(id.get())) {
                log.info("Skipping duplicate {} id={} source={}", kind, id.get(), source);
                return false;
            }
            log.info("Applying {} id={} source={}", kind, id.get(), source);
            return true;
        }

        private void addToStore(JsonNode kitchenOrder) {
            if (kitchenOrder != null && kitchenOrder.isObject()) {
                toStore(() -> store.addOrder(kitchenOrder));
            }
        }
    }

    private void toStore(Runnable update) {
        try {
            update.run();
        } catch (RuntimeException e) {
            log.warn("Kitchen order store update failed err={}", e.toString(), e);
        }
    }

    private void invoke(String handler, Consumer<SyncCallbacks> call) {
        try {
            call.accept(callbacks.get());
        } catch (RuntimeException e) {
            log.warn("Callback {} failed err={}", handler, e.toString(), e);
        }
    }
}
