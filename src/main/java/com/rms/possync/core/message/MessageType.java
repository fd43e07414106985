package com.rms.possync.core.message;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Wire vocabulary of {@link SyncMessage}.
 *
 * <p>The tokens are shared with the cloud room and every other device build, so they must not
 * be renamed. {@link #inbound} marks kinds this service expects to receive; the rest are only
 * ever sent.</p>
 */
public enum MessageType {

    ORDER_CREATED("order_created", SyncMessage.OrderCreated.class, true),
    BROADCAST_ORDER("broadcast_order", SyncMessage.BroadcastOrder.class, false),
    ORDER_STATUS_UPDATE("order_status_update", SyncMessage.OrderStatusUpdate.class, true),
    STATUS_UPDATE("status_update", SyncMessage.StatusUpdate.class, false),
    ITEM_STATUS_UPDATE("item_status_update", SyncMessage.ItemStatusUpdate.class, true),
    SYNC_STATE("sync_state", SyncMessage.SyncState.class, true),
    STAFF_SYNC("staff_sync", SyncMessage.StaffSync.class, true),
    STAFF_ADDED("staff_added", SyncMessage.StaffAdded.class, true),
    STAFF_UPDATED("staff_updated", SyncMessage.StaffUpdated.class, true),
    STAFF_REMOVED("staff_removed", SyncMessage.StaffRemoved.class, true),
    FLOORPLAN_SYNC("floorplan_sync", SyncMessage.FloorPlanSync.class, true),
    SECTION_ADDED("section_added", SyncMessage.SectionAdded.class, true),
    SECTION_REMOVED("section_removed", SyncMessage.SectionRemoved.class, true),
    TABLE_ADDED("table_added", SyncMessage.TableAdded.class, true),
    TABLE_REMOVED("table_removed", SyncMessage.TableRemoved.class, true),
    TABLE_STATUS_UPDATED("table_status_updated", SyncMessage.TableStatusUpdated.class, true),
    STAFF_ASSIGNED("staff_assigned", SyncMessage.StaffAssigned.class, true),
    SYNC_REQUESTED("sync_requested", SyncMessage.SyncRequested.class, true),
    REQUEST_SYNC("request_sync", SyncMessage.RequestSync.class, false),
    QR_ORDER_CREATED("qr_order_created", SyncMessage.QrOrderCreated.class, true),
    SERVICE_REQUEST("service_request", SyncMessage.ServiceRequestRaised.class, true),
    SERVICE_REQUEST_ACKNOWLEDGED("service_request_acknowledged", SyncMessage.ServiceRequestAcknowledged.class, true),
    SERVICE_REQUEST_RESOLVED("service_request_resolved", SyncMessage.ServiceRequestResolved.class, true),
    ITEM_READY("item_ready", SyncMessage.ItemReady.class, true),
    PING("ping", SyncMessage.Ping.class, false),
    PONG("pong", SyncMessage.Pong.class, true);

    private static final Map<String, MessageType> BY_WIRE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MessageType::wire, Function.identity()));

    private static final Map<Class<?>, MessageType> BY_CLASS = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MessageType::messageClass, Function.identity()));

    private final String wire;
    private final Class<? extends SyncMessage> messageClass;
    private final boolean inbound;

    MessageType(String wire, Class<? extends SyncMessage> messageClass, boolean inbound) {
        this.wire = wire;
        this.messageClass = messageClass;
        this.inbound = inbound;
    }

    public String wire() {
        return wire;
    }

    public Class<? extends SyncMessage> messageClass() {
        return messageClass;
    }

    public boolean inbound() {
        return inbound;
    }

    public static Optional<MessageType> fromWire(String wire) {
        return Optional.ofNullable(wire).map(BY_WIRE::get);
    }

    public static MessageType of(SyncMessage message) {
        MessageType t = BY_CLASS.get(message.getClass());
        if (t == null) {
            throw new IllegalStateException("No wire type registered for " + message.getClass().getName());
        }
        return t;
    }
}
