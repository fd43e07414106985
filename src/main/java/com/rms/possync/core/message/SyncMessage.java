package com.rms.possync.core.message;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Closed set of frames exchanged over the sync transports.
 *
 * <h2>Wire form</h2>
 * <ul>
 *   <li>Every frame is a UTF-8 JSON object with a required {@code type} field.</li>
 *   <li>The {@code type} token of each record is declared in {@link MessageType}; the record
 *       components are the remaining top-level fields.</li>
 *   <li>Domain payloads this service does not own (orders, kitchen orders, staff, sections,
 *       tables, assignments, service requests) are carried as opaque {@link JsonNode} trees.</li>
 * </ul>
 *
 * <h2>Dispatch</h2>
 * Consumers implement {@link Visitor}. Adding a record means adding a visitor method, so every
 * dispatcher is forced to decide what to do with the new kind at compile time.
 */
public sealed interface SyncMessage {

    <R> R accept(Visitor<R> visitor);

    default MessageType messageType() {
        return MessageType.of(this);
    }

    /**
     * One method per message kind.
     */
    interface Visitor<R> {
        R visit(OrderCreated m);
        R visit(BroadcastOrder m);
        R visit(OrderStatusUpdate m);
        R visit(StatusUpdate m);
        R visit(ItemStatusUpdate m);
        R visit(SyncState m);
        R visit(StaffSync m);
        R visit(StaffAdded m);
        R visit(StaffUpdated m);
        R visit(StaffRemoved m);
        R visit(FloorPlanSync m);
        R visit(SectionAdded m);
        R visit(SectionRemoved m);
        R visit(TableAdded m);
        R visit(TableRemoved m);
        R visit(TableStatusUpdated m);
        R visit(StaffAssigned m);
        R visit(SyncRequested m);
        R visit(RequestSync m);
        R visit(QrOrderCreated m);
        R visit(ServiceRequestRaised m);
        R visit(ServiceRequestAcknowledged m);
        R visit(ServiceRequestResolved m);
        R visit(ItemReady m);
        R visit(Ping m);
        R visit(Pong m);
    }

    // ---------------------------------------------------------------------
    // Orders
    // ---------------------------------------------------------------------

    /** A new order announced by a peer. */
    record OrderCreated(JsonNode order, JsonNode kitchenOrder) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** Outbound form of {@link OrderCreated}; the cloud room relays it to peers. */
    record BroadcastOrder(JsonNode order, JsonNode kitchenOrder) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record OrderStatusUpdate(String orderId, String status, String orderNumber, Integer tableNumber,
                             String orderType) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** Outbound form of {@link OrderStatusUpdate}. */
    record StatusUpdate(String orderId, String status, String orderNumber, Integer tableNumber,
                        String orderType) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ItemStatusUpdate(String orderId, String itemId, String status, String orderNumber,
                            Integer tableNumber, String itemName) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** Snapshot of active orders, exchanged on (re)connect. */
    record SyncState(List<JsonNode> activeOrders) implements SyncMessage {
        public SyncState {
            activeOrders = activeOrders == null ? List.of() : List.copyOf(activeOrders);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ---------------------------------------------------------------------
    // Staff
    // ---------------------------------------------------------------------

    record StaffSync(List<JsonNode> staff, Instant timestamp) implements SyncMessage {
        public StaffSync {
            staff = staff == null ? List.of() : List.copyOf(staff);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record StaffAdded(JsonNode staff) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record StaffUpdated(String staffId, JsonNode updates) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record StaffRemoved(String staffId) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ---------------------------------------------------------------------
    // Floor plan
    // ---------------------------------------------------------------------

    record FloorPlanSync(List<JsonNode> sections, List<JsonNode> tables, List<JsonNode> assignments,
                         Instant timestamp) implements SyncMessage {
        public FloorPlanSync {
            sections = sections == null ? List.of() : List.copyOf(sections);
            tables = tables == null ? List.of() : List.copyOf(tables);
            assignments = assignments == null ? List.of() : List.copyOf(assignments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record SectionAdded(JsonNode section) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record SectionRemoved(String sectionId) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record TableAdded(JsonNode table) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record TableRemoved(String tableId) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record TableStatusUpdated(String tableId, String status) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record StaffAssigned(JsonNode assignment) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ---------------------------------------------------------------------
    // Sync control
    // ---------------------------------------------------------------------

    /** A peer asked for a catch-up. Relayed by the cloud room from a {@link RequestSync}. */
    record SyncRequested(String requesterId, String deviceType) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record RequestSync() implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ---------------------------------------------------------------------
    // QR ordering and service requests
    // ---------------------------------------------------------------------

    record QrOrderCreated(JsonNode order, TableInfo tableInfo, JsonNode kitchenOrder) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record TableInfo(String tableId, Integer tableNumber, String sectionName) {
    }

    /** "Call waiter" request raised from a table. */
    record ServiceRequestRaised(JsonNode request) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ServiceRequestAcknowledged(String requestId, String staffId, String staffName) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ServiceRequestResolved(String requestId) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ItemReady(String orderId, String itemId, String itemName, String orderNumber, Integer tableNumber,
                     String assignedStaffId) implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ---------------------------------------------------------------------
    // Heartbeat
    // ---------------------------------------------------------------------

    record Ping() implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Pong() implements SyncMessage {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
