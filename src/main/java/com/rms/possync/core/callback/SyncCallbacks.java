package com.rms.possync.core.callback;

import com.fasterxml.jackson.databind.JsonNode;
import com.rms.possync.core.message.SyncMessage;
import com.rms.possync.core.model.ConnectionState;
import com.rms.possync.core.model.SyncPath;
import com.rms.possync.core.model.Transport;

import java.util.List;

/**
 * Domain handler registry passed to {@code initialize}. One registry is active per service
 * instance; every method is optional.
 *
 * <p>Handlers run on whichever thread delivered the event, while the service holds its state
 * monitor. Keep them short and non-blocking. Exceptions are logged and swallowed by the caller.</p>
 *
 * <p>Additional subscribers that should not replace this registry use the service's
 * {@code Flux} streams instead.</p>
 */
public interface SyncCallbacks {

    SyncCallbacks NONE = new SyncCallbacks() {
    };

    default void onOrderCreated(JsonNode order, JsonNode kitchenOrder) {
    }

    default void onOrderStatusUpdate(String orderId, String status, SyncMessage.OrderStatusUpdate update) {
    }

    default void onItemStatusUpdate(SyncMessage.ItemStatusUpdate update) {
    }

    default void onSyncState(List<JsonNode> activeOrders) {
    }

    default void onConnectionChange(ConnectionState status, SyncPath path) {
    }

    default void onError(Throwable error, Transport transport) {
    }

    // staff

    default void onStaffSync(List<JsonNode> staff) {
    }

    default void onStaffAdded(JsonNode staff) {
    }

    default void onStaffUpdated(String staffId, JsonNode updates) {
    }

    default void onStaffRemoved(String staffId) {
    }

    // floor plan

    default void onFloorPlanSync(List<JsonNode> sections, List<JsonNode> tables, List<JsonNode> assignments) {
    }

    default void onSectionAdded(JsonNode section) {
    }

    default void onSectionRemoved(String sectionId) {
    }

    default void onTableAdded(JsonNode table) {
    }

    default void onTableRemoved(String tableId) {
    }

    default void onTableStatusUpdated(String tableId, String status) {
    }

    default void onStaffAssigned(JsonNode assignment) {
    }

    default void onSyncRequested(String requesterId, String deviceType) {
    }

    default void onQrOrderCreated(JsonNode order, SyncMessage.TableInfo tableInfo, JsonNode kitchenOrder) {
    }

    // service requests

    default void onServiceRequest(JsonNode request) {
    }

    default void onServiceRequestAcknowledged(String requestId, String staffId, String staffName) {
    }

    default void onServiceRequestResolved(String requestId) {
    }

    default void onItemReady(SyncMessage.ItemReady itemReady) {
    }
}
