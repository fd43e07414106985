package com.rms.possync.lan;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Local-network companion transport. One device hosts, the others join as clients.
 *
 * <p>Discovery and socket handling live behind this interface. The sync service decides which
 * role to take and never calls both {@link #startServer} and {@link #connectAsClient}.</p>
 *
 * <p>Failures are signalled through the returned {@link Mono}s; implementations must not throw
 * from these methods directly.</p>
 */
public interface LanChannel {

    /**
     * Starts hosting the tenant's LAN mesh.
     *
     * @return the address dependents should connect to
     */
    Mono<String> startServer(String tenantId);

    Mono<Void> stopServer();

    /**
     * Finds the tenant's host and joins it.
     *
     * @return the link status, or empty when no host answered
     */
    Mono<LanClientStatus> connectAsClient(DeviceType deviceType, String tenantId);

    Mono<Void> disconnect();

    /**
     * @return number of clients the order was delivered to
     */
    Mono<Integer> broadcastOrder(JsonNode order, JsonNode kitchenOrder);

    /**
     * @return number of clients the update was delivered to
     */
    Mono<Integer> broadcastOrderStatus(String orderId, String status);

    /**
     * Registers {@code listener} until the returned handle is disposed.
     */
    Disposable subscribe(LanEventListener listener);
}
