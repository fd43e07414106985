package com.rms.possync.service;

import com.rms.possync.core.message.SyncMessage;
import com.rms.possync.core.model.ConnectionStatusChange;
import com.rms.possync.core.model.SyncError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Multicast streams for subscribers beyond the single callback registry.
 *
 * <ul>
 *   <li>Hot and best-effort: late subscribers only see what is emitted after they subscribe.</li>
 *   <li>Emission happens under the service monitor, so the sinks never see concurrent emitters.</li>
 * </ul>
 */
public class SyncEventBus {

    private static final Logger log = LoggerFactory.getLogger(SyncEventBus.class);

    private final Sinks.Many<SyncMessage> messages = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<ConnectionStatusChange> statusChanges = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<SyncError> errors = Sinks.many().multicast().directBestEffort();

    /** Inbound messages after dedup and application. */
    public Flux<SyncMessage> messages() {
        return messages.asFlux();
    }

    public <T extends SyncMessage> Flux<T> messages(Class<T> kind) {
        return messages.asFlux().ofType(kind);
    }

    public Flux<ConnectionStatusChange> statusChanges() {
        return statusChanges.asFlux();
    }

    public Flux<SyncError> errors() {
        return errors.asFlux();
    }

    void publishMessage(SyncMessage message) {
        emit(messages, message, "message");
    }

    void publishStatus(ConnectionStatusChange change) {
        emit(statusChanges, change, "status");
    }

    void publishError(SyncError error) {
        emit(errors, error, "error");
    }

    void complete() {
        messages.tryEmitComplete();
        statusChanges.tryEmitComplete();
        errors.tryEmitComplete();
    }

    private static <T> void emit(Sinks.Many<T> sink, T value, String stream) {
        Sinks.EmitResult r = sink.tryEmitNext(value);
        if (r.isFailure() && r != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Event dropped stream={} result={}", stream, r);
        }
    }
}
