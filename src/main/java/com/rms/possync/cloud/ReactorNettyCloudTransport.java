package com.rms.possync.cloud;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link CloudTransport} over Spring WebFlux's reactive {@link WebSocketClient}
 * (Reactor Netty in production).
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Outbound frames go through a unicast sink drained by {@link WebSocketSession#send}.</li>
 *   <li>Inbound text frames are handed to the listener in arrival order.</li>
 *   <li>Completion of the session reports the peer's close status; a failed handshake or I/O
 *       error reports {@code onError} then {@code onClose(1006)}.</li>
 * </ul>
 */
public class ReactorNettyCloudTransport implements CloudTransport {

    private static final Logger log = LoggerFactory.getLogger(ReactorNettyCloudTransport.class);

    static final int ABNORMAL_CLOSURE = 1006;

    private final WebSocketClient client;

    public ReactorNettyCloudTransport(WebSocketClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public CloudConnection open(URI uri, CloudConnection.Listener listener) {
        SessionConnection connection = new SessionConnection(listener);
        connection.subscription = client.execute(uri, connection::handle)
                .subscribe(
                        v -> { },
                        err -> connection.fail(err),
                        connection::completed);
        return connection;
    }

    private static final class SessionConnection implements CloudConnection {

        private final CloudConnection.Listener listener;
        private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        private final AtomicBoolean closed = new AtomicBoolean();

        private volatile WebSocketSession session;
        private volatile CloseStatus closeStatus;
        private volatile Disposable subscription;

        SessionConnection(CloudConnection.Listener listener) {
            this.listener = listener;
        }

        Mono<Void> handle(WebSocketSession s) {
            this.session = s;
            s.closeStatus().subscribe(status -> this.closeStatus = status);
            listener.onOpen();

            Mono<Void> in = s.receive()
                    .filter(m -> m.getType() == WebSocketMessage.Type.TEXT)
                    .map(WebSocketMessage::getPayloadAsText)
                    .doOnNext(listener::onMessage)
                    .then();
            Mono<Void> out = s.send(outbound.asFlux().map(s::textMessage));
            return Mono.firstWithSignal(in, out);
        }

        void fail(Throwable err) {
            if (closed.compareAndSet(false, true)) {
                listener.onError(err);
                listener.onClose(ABNORMAL_CLOSURE, err.getMessage() == null ? err.toString() : err.getMessage());
            }
        }

        void completed() {
            if (closed.compareAndSet(false, true)) {
                CloseStatus status = closeStatus;
                if (status == null) {
                    status = CloseStatus.NORMAL;
                }
                listener.onClose(status.getCode(), status.getReason());
            }
        }

        @Override
        public boolean isOpen() {
            WebSocketSession s = session;
            return !closed.get() && s != null && s.isOpen();
        }

        @Override
        public boolean send(String frame) {
            if (!isOpen()) {
                return false;
            }
            return outbound.tryEmitNext(frame).isSuccess();
        }

        @Override
        public void close(int code, String reason) {
            WebSocketSession s = session;
            outbound.tryEmitComplete();
            if (s != null) {
                s.close(new CloseStatus(code, reason))
                        .onErrorResume(err -> {
                            log.debug("WebSocket close failed err={}", err.toString());
                            return Mono.empty();
                        })
                        .subscribe();
            } else {
                Disposable d = subscription;
                if (d != null) {
                    d.dispose();
                }
            }
        }
    }
}
