package com.rms.possync.admin;

import com.rms.possync.core.model.BroadcastResult;
import com.rms.possync.core.model.ConnectionState;
import com.rms.possync.core.model.DetailedStatus;
import com.rms.possync.core.model.SyncPath;
import com.rms.possync.service.OrderSyncService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Operational endpoints for a device's sync service.
 *
 * Production posture: disabled by default, and meant for the device's local admin network only
 * (no authentication here). Enable explicitly with {@code possync.admin.enabled=true}.
 */
@RestController
@RequestMapping(path = "/admin/sync", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "possync.admin", name = "enabled", havingValue = "true", matchIfMissing = false)
@Validated
public class SyncAdminController {

    private static final Logger log = LoggerFactory.getLogger(SyncAdminController.class);

    private final OrderSyncService service;

    public SyncAdminController(OrderSyncService service) {
        this.service = service;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("ok", Instant.now().toString());
    }

    /**
     * Both transports, the derived path and the aggregate status in one payload.
     */
    @GetMapping("/status")
    public StatusResponse status() {
        return new StatusResponse(service.isInitialized(), service.getConnectionStatus(),
                service.getActiveSyncPath(), service.getDetailedStatus());
    }

    @PostMapping(path = "/initialize", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<StatusResponse> initialize(@Valid @RequestBody InitializeRequest req) {
        log.info("Admin initialize requested");
        service.initialize(req.tenantId().trim(), null);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(status());
    }

    @PostMapping("/shutdown")
    public StatusResponse shutdown() {
        log.info("Admin shutdown requested");
        service.shutdown();
        return status();
    }

    /**
     * Asks peers for their state. Waits for the cloud socket the same way any broadcast does.
     */
    @PostMapping("/request")
    public Mono<BroadcastResult> requestSync() {
        requireInitialized();
        return service.requestSync();
    }

    /** Manual reconnect; useful after the automatic attempts ran out. */
    @PostMapping("/reconnect")
    public ResponseEntity<StatusResponse> reconnect() {
        requireInitialized();
        service.connectCloud();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(status());
    }

    private void requireInitialized() {
        if (!service.isInitialized()) {
            throw new IllegalStateException("Order sync is not initialized");
        }
    }

    // ---------------------------------------------------------------------
    // DTOs
    // ---------------------------------------------------------------------

    public record HealthResponse(String status, String time) {
    }

    public record InitializeRequest(@NotBlank String tenantId) {
    }

    public record StatusResponse(boolean initialized, ConnectionState status, SyncPath activePath,
                                 DetailedStatus detail) {
    }
}

/**
 * Maps admin failures to stable {@link ApiError} bodies.
 */
@RestControllerAdvice(assignableTypes = SyncAdminController.class)
class SyncAdminExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(SyncAdminExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiError> invalid(WebExchangeBindException e) {
        String msg = e.getFieldErrors().isEmpty()
                ? "Invalid request"
                : e.getFieldErrors().get(0).getField() + " " + e.getFieldErrors().get(0).getDefaultMessage();
        return ResponseEntity.badRequest().body(new ApiError("bad_request", msg));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ApiError("conflict", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> internal(Exception e) {
        // full detail stays in the log
        log.error("Admin endpoint failure", e);
        return ResponseEntity.status(500).body(new ApiError("internal_error", "Request failed"));
    }

    record ApiError(String code, String message) {
    }
}
