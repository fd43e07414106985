package com.rms.possync.bootstrap;

import com.rms.possync.config.OrderSyncProperties;
import com.rms.possync.core.callback.SyncCallbacks;
import com.rms.possync.service.OrderSyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Joins the configured tenant once the application is ready.
 *
 * <p>Enabled by {@code possync.auto-start=true}. Uses the {@link SyncCallbacks} bean if the
 * application defines one. A missing tenant is logged, not fatal: the admin endpoint can still
 * initialize later.</p>
 */
@Component
@ConditionalOnProperty(prefix = "possync", name = "auto-start", havingValue = "true", matchIfMissing = false)
public class OrderSyncBootstrapper {

    private static final Logger log = LoggerFactory.getLogger(OrderSyncBootstrapper.class);

    private final OrderSyncService service;
    private final OrderSyncProperties props;
    private final ObjectProvider<SyncCallbacks> callbacks;

    public OrderSyncBootstrapper(OrderSyncService service, OrderSyncProperties props,
                                 ObjectProvider<SyncCallbacks> callbacks) {
        this.service = service;
        this.props = props;
        this.callbacks = callbacks;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        start();
    }

    void start() {
        String tenant = props.getTenantId();
        if (tenant == null || tenant.isBlank()) {
            log.warn("possync.auto-start is set but possync.tenant-id is empty; not starting");
            return;
        }
        if (service.isInitialized()) {
            return;
        }
        service.initialize(tenant.trim(), callbacks.getIfAvailable(() -> SyncCallbacks.NONE));
    }
}
