package com.rms.possync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.possync.cloud.CloudTransport;
import com.rms.possync.cloud.ReactorNettyCloudTransport;
import com.rms.possync.cloud.ReconnectBackoff;
import com.rms.possync.core.callback.InMemoryKitchenOrderStore;
import com.rms.possync.core.callback.KitchenOrderStore;
import com.rms.possync.core.message.SyncMessageCodec;
import com.rms.possync.lan.LanChannel;
import com.rms.possync.lan.nats.NatsLanChannel;
import com.rms.possync.service.OrderSyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Wires the order sync service from {@link OrderSyncProperties}.
 *
 * <ul>
 *   <li>One single-threaded Reactor {@link Scheduler} drives every sync timer.</li>
 *   <li>The cloud transport is Reactor Netty's WebSocket client.</li>
 *   <li>A LAN channel bean exists only with {@code possync.lan.transport=nats}; without it the
 *       service runs cloud only.</li>
 * </ul>
 */
@Configuration
@EnableConfigurationProperties(OrderSyncProperties.class)
public class OrderSyncConfig {

    private static final Logger log = LoggerFactory.getLogger(OrderSyncConfig.class);

    @Bean(destroyMethod = "dispose")
    public Scheduler orderSyncScheduler() {
        return Schedulers.newSingle("order-sync-timer", true);
    }

    @Bean
    public SyncMessageCodec syncMessageCodec(ObjectMapper mapper) {
        return new SyncMessageCodec(mapper);
    }

    @Bean
    public CloudTransport cloudTransport() {
        return new ReactorNettyCloudTransport(new ReactorNettyWebSocketClient());
    }

    @Bean
    @ConditionalOnProperty(prefix = "possync.lan", name = "transport", havingValue = "nats")
    public LanChannel natsLanChannel(OrderSyncProperties props, ObjectMapper mapper) {
        log.info("LAN transport enabled (nats url={})", props.getLan().getNatsUrl());
        return new NatsLanChannel(props.getLan(), mapper);
    }

    @Bean
    public KitchenOrderStore kitchenOrderStore() {
        return new InMemoryKitchenOrderStore();
    }

    @Bean
    public ReconnectBackoff reconnectBackoff(OrderSyncProperties props) {
        OrderSyncProperties.Cloud c = props.getCloud();
        return new ReconnectBackoff(
                c.getReconnectBaseDelay(),
                c.getReconnectMaxDelay(),
                c.getReconnectJitter(),
                c.getReconnectMaxAttempts(),
                bound -> ThreadLocalRandom.current().nextLong(bound));
    }

    @Bean
    public OrderSyncService orderSyncService(OrderSyncProperties props,
                                             CloudTransport cloudTransport,
                                             ObjectProvider<LanChannel> lanChannel,
                                             Scheduler orderSyncScheduler,
                                             KitchenOrderStore kitchenOrderStore,
                                             SyncMessageCodec syncMessageCodec,
                                             ReconnectBackoff reconnectBackoff) {
        return new OrderSyncService(props, cloudTransport, lanChannel.getIfAvailable(), orderSyncScheduler,
                kitchenOrderStore, syncMessageCodec, reconnectBackoff);
    }
}
