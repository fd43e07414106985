package com.rms.possync.config;

import com.rms.possync.core.model.DeviceMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Device identity, cloud endpoint and timing for the order sync service.
 *
 * <p>Defaults reproduce the wire-compatible constants shared with the other device builds
 * (backoff 1s..30s with up to 1s jitter and 10 attempts, 5 minute dedup window, 6 send polls
 * every 500ms). Change them only together with every peer.</p>
 */
@Validated
@ConfigurationProperties(prefix = "possync")
public class OrderSyncProperties {

    // ---------------------------------------------------------------------
    // Device identity
    // ---------------------------------------------------------------------

    /** Tenant to join on startup when {@link #autoStart} is set. */
    private String tenantId;

    /** Declared operating mode; decides LAN host vs. dependent. */
    @NotNull
    private DeviceMode deviceMode = DeviceMode.pos;

    /** Initialize on ApplicationReadyEvent (requires tenantId). */
    private boolean autoStart = false;

    @Valid
    private Cloud cloud = new Cloud();

    @Valid
    private Dedup dedup = new Dedup();

    @Valid
    private Lan lan = new Lan();

    private Admin admin = new Admin();

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public DeviceMode getDeviceMode() { return deviceMode; }
    public void setDeviceMode(DeviceMode deviceMode) { this.deviceMode = deviceMode; }

    public boolean isAutoStart() { return autoStart; }
    public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }

    public Cloud getCloud() { return cloud; }
    public void setCloud(Cloud cloud) { this.cloud = cloud; }

    public Dedup getDedup() { return dedup; }
    public void setDedup(Dedup dedup) { this.dedup = dedup; }

    public Lan getLan() { return lan; }
    public void setLan(Lan lan) { this.lan = lan; }

    public Admin getAdmin() { return admin; }
    public void setAdmin(Admin admin) { this.admin = admin; }

    // ---------------------------------------------------------------------
    // Cloud channel
    // ---------------------------------------------------------------------

    public static class Cloud {

        /** Base URL; the socket path is {@code /ws/orders/{tenantId}}. */
        @NotBlank
        private String wsBase = "ws://localhost:8787";

        /** Ping period while connected; zero disables the heartbeat. */
        private Duration heartbeatInterval = Duration.ofSeconds(30);

        private Duration reconnectBaseDelay = Duration.ofMillis(1000);
        private Duration reconnectMaxDelay = Duration.ofMillis(30_000);
        private Duration reconnectJitter = Duration.ofMillis(1000);

        @Min(0)
        private int reconnectMaxAttempts = 10;

        private Duration sendPollInterval = Duration.ofMillis(500);

        @Min(0)
        private int sendPolls = 6;

        public String getWsBase() { return wsBase; }
        public void setWsBase(String wsBase) { this.wsBase = wsBase; }

        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }

        public Duration getReconnectBaseDelay() { return reconnectBaseDelay; }
        public void setReconnectBaseDelay(Duration reconnectBaseDelay) { this.reconnectBaseDelay = reconnectBaseDelay; }

        public Duration getReconnectMaxDelay() { return reconnectMaxDelay; }
        public void setReconnectMaxDelay(Duration reconnectMaxDelay) { this.reconnectMaxDelay = reconnectMaxDelay; }

        public Duration getReconnectJitter() { return reconnectJitter; }
        public void setReconnectJitter(Duration reconnectJitter) { this.reconnectJitter = reconnectJitter; }

        public int getReconnectMaxAttempts() { return reconnectMaxAttempts; }
        public void setReconnectMaxAttempts(int reconnectMaxAttempts) { this.reconnectMaxAttempts = reconnectMaxAttempts; }

        public Duration getSendPollInterval() { return sendPollInterval; }
        public void setSendPollInterval(Duration sendPollInterval) { this.sendPollInterval = sendPollInterval; }

        public int getSendPolls() { return sendPolls; }
        public void setSendPolls(int sendPolls) { this.sendPolls = sendPolls; }
    }

    public static class Dedup {

        private Duration ttl = Duration.ofMinutes(5);

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
    }

    // ---------------------------------------------------------------------
    // LAN channel
    // ---------------------------------------------------------------------

    public static class Lan {

        /** {@code none} (cloud only) or {@code nats}. */
        @NotBlank
        private String transport = "none";

        /** Broker on the LAN host, e.g. {@code nats://pos.local:4222}. */
        private String natsUrl = "nats://localhost:4222";

        /** How long a dependent waits for the host before falling back to cloud only. */
        private Duration connectTimeout = Duration.ofSeconds(10);

        @NotBlank
        private String subjectPrefix = "possync.lan";

        /** Stable id announced to the host; random per process when unset. */
        private String clientId;

        public String getTransport() { return transport; }
        public void setTransport(String transport) { this.transport = transport; }

        public String getNatsUrl() { return natsUrl; }
        public void setNatsUrl(String natsUrl) { this.natsUrl = natsUrl; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public String getSubjectPrefix() { return subjectPrefix; }
        public void setSubjectPrefix(String subjectPrefix) { this.subjectPrefix = subjectPrefix; }

        public String getClientId() { return clientId; }
        public void setClientId(String clientId) { this.clientId = clientId; }
    }

    public static class Admin {

        private boolean enabled = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
