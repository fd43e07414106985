package com.rms.possync.lan.nats;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Subject vocabulary of the NATS-backed LAN mesh: {@code <prefix>.<tenant>.<kind>}.
 *
 * <p>{@code prefix} may contain dots; {@code tenant} is a single token so one broker can host
 * several tenants without crosstalk.</p>
 */
public final class LanSubject {

    private static final Pattern TOKEN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{0,127}$");
    private static final Pattern PREFIX = Pattern.compile("^[A-Za-z0-9_-]+(\\.[A-Za-z0-9_-]+)*$");

    /** Fixed tail tokens, one per event kind. */
    public enum Kind {
        ORDER_CREATED("orders.created"),
        ORDER_STATUS("orders.status"),
        SYNC_STATE("sync.state"),
        CLIENT_JOIN("clients.join"),
        CLIENT_LEAVE("clients.leave");

        private final String tail;

        Kind(String tail) {
            this.tail = tail;
        }

        public String tail() {
            return tail;
        }
    }

    private final String base;

    private LanSubject(String prefix, String tenantId) {
        Objects.requireNonNull(prefix, "prefix");
        if (!PREFIX.matcher(prefix).matches()) {
            throw new IllegalArgumentException("subject prefix must match " + PREFIX.pattern() + " but was: " + prefix);
        }
        String tenant = tenantToken(tenantId);
        this.base = prefix + "." + tenant + ".";
    }

    public static LanSubject of(String prefix, String tenantId) {
        return new LanSubject(prefix, tenantId);
    }

    public String subject(Kind kind) {
        return base + kind.tail();
    }

    /**
     * Resolves a received subject back to its kind, or {@code null} if it is not one of ours.
     */
    public Kind tryParse(String subject) {
        if (subject == null || !subject.startsWith(base)) {
            return null;
        }
        String tail = subject.substring(base.length());
        for (Kind k : Kind.values()) {
            if (k.tail().equals(tail)) {
                return k;
            }
        }
        return null;
    }

    /**
     * Tenant ids are free-form upstream; characters NATS treats specially become {@code _}.
     */
    static String tenantToken(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        String token = tenantId.trim().replaceAll("[^A-Za-z0-9_-]", "_");
        if (!TOKEN.matcher(token).matches()) {
            throw new IllegalArgumentException("tenantId cannot be used as a subject token: " + tenantId);
        }
        return token;
    }
}
