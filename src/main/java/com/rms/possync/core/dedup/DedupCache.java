package com.rms.possync.core.dedup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Time-bounded set of recently applied message ids.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>{@link #markIfAbsent(String)} is the only gate: it returns {@code true} exactly once per id
 *       per window.</li>
 *   <li>Each entry owns one expiry task on the injected {@link Scheduler}; there is no sweep.</li>
 *   <li>The window is not sliding per hit: a duplicate does not extend the entry's life.</li>
 * </ul>
 *
 * <p>Guards itself with its own monitor and never calls out while holding it.</p>
 */
public class DedupCache {

    private static final Logger log = LoggerFactory.getLogger(DedupCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final Scheduler scheduler;
    private final Duration ttl;

    private final Map<String, Slot> entries = new HashMap<>();

    public DedupCache(Scheduler scheduler, Duration ttl) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
    }

    /**
     * Records {@code messageId} if it has not been seen within the window.
     *
     * @return {@code true} if the caller should apply the message, {@code false} for a duplicate
     */
    public boolean markIfAbsent(String messageId) {
        Objects.requireNonNull(messageId, "messageId");
        synchronized (entries) {
            if (entries.containsKey(messageId)) {
                return false;
            }
            Slot slot = new Slot(new DedupEntry(messageId, scheduler.now(TimeUnit.MILLISECONDS)));
            entries.put(messageId, slot);
            slot.expiry = scheduler.schedule(() -> expire(messageId, slot), ttl.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        }
    }

    public boolean contains(String messageId) {
        synchronized (entries) {
            return entries.containsKey(messageId);
        }
    }

    public Optional<DedupEntry> entry(String messageId) {
        synchronized (entries) {
            Slot slot = entries.get(messageId);
            return slot == null ? Optional.empty() : Optional.of(slot.entry);
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    /**
     * Drops every entry and cancels their expiry tasks.
     */
    public void clear() {
        synchronized (entries) {
            for (Slot slot : entries.values()) {
                if (slot.expiry != null) {
                    slot.expiry.dispose();
                }
            }
            int n = entries.size();
            entries.clear();
            if (n > 0) {
                log.debug("Dedup cache cleared entries={}", n);
            }
        }
    }

    private void expire(String messageId, Slot slot) {
        synchronized (entries) {
            // A clear() followed by a re-insert must not be evicted by the old timer.
            if (entries.get(messageId) == slot) {
                entries.remove(messageId);
            }
        }
    }

    private static final class Slot {
        final DedupEntry entry;
        Disposable expiry;

        Slot(DedupEntry entry) {
            this.entry = entry;
        }
    }
}
