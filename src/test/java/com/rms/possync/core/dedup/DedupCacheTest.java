package com.rms.possync.core.dedup;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DedupCacheTest {

    private VirtualTimeScheduler vts;
    private DedupCache cache;

    @BeforeEach
    void setUp() {
        vts = VirtualTimeScheduler.create();
        cache = new DedupCache(vts, DedupCache.DEFAULT_TTL);
    }

    @Test
    void firstSightingWinsAndRepeatsAreRejected() {
        assertThat(cache.markIfAbsent("K-1")).isTrue();
        assertThat(cache.markIfAbsent("K-1")).isFalse();
        assertThat(cache.markIfAbsent("K-1")).isFalse();
        assertThat(cache.markIfAbsent("K-2")).isTrue();
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void entryRecordsInsertionTime() {
        vts.advanceTimeBy(Duration.ofSeconds(42));
        cache.markIfAbsent("K-1");

        assertThat(cache.entry("K-1")).hasValueSatisfying(e -> {
            assertThat(e.messageId()).isEqualTo("K-1");
            assertThat(e.insertedAt()).isEqualTo(42_000L);
        });
        assertThat(cache.entry("missing")).isEmpty();
    }

    @Test
    void entryExpiresAfterWindowAndIsAcceptedAgain() {
        cache.markIfAbsent("K-1");

        vts.advanceTimeBy(Duration.ofMinutes(5).minusMillis(1));
        assertThat(cache.contains("K-1")).isTrue();
        assertThat(cache.markIfAbsent("K-1")).isFalse();

        vts.advanceTimeBy(Duration.ofMillis(1));
        assertThat(cache.contains("K-1")).isFalse();
        assertThat(cache.markIfAbsent("K-1")).isTrue();
    }

    @Test
    void duplicateDoesNotExtendWindow() {
        cache.markIfAbsent("K-1");
        vts.advanceTimeBy(Duration.ofMinutes(4));
        cache.markIfAbsent("K-1");

        vts.advanceTimeBy(Duration.ofMinutes(1));

        assertThat(cache.contains("K-1")).isFalse();
    }

    @Test
    void clearDropsEntriesAndCancelsTheirTimers() {
        cache.markIfAbsent("K-1");
        cache.markIfAbsent("K-2");

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.markIfAbsent("K-1")).isTrue();

        // the timer from before clear() must not evict the re-inserted entry early
        vts.advanceTimeBy(Duration.ofMinutes(4));
        assertThat(cache.contains("K-1")).isTrue();
        vts.advanceTimeBy(Duration.ofMinutes(1));
        assertThat(cache.contains("K-1")).isFalse();
    }

    @Test
    void rejectsNonPositiveTtl() {
        assertThatThrownBy(() -> new DedupCache(vts, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
