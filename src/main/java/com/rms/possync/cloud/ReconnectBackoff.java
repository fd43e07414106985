package com.rms.possync.cloud;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Exponential reconnect delay: {@code min(base * 2^attempt, max) + jitter}, jitter uniform in
 * {@code [0, maxJitter)}.
 */
public class ReconnectBackoff {

    public static final Duration DEFAULT_BASE = Duration.ofMillis(1000);
    public static final Duration DEFAULT_MAX = Duration.ofMillis(30_000);
    public static final Duration DEFAULT_JITTER = Duration.ofMillis(1000);
    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    private final long baseMillis;
    private final long maxMillis;
    private final long jitterMillis;
    private final int maxAttempts;
    private final LongUnaryOperator jitterSource;

    /**
     * @param jitterSource given the exclusive upper bound, returns a value in {@code [0, bound)}
     */
    public ReconnectBackoff(Duration base, Duration max, Duration jitter, int maxAttempts,
                            LongUnaryOperator jitterSource) {
        this.baseMillis = Objects.requireNonNull(base, "base").toMillis();
        this.maxMillis = Objects.requireNonNull(max, "max").toMillis();
        this.jitterMillis = Objects.requireNonNull(jitter, "jitter").toMillis();
        this.maxAttempts = maxAttempts;
        this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource");
        if (baseMillis <= 0 || maxMillis < baseMillis) {
            throw new IllegalArgumentException("Require 0 < base <= max, got base=" + base + " max=" + max);
        }
        if (jitterMillis < 0 || maxAttempts < 0) {
            throw new IllegalArgumentException("jitter and maxAttempts must not be negative");
        }
    }

    public static ReconnectBackoff defaults() {
        return new ReconnectBackoff(DEFAULT_BASE, DEFAULT_MAX, DEFAULT_JITTER, DEFAULT_MAX_ATTEMPTS,
                bound -> ThreadLocalRandom.current().nextLong(bound));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean exhausted(int attempt) {
        return attempt >= maxAttempts;
    }

    /** Capped exponential part, without jitter. */
    public long baseDelayMillis(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative: " + attempt);
        }
        // compare by shifting max down so base << attempt cannot overflow
        if (attempt >= 62 || baseMillis > (maxMillis >> Math.min(attempt, 62))) {
            return maxMillis;
        }
        return Math.min(baseMillis << attempt, maxMillis);
    }

    public Duration delayFor(int attempt) {
        long jitter = jitterMillis == 0 ? 0 : jitterSource.applyAsLong(jitterMillis);
        return Duration.ofMillis(baseDelayMillis(attempt) + jitter);
    }
}
