package com.fintech.intervalpool.pool;

import java.time.Duration;

/**
 * Tunables shared by every pool.
 *
 * @param maxIntervals Interval ceiling enforced by the garbage collector
 * @param protectedDaysBefore Days before today covered by the protected range
 * @param protectedDaysAfter Days after today at whose midnight the protected range ends
 * @param debounce Delay between the last change and the persisted save
 */
public record PoolSettings(int maxIntervals, int protectedDaysBefore, int protectedDaysAfter, Duration debounce) {

    public static final Duration DEFAULT_DEBOUNCE = Duration.ofSeconds(3);

    public PoolSettings {
        if (maxIntervals <= 0) {
            throw new IllegalArgumentException("maxIntervals must be positive: " + maxIntervals);
        }
        if (protectedDaysBefore < 0 || protectedDaysAfter < 0) {
            throw new IllegalArgumentException("Protected day offsets must not be negative");
        }
        if (debounce == null || debounce.isNegative()) {
            throw new IllegalArgumentException("Debounce must be zero or positive");
        }
    }

    public static PoolSettings defaults() {
        return new PoolSettings(
            GarbageCollector.DEFAULT_MAX_INTERVALS,
            FetchGroupCache.DEFAULT_PROTECTED_DAYS_BEFORE,
            FetchGroupCache.DEFAULT_PROTECTED_DAYS_AFTER,
            DEFAULT_DEBOUNCE
        );
    }

    public PoolSettings withMaxIntervals(int value) {
        return new PoolSettings(value, protectedDaysBefore, protectedDaysAfter, debounce);
    }

    public PoolSettings withDebounce(Duration value) {
        return new PoolSettings(maxIntervals, protectedDaysBefore, protectedDaysAfter, value);
    }
}
