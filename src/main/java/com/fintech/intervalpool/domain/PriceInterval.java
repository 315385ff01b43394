package com.fintech.intervalpool.domain;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable price record for one interval as delivered by the upstream source.
 * Uses record semantics for immutability and compact constructor for validation.
 *
 * Two instances describe the same interval when their {@link #normalizedStart()} values are equal,
 * regardless of which fetch produced them.
 *
 * @param startsAt Interval start including the source's UTC offset
 * @param total Total price (energy + tax)
 * @param energy Energy component of the price
 * @param tax Tax component of the price
 * @param level Classification tier, may be null when the source omits it
 * @param extras Pass-through fields the pool does not interpret
 */
public record PriceInterval(
    OffsetDateTime startsAt,
    double total,
    double energy,
    double tax,
    PriceLevel level,
    Map<String, Object> extras
) {

    /**
     * Validates the start timestamp and freezes the extras map.
     */
    public PriceInterval {
        Objects.requireNonNull(startsAt, "startsAt cannot be null");
        if (Double.isNaN(total) || Double.isNaN(energy) || Double.isNaN(tax)) {
            throw new IllegalArgumentException("Price components must be numbers: startsAt=" + startsAt);
        }
        extras = extras == null ? Map.of() : Map.copyOf(extras);
    }

    /**
     * Creates an interval without pass-through fields.
     */
    public static PriceInterval of(OffsetDateTime startsAt, double total, double energy, double tax, PriceLevel level) {
        return new PriceInterval(startsAt, total, energy, tax, level, Map.of());
    }

    /**
     * Returns the offset-free local start truncated to whole seconds.
     * This is the key used by the timestamp index and the protected-range check.
     */
    public LocalDateTime normalizedStart() {
        return normalize(startsAt);
    }

    /** Normalizes any offset timestamp the same way as {@link #normalizedStart()}. */
    public static LocalDateTime normalize(OffsetDateTime timestamp) {
        return timestamp.toLocalDateTime().truncatedTo(ChronoUnit.SECONDS);
    }
}
