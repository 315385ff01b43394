package com.fintech.intervalpool.pool;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Calendar window around today whose intervals are never evicted.
 * Bounds are local wall times: start inclusive, end exclusive.
 */
public record ProtectedRange(LocalDateTime start, LocalDateTime end) {

    /** Fixed-width local format, sorts lexicographically in time order. */
    public static final DateTimeFormatter ISO_SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    public boolean contains(LocalDateTime timestamp) {
        return !timestamp.isBefore(start) && timestamp.isBefore(end);
    }

    public String startIso() {
        return ISO_SECONDS.format(start);
    }

    public String endIso() {
        return ISO_SECONDS.format(end);
    }
}
