package com.fintech.intervalpool.domain;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Half-open time range [start, end) in the subject's zone.
 */
public record TimeRange(ZonedDateTime start, ZonedDateTime end) {

    public TimeRange {
        Objects.requireNonNull(start, "Range start cannot be null");
        Objects.requireNonNull(end, "Range end cannot be null");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Range start (" + start + ") must be before end (" + end + ")");
        }
    }

    /** Returns true if the instant lies inside [start, end). */
    public boolean contains(ZonedDateTime time) {
        return !time.isBefore(start) && time.isBefore(end);
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    @Override
    public String toString() {
        return "[" + start.toOffsetDateTime() + ", " + end.toOffsetDateTime() + ")";
    }
}
