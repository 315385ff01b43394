package com.fintech.intervalpool.domain;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Price resolutions published by the upstream source.
 * Hourly prices before the resolution cutover, quarter-hourly prices from it onwards.
 */
public enum Resolution {

    HOURLY(60),
    QUARTER_HOURLY(15);

    private final int minutes;

    Resolution(int minutes) {
        this.minutes = minutes;
    }

    /** Returns the width of one interval in minutes. */
    public int toMinutes() {
        return minutes;
    }

    /** Returns the width of one interval as a duration. */
    public Duration width() {
        return Duration.ofMinutes(minutes);
    }

    /** Returns the width of one interval in seconds. */
    public long toSeconds() {
        return minutes * 60L;
    }

    /**
     * Aligns a time down to the start of its interval: minutes are floored to a multiple of the width.
     */
    public ZonedDateTime alignDown(ZonedDateTime time) {
        ZonedDateTime truncated = time.truncatedTo(ChronoUnit.MINUTES);
        int minuteOfHour = truncated.getMinute();
        return truncated.withMinute((minuteOfHour / minutes) * minutes);
    }

    /**
     * Aligns a time up to the next interval start, or returns it unchanged when already aligned.
     */
    public ZonedDateTime alignUp(ZonedDateTime time) {
        ZonedDateTime floor = alignDown(time);
        return floor.isEqual(time) ? floor : floor.plus(width());
    }

    /** Local wall time variant of {@link #alignDown(ZonedDateTime)}. */
    public LocalDateTime alignDown(LocalDateTime time) {
        LocalDateTime truncated = time.truncatedTo(ChronoUnit.MINUTES);
        return truncated.withMinute((truncated.getMinute() / minutes) * minutes);
    }

    /** Local wall time variant of {@link #alignUp(ZonedDateTime)}. */
    public LocalDateTime alignUp(LocalDateTime time) {
        LocalDateTime floor = alignDown(time);
        return floor.isEqual(time) ? floor : floor.plus(width());
    }

    /** Returns exclusive interval end: start + width. */
    public ZonedDateTime intervalEnd(ZonedDateTime start) {
        return start.plus(width());
    }
}
