package com.fintech.intervalpool.util;

import com.fintech.intervalpool.domain.Resolution;
import com.fintech.intervalpool.domain.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolution calculations around the fixed cutover from hourly to quarter-hourly prices.
 * Handles the cutover instant, interval widths and the jitter tolerance used by gap detection.
 *
 * Thread-safe and stateless - all methods are pure functions.
 */
public class ResolutionTimeline {

    private static final Logger log = LoggerFactory.getLogger(ResolutionTimeline.class);

    /** Local wall time at which the source switched to quarter-hourly prices. */
    public static final LocalDateTime DEFAULT_CUTOVER = LocalDateTime.of(2025, 10, 1, 0, 0);

    /** Absorbs floating point and time zone jitter when comparing interval starts. */
    public static final Duration DEFAULT_TOLERANCE = Duration.ofSeconds(1);

    /** Slack allowed on top of the expected width between consecutive intervals. */
    public static final Duration DEFAULT_STEP_TOLERANCE = Duration.ofMinutes(1);

    private final LocalDateTime cutover;
    private final Duration tolerance;
    private final Duration stepTolerance;

    public ResolutionTimeline() {
        this(DEFAULT_CUTOVER, DEFAULT_TOLERANCE, DEFAULT_STEP_TOLERANCE);
    }

    public ResolutionTimeline(LocalDateTime cutover, Duration tolerance, Duration stepTolerance) {
        this.cutover = cutover;
        this.tolerance = tolerance;
        this.stepTolerance = stepTolerance;
    }

    /** Returns the cutover as local wall time (zone independent). */
    public LocalDateTime cutover() {
        return cutover;
    }

    /** Returns the cutover instant in the given zone. */
    public ZonedDateTime cutoverIn(ZoneId zone) {
        return cutover.atZone(zone);
    }

    public Duration tolerance() {
        return tolerance;
    }

    public Duration stepTolerance() {
        return stepTolerance;
    }

    /**
     * Determines the resolution in effect for an interval starting at the given time.
     *
     * @param time Interval start
     * @return HOURLY before the cutover, QUARTER_HOURLY at or after it
     */
    public Resolution resolutionAt(ZonedDateTime time) {
        return time.isBefore(cutoverIn(time.getZone())) ? Resolution.HOURLY : Resolution.QUARTER_HOURLY;
    }

    /**
     * Returns the start of the interval following the one starting at {@code time}.
     * Steps never skip the cutover: an hourly step that would pass it lands on it.
     */
    public ZonedDateTime nextIntervalStart(ZonedDateTime time) {
        ZonedDateTime next = time.plus(resolutionAt(time).width());
        ZonedDateTime cutoverInstant = cutoverIn(time.getZone());
        if (time.isBefore(cutoverInstant) && next.isAfter(cutoverInstant)) {
            return cutoverInstant;
        }
        return next;
    }

    /**
     * Returns the first interval start at or after {@code time}, aligned to the resolution in effect.
     */
    public ZonedDateTime firstIntervalStartAtOrAfter(ZonedDateTime time) {
        return resolutionAt(time).alignUp(time);
    }

    /** Resolution in effect for an interval starting at the given local wall time. */
    public Resolution resolutionAt(LocalDateTime time) {
        return time.isBefore(cutover) ? Resolution.HOURLY : Resolution.QUARTER_HOURLY;
    }

    /**
     * Steps local wall time by the resolution in effect, landing on the cutover like
     * {@link #nextIntervalStart(ZonedDateTime)}. A repeated or skipped DST hour is stepped
     * over once, matching the local keys of the timestamp index.
     */
    public LocalDateTime nextIntervalStart(LocalDateTime time) {
        LocalDateTime next = time.plus(resolutionAt(time).width());
        if (time.isBefore(cutover) && next.isAfter(cutover)) {
            return cutover;
        }
        return next;
    }

    public LocalDateTime firstIntervalStartAtOrAfter(LocalDateTime time) {
        return resolutionAt(time).alignUp(time);
    }

    /**
     * Checks whether a time range crosses the cutover strictly inside.
     *
     * @param range Candidate range
     * @return true if start &lt; cutover &lt; end
     */
    public boolean straddlesCutover(TimeRange range) {
        ZonedDateTime cutoverInstant = cutoverIn(range.start().getZone());
        return range.start().isBefore(cutoverInstant) && range.end().isAfter(cutoverInstant);
    }

    /**
     * Splits every range that straddles the cutover into two ranges meeting at the cutover,
     * so that no single fetch spans both resolutions.
     *
     * @param ranges Ranges to split
     * @return Ranges in the original order, straddling ones replaced by their two halves
     */
    public List<TimeRange> splitAtCutover(List<TimeRange> ranges) {
        List<TimeRange> result = new ArrayList<>(ranges.size() + 1);
        for (TimeRange range : ranges) {
            if (straddlesCutover(range)) {
                ZonedDateTime cutoverInstant = cutoverIn(range.start().getZone());
                result.add(new TimeRange(range.start(), cutoverInstant));
                result.add(new TimeRange(cutoverInstant, range.end()));
                log.debug("Split range at resolution cutover: {} -> [{}, {}) + [{}, {})",
                        range, range.start(), cutoverInstant, cutoverInstant, range.end());
            } else {
                result.add(range);
            }
        }
        return result;
    }

    /**
     * Counts the interval starts in [start, end) when stepping with the resolution in effect.
     */
    public long intervalsBetween(ZonedDateTime start, ZonedDateTime end) {
        long count = 0;
        ZonedDateTime current = firstIntervalStartAtOrAfter(start);
        while (current.isBefore(end)) {
            count++;
            current = nextIntervalStart(current);
        }
        return count;
    }
}
