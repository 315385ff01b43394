package com.fintech.intervalpool.pool;

import com.fintech.intervalpool.domain.PriceInterval;
import com.fintech.intervalpool.domain.Resolution;
import com.fintech.intervalpool.domain.TimeRange;
import com.fintech.intervalpool.util.ResolutionTimeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Computes the sub-ranges of a request that the cache does not cover.
 *
 * Each cached interval covers [start, start + width), where the width depends on which
 * side of the resolution cutover the interval starts. Gaps are reported:
 * <ul>
 *   <li>before the first cached interval, if it starts more than the tolerance after the range start</li>
 *   <li>between two cached intervals, if they are more than width + step tolerance apart, measured
 *       both as instants and as local wall time so neither DST transition reads as a gap</li>
 *   <li>after the last cached interval, if at least one full width is left uncovered</li>
 * </ul>
 * Gaps straddling the cutover are split there so that no fetch spans both resolutions.
 */
public class GapDetector {

    private static final Logger log = LoggerFactory.getLogger(GapDetector.class);

    private final ResolutionTimeline timeline;

    public GapDetector(ResolutionTimeline timeline) {
        this.timeline = timeline;
    }

    /**
     * Finds the missing sub-ranges of [start, end).
     *
     * @param cachedIntervals Cached intervals, may include intervals outside the range
     * @param start Range start (inclusive)
     * @param end Range end (exclusive)
     * @return Missing ranges in time order, empty when the range is fully covered
     */
    public List<TimeRange> detectGaps(List<PriceInterval> cachedIntervals, ZonedDateTime start, ZonedDateTime end) {
        TimeRange requested = new TimeRange(start, end);
        ZoneId zone = start.getZone();

        List<ZonedDateTime> starts = cachedIntervals.stream()
            .map(interval -> interval.startsAt().atZoneSameInstant(zone))
            .filter(requested::contains)
            .sorted(Comparator.naturalOrder())
            .toList();

        if (starts.isEmpty()) {
            log.debug("No cached intervals in {}, whole range is missing", requested);
            return timeline.splitAtCutover(List.of(requested));
        }

        List<TimeRange> missing = new ArrayList<>();

        ZonedDateTime first = starts.get(0);
        if (Duration.between(start, first).compareTo(timeline.tolerance()) > 0) {
            missing.add(new TimeRange(start, first));
            log.trace("Missing range before first cached interval: {} to {}", start, first);
        }

        for (int i = 0; i < starts.size() - 1; i++) {
            ZonedDateTime current = starts.get(i);
            ZonedDateTime next = starts.get(i + 1);
            Resolution resolution = timeline.resolutionAt(current);
            Duration expected = resolution.width().plus(timeline.stepTolerance());
            // The instant step covers a skipped DST hour, the local step a repeated one
            Duration instantStep = Duration.between(current, next);
            Duration localStep = Duration.between(current.toLocalDateTime(), next.toLocalDateTime());
            Duration step = instantStep.compareTo(localStep) <= 0 ? instantStep : localStep;
            if (step.compareTo(expected) > 0) {
                ZonedDateTime currentEnd = resolution.intervalEnd(current);
                missing.add(new TimeRange(currentEnd, next));
                log.trace("Missing range between cached intervals: {} to {} (expected step {} min)",
                        currentEnd, next, resolution.toMinutes());
            }
        }

        ZonedDateTime last = starts.get(starts.size() - 1);
        Resolution lastResolution = timeline.resolutionAt(last);
        ZonedDateTime lastEnd = lastResolution.intervalEnd(last);
        if (Duration.between(lastEnd, end).compareTo(lastResolution.width()) >= 0) {
            missing.add(new TimeRange(lastEnd, end));
            log.trace("Missing range after last cached interval: {} to {}", lastEnd, end);
        }

        if (missing.isEmpty()) {
            log.debug("Full coverage for {}: {} cached intervals", requested, starts.size());
            return missing;
        }
        return timeline.splitAtCutover(missing);
    }
}
