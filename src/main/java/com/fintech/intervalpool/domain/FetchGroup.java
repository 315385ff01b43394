package com.fintech.intervalpool.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Batch of intervals that arrived with one fetch (or one touch), sorted by start.
 * Unit of allocation and unit of eviction.
 *
 * @param fetchedAt Wall time the batch was fetched
 * @param intervals Intervals in start order; the list is never modified, filtering yields a new group
 */
public record FetchGroup(OffsetDateTime fetchedAt, List<PriceInterval> intervals) {

    public FetchGroup {
        Objects.requireNonNull(fetchedAt, "fetchedAt cannot be null");
        intervals = List.copyOf(intervals);
    }

    public int size() {
        return intervals.size();
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    /**
     * Returns a copy of this group holding only the intervals accepted by the filter.
     * The position handed to the filter is the interval's index in this group.
     */
    public FetchGroup retain(PositionFilter filter) {
        List<PriceInterval> kept = new ArrayList<>(intervals.size());
        for (int position = 0; position < intervals.size(); position++) {
            PriceInterval interval = intervals.get(position);
            if (filter.keep(interval, position)) {
                kept.add(interval);
            }
        }
        return new FetchGroup(fetchedAt, kept);
    }

    /** Returns true if any interval matches. */
    public boolean anyMatch(Predicate<PriceInterval> predicate) {
        return intervals.stream().anyMatch(predicate);
    }

    /** Filter over (interval, position) pairs. */
    @FunctionalInterface
    public interface PositionFilter {
        boolean keep(PriceInterval interval, int position);
    }
}
