package com.fintech.intervalpool.pool;

import com.fintech.intervalpool.domain.FetchGroup;
import com.fintech.intervalpool.domain.PriceInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * O(1) lookup from a normalized interval start to the location of its authoritative copy.
 *
 * Keys are offset-free local timestamps truncated to whole seconds, so two copies of the
 * same interval collide regardless of sub-second digits or offset notation.
 *
 * Single writer: mutations come from the owning pool only. {@link #rebuild(List)} builds a
 * complete replacement map before publishing it, so readers see either the old or the new index.
 */
public class TimestampIndex {

    private static final Logger log = LoggerFactory.getLogger(TimestampIndex.class);

    private volatile Map<LocalDateTime, IntervalLocation> entries = new HashMap<>();

    /**
     * Indexes an interval at the given location, replacing any previous entry for its start.
     */
    public void add(PriceInterval interval, int groupId, int position) {
        entries.put(interval.normalizedStart(), new IntervalLocation(groupId, position));
    }

    public Optional<IntervalLocation> get(LocalDateTime timestamp) {
        return Optional.ofNullable(entries.get(normalize(timestamp)));
    }

    public Optional<IntervalLocation> get(OffsetDateTime timestamp) {
        return get(timestamp.toLocalDateTime());
    }

    public boolean contains(LocalDateTime timestamp) {
        return entries.containsKey(normalize(timestamp));
    }

    public boolean contains(OffsetDateTime timestamp) {
        return contains(timestamp.toLocalDateTime());
    }

    public void remove(LocalDateTime timestamp) {
        entries.remove(normalize(timestamp));
    }

    public void clear() {
        entries = new HashMap<>();
    }

    /**
     * Replaces the whole index with the locations found in the given groups.
     * Later groups win when a timestamp appears more than once.
     *
     * @param groups Fetch groups in group-id order
     */
    public void rebuild(List<FetchGroup> groups) {
        Map<LocalDateTime, IntervalLocation> rebuilt = new HashMap<>(Math.max(16, entries.size() * 2));
        for (int groupId = 0; groupId < groups.size(); groupId++) {
            List<PriceInterval> intervals = groups.get(groupId).intervals();
            for (int position = 0; position < intervals.size(); position++) {
                rebuilt.put(intervals.get(position).normalizedStart(), new IntervalLocation(groupId, position));
            }
        }
        entries = rebuilt;
        log.debug("Rebuilt index: {} timestamps indexed", rebuilt.size());
    }

    /**
     * Re-points several timestamps at once, e.g. after a touch moved them into a new group.
     */
    public void batchUpdate(List<IndexUpdate> updates) {
        for (IndexUpdate update : updates) {
            entries.put(normalize(update.timestamp()), new IntervalLocation(update.groupId(), update.position()));
        }
    }

    /** Returns the number of indexed timestamps (live intervals). */
    public int count() {
        return entries.size();
    }

    /** Returns a snapshot of all indexed timestamps. */
    public Set<LocalDateTime> timestamps() {
        return Set.copyOf(entries.keySet());
    }

    static LocalDateTime normalize(LocalDateTime timestamp) {
        return timestamp.truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * One re-pointing instruction for {@link #batchUpdate(List)}.
     */
    public record IndexUpdate(LocalDateTime timestamp, int groupId, int position) {
    }
}
