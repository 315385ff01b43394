package com.fintech.intervalpool.pool;

import com.fintech.intervalpool.domain.FetchGroup;
import com.fintech.intervalpool.domain.PriceInterval;
import com.fintech.intervalpool.storage.PoolState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only list of fetch groups plus the protected date range.
 *
 * Group ids are positions in the list. They stay stable until the garbage collector
 * replaces the list, after which the timestamp index is rebuilt.
 *
 * Protected range: day-before-yesterday 00:00 up to (exclusive) day-after-tomorrow 00:00
 * in the subject's zone. "Today" comes from the injected clock, which may be shifted for
 * simulation. The range is cached and recomputed when the calendar date rolls over.
 */
public class FetchGroupCache {

    private static final Logger log = LoggerFactory.getLogger(FetchGroupCache.class);

    public static final int DEFAULT_PROTECTED_DAYS_BEFORE = 2;
    public static final int DEFAULT_PROTECTED_DAYS_AFTER = 2;

    private final Clock clock;
    private final ZoneId zone;
    private final int protectedDaysBefore;
    private final int protectedDaysAfter;

    private List<FetchGroup> groups = new ArrayList<>();

    private ProtectedRange protectedRangeCache;
    private LocalDate protectedRangeDate;

    public FetchGroupCache(Clock clock, ZoneId zone) {
        this(clock, zone, DEFAULT_PROTECTED_DAYS_BEFORE, DEFAULT_PROTECTED_DAYS_AFTER);
    }

    public FetchGroupCache(Clock clock, ZoneId zone, int protectedDaysBefore, int protectedDaysAfter) {
        this.clock = clock;
        this.zone = zone;
        this.protectedDaysBefore = protectedDaysBefore;
        this.protectedDaysAfter = protectedDaysAfter;
    }

    /**
     * Appends a new fetch group.
     *
     * @param intervals Intervals sorted by start
     * @param fetchedAt When the intervals were fetched
     * @return Id of the new group
     */
    public int addGroup(List<PriceInterval> intervals, OffsetDateTime fetchedAt) {
        int groupId = groups.size();
        groups.add(new FetchGroup(fetchedAt, intervals));
        log.debug("Added fetch group {}: {} intervals (fetched at {})", groupId, intervals.size(), fetchedAt);
        return groupId;
    }

    /** Returns a read-only view of all groups in id order. */
    public List<FetchGroup> groups() {
        return Collections.unmodifiableList(groups);
    }

    public FetchGroup group(int groupId) {
        return groups.get(groupId);
    }

    /** Looks up the interval stored at a location. */
    public PriceInterval intervalAt(IntervalLocation location) {
        return groups.get(location.groupId()).intervals().get(location.position());
    }

    /**
     * Replaces all groups. Used by the garbage collector only; the caller rebuilds the index.
     */
    public void replaceGroups(List<FetchGroup> newGroups) {
        this.groups = new ArrayList<>(newGroups);
    }

    /**
     * Returns the protected range for the current calendar day, recomputing it after midnight.
     */
    public ProtectedRange protectedRange() {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        if (protectedRangeCache != null && today.equals(protectedRangeDate)) {
            return protectedRangeCache;
        }

        ProtectedRange range = new ProtectedRange(
            today.minusDays(protectedDaysBefore).atStartOfDay(),
            today.plusDays(protectedDaysAfter).atStartOfDay()
        );
        protectedRangeCache = range;
        protectedRangeDate = today;
        log.debug("Protected range for {}: {} to {}", today, range.startIso(), range.endIso());
        return range;
    }

    /** Returns true if the interval starts inside the protected range. */
    public boolean isProtected(PriceInterval interval) {
        return protectedRange().contains(interval.normalizedStart());
    }

    /** Counts intervals across all groups, dead copies included. */
    public int totalIntervalCount() {
        int total = 0;
        for (FetchGroup group : groups) {
            total += group.size();
        }
        return total;
    }

    public int groupCount() {
        return groups.size();
    }

    /**
     * Serializes every group as stored, dead copies included. The pool filters dead copies
     * before persisting.
     */
    public List<PoolState.FetchGroupState> toState() {
        List<PoolState.FetchGroupState> states = new ArrayList<>(groups.size());
        for (FetchGroup group : groups) {
            states.add(PoolState.FetchGroupState.from(group));
        }
        return states;
    }

    /**
     * Appends the serialized groups in order, returning their new ids.
     */
    public List<Integer> fromState(List<PoolState.FetchGroupState> states) {
        List<Integer> ids = new ArrayList<>(states.size());
        for (PoolState.FetchGroupState state : states) {
            FetchGroup group = state.toFetchGroup();
            ids.add(addGroup(group.intervals(), group.fetchedAt()));
        }
        return ids;
    }
}
