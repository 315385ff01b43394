package com.fintech.intervalpool.pool;

import com.fintech.intervalpool.domain.FetchGroup;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reclaims memory held by superseded copies and keeps the pool under its interval ceiling.
 *
 * Phases:
 * <ol>
 *   <li>Dead sweep: drop every copy the index no longer points at.</li>
 *   <li>Empty-group removal, followed by an index rebuild whenever the sweep changed anything.</li>
 *   <li>Capacity check against the ceiling.</li>
 *   <li>Eviction of whole unprotected groups, oldest {@code fetchedAt} first.</li>
 *   <li>Index rebuild after eviction.</li>
 * </ol>
 *
 * When every group holds a protected interval the pool stays oversized; this is
 * logged at WARN and counted on {@code interval.pool.gc.capacity.exceeded}.
 */
public class GarbageCollector {

    private static final Logger log = LoggerFactory.getLogger(GarbageCollector.class);

    public static final int DEFAULT_MAX_INTERVALS = 960;

    private final FetchGroupCache cache;
    private final TimestampIndex index;
    private final String subjectId;
    private final int maxIntervals;

    private final Counter deadIntervalsCounter;
    private final Counter evictedGroupsCounter;
    private final Counter capacityExceededCounter;

    public GarbageCollector(FetchGroupCache cache, TimestampIndex index, String subjectId,
                            int maxIntervals, MeterRegistry meterRegistry) {
        this.cache = cache;
        this.index = index;
        this.subjectId = subjectId;
        this.maxIntervals = maxIntervals;
        this.deadIntervalsCounter = meterRegistry.counter("interval.pool.gc.dead.intervals", "subject", subjectId);
        this.evictedGroupsCounter = meterRegistry.counter("interval.pool.gc.evicted.groups", "subject", subjectId);
        this.capacityExceededCounter = meterRegistry.counter("interval.pool.gc.capacity.exceeded", "subject", subjectId);
    }

    /**
     * Runs one full collection pass.
     *
     * @return true if any group was filtered, removed or evicted
     */
    public boolean runGc() {
        List<FetchGroup> groups = cache.groups();

        List<FetchGroup> swept = new ArrayList<>(groups.size());
        int deadCount = sweepDeadIntervals(groups, swept);
        int emptyRemoved = removeEmptyGroups(swept);
        boolean structureChanged = deadCount > 0 || emptyRemoved > 0;

        if (structureChanged) {
            cache.replaceGroups(swept);
            index.rebuild(swept);
            deadIntervalsCounter.increment(deadCount);
            log.debug("GC for subject {}: removed {} dead intervals and {} empty groups",
                    subjectId, deadCount, emptyRemoved);
        }

        int total = cache.totalIntervalCount();
        if (total <= maxIntervals) {
            log.debug("GC for subject {}: {} intervals within limit {}, no eviction needed",
                    subjectId, total, maxIntervals);
            return structureChanged;
        }

        Set<Integer> evicted = selectGroupsToEvict(cache.groups(), total);
        if (evicted.isEmpty()) {
            return structureChanged;
        }

        List<FetchGroup> current = cache.groups();
        List<FetchGroup> survivors = new ArrayList<>(current.size() - evicted.size());
        for (int groupId = 0; groupId < current.size(); groupId++) {
            if (!evicted.contains(groupId)) {
                survivors.add(current.get(groupId));
            }
        }
        cache.replaceGroups(survivors);
        index.rebuild(survivors);
        evictedGroupsCounter.increment(evicted.size());

        log.debug("GC for subject {}: evicted {} groups, {} intervals remaining",
                subjectId, evicted.size(), cache.totalIntervalCount());
        return true;
    }

    /**
     * Filters every group down to the copies the index still points at.
     *
     * @param groups Current groups in id order
     * @param target Receives the filtered groups, one per input group
     * @return Number of dead copies dropped
     */
    private int sweepDeadIntervals(List<FetchGroup> groups, List<FetchGroup> target) {
        int totalDead = 0;
        for (int groupId = 0; groupId < groups.size(); groupId++) {
            FetchGroup group = groups.get(groupId);
            final int id = groupId;
            FetchGroup live = group.retain((interval, position) -> {
                Optional<IntervalLocation> location = index.get(interval.normalizedStart());
                return location.isPresent() && location.get().pointsAt(id, position);
            });

            int dead = group.size() - live.size();
            if (dead > 0) {
                totalDead += dead;
                log.trace("GC for subject {}: {} dead intervals in group {}", subjectId, dead, groupId);
                target.add(live);
            } else {
                target.add(group);
            }
        }
        return totalDead;
    }

    private int removeEmptyGroups(List<FetchGroup> groups) {
        int before = groups.size();
        groups.removeIf(FetchGroup::isEmpty);
        return before - groups.size();
    }

    /**
     * Picks unprotected groups oldest-first until the projected total fits the ceiling.
     */
    private Set<Integer> selectGroupsToEvict(List<FetchGroup> groups, int total) {
        ProtectedRange range = cache.protectedRange();

        List<Integer> evictable = new ArrayList<>();
        for (int groupId = 0; groupId < groups.size(); groupId++) {
            if (!groups.get(groupId).anyMatch(cache::isProtected)) {
                evictable.add(groupId);
            }
        }
        evictable.sort(Comparator.comparing(groupId -> groups.get(groupId).fetchedAt()));

        log.debug("GC for subject {}: protected range {} to {}, {} protected groups, {} evictable",
                subjectId, range.startIso(), range.endIso(), groups.size() - evictable.size(), evictable.size());

        Set<Integer> evicted = new HashSet<>();
        int remaining = total;
        for (Integer groupId : evictable) {
            if (remaining <= maxIntervals) {
                break;
            }
            FetchGroup group = groups.get(groupId);
            evicted.add(groupId);
            remaining -= group.size();
            log.trace("GC for subject {}: evicting group {} fetched at {} ({} intervals, {} remaining)",
                    subjectId, groupId, group.fetchedAt(), group.size(), remaining);
        }

        if (evicted.isEmpty()) {
            capacityExceededCounter.increment();
            log.warn("GC cannot evict any group for subject {}: all {} intervals are protected (limit {})",
                    subjectId, total, maxIntervals);
        }
        return evicted;
    }

    public int maxIntervals() {
        return maxIntervals;
    }
}
