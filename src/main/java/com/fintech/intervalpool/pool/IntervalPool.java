package com.fintech.intervalpool.pool;

import com.fintech.intervalpool.domain.FetchGroup;
import com.fintech.intervalpool.domain.PriceInterval;
import com.fintech.intervalpool.domain.SubjectContext;
import com.fintech.intervalpool.domain.TimeRange;
import com.fintech.intervalpool.source.PriceRouter;
import com.fintech.intervalpool.storage.CorruptStateException;
import com.fintech.intervalpool.storage.PoolPersistence;
import com.fintech.intervalpool.storage.PoolState;
import com.fintech.intervalpool.util.ResolutionTimeline;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Interval cache for one subject.
 *
 * A {@link #get} call reads the cached intervals of the range through the timestamp index,
 * detects the gaps, fetches each gap through the router and inserts the results, runs the
 * garbage collector once per inserted batch, and finally re-reads the range from the cache.
 *
 * Insertion splits incoming intervals into new ones (appended as their own group) and
 * touched ones (already cached). A touched interval is not copied: the cached instance is
 * referenced again from a new group stamped with the new fetch time and the index is
 * re-pointed there, leaving a dead copy for the collector.
 *
 * Every change (re)starts a debounced save. Only one save task is live at a time; a new
 * change cancels and replaces it. The state is snapshotted under the pool lock, then written
 * under a separate save lock, so a write never waits for a fetch and an older snapshot never
 * overwrites a newer one.
 *
 * All calls against one pool are serialized by a per-pool lock.
 */
public class IntervalPool {

    private static final Logger log = LoggerFactory.getLogger(IntervalPool.class);

    private static final Duration STATS_STEP = Duration.ofMinutes(15);

    /** Debounce state of the persisted save. */
    public enum SaveState {
        IDLE,
        PENDING
    }

    private final SubjectContext context;
    private final PoolSettings settings;
    private final ResolutionTimeline timeline;
    private final Clock poolClock;
    private final MeterRegistry meterRegistry;
    private final PoolPersistence persistence;
    private final ScheduledExecutorService scheduler;

    private final FetchGroupCache cache;
    private final TimestampIndex index;
    private final GarbageCollector gc;
    private final GapDetector gapDetector;
    private final IntervalFetcher fetcher;

    private final ReentrantLock poolLock = new ReentrantLock();
    private final ReentrantLock saveLock = new ReentrantLock();
    private final ReentrantLock debounceLock = new ReentrantLock();

    private ScheduledFuture<?> pendingSave;
    private long saveGeneration;

    // guarded by poolLock
    private long snapshotSequence;
    // guarded by saveLock
    private long writtenSequence;
    private volatile boolean shutdown;

    private final Counter touchedCounter;
    private final Counter addedCounter;

    /**
     * Creates an empty pool.
     *
     * @param context Subject served by this pool, immutable
     * @param settings Ceiling, protected range and debounce delay
     * @param timeline Resolution cutover and tolerances
     * @param router Upstream endpoint selection
     * @param poolClock Clock deciding "today" for the protected range, may be shifted
     * @param wallClock Real clock used for fetch timestamps
     * @param meterRegistry Metrics sink
     * @param persistence Save target, or null to keep the pool in memory only
     * @param scheduler Runs debounced saves, or null to keep the pool in memory only
     */
    public IntervalPool(SubjectContext context,
                        PoolSettings settings,
                        ResolutionTimeline timeline,
                        PriceRouter router,
                        Clock poolClock,
                        Clock wallClock,
                        MeterRegistry meterRegistry,
                        PoolPersistence persistence,
                        ScheduledExecutorService scheduler) {
        this.context = context;
        this.settings = settings;
        this.timeline = timeline;
        this.poolClock = poolClock;
        this.meterRegistry = meterRegistry;
        this.persistence = persistence;
        this.scheduler = scheduler;

        String subjectId = context.subjectId();
        this.cache = new FetchGroupCache(poolClock, context.timeZone(),
                settings.protectedDaysBefore(), settings.protectedDaysAfter());
        this.index = new TimestampIndex();
        this.gc = new GarbageCollector(cache, index, subjectId, settings.maxIntervals(), meterRegistry);
        this.gapDetector = new GapDetector(timeline);
        this.fetcher = new IntervalFetcher(router, wallClock, subjectId, meterRegistry);

        this.touchedCounter = meterRegistry.counter("interval.pool.intervals.touched", "subject", subjectId);
        this.addedCounter = meterRegistry.counter("interval.pool.intervals.added", "subject", subjectId);
    }

    /**
     * Returns all intervals starting in [start, end), fetching whatever the cache is missing.
     *
     * @param requestContext Subject context; must name this pool's subject
     * @param start Range start (inclusive)
     * @param end Range end (exclusive)
     * @return Intervals sorted by start
     * @throws PoolValidationException on a missing or foreign context, or an empty range
     * @throws com.fintech.intervalpool.source.UpstreamException if a gap fetch fails; gaps
     *         inserted before the failure stay cached
     */
    public List<PriceInterval> get(SubjectContext requestContext, ZonedDateTime start, ZonedDateTime end) {
        validate(requestContext, start, end);

        ZonedDateTime rangeStart = start.withZoneSameInstant(context.timeZone());
        ZonedDateTime rangeEnd = end.withZoneSameInstant(context.timeZone());

        Timer.Sample sample = Timer.start(meterRegistry);
        poolLock.lock();
        try {
            log.debug("Pool request for subject {}: {} to {}", context.subjectId(), rangeStart, rangeEnd);

            List<PriceInterval> cached = readCachedIntervals(rangeStart, rangeEnd);
            List<TimeRange> gaps = gapDetector.detectGaps(cached, rangeStart, rangeEnd);

            if (gaps.isEmpty()) {
                log.debug("Full coverage for subject {}: {} cached intervals, no fetch needed",
                        context.subjectId(), cached.size());
                return cached;
            }

            log.debug("Coverage check for subject {}: {} range(s) missing", context.subjectId(), gaps.size());
            fetcher.fetchMissingRanges(context, gaps, this::insert);

            List<PriceInterval> result = readCachedIntervals(rangeStart, rangeEnd);
            log.debug("Pool returning {} intervals for subject {} ({} cached before, {} ranges fetched)",
                    result.size(), context.subjectId(), cached.size(), gaps.size());
            return result;

        } finally {
            poolLock.unlock();
            sample.stop(meterRegistry.timer("interval.pool.get.time", "subject", context.subjectId()));
        }
    }

    /**
     * Returns the whole protected window (day-before-yesterday through the end of tomorrow).
     * Fetching stops at the end of today unless {@code includeTomorrow} is set, but cached
     * intervals for tomorrow are always returned.
     */
    public List<PriceInterval> getProtectedWindow(SubjectContext requestContext, boolean includeTomorrow) {
        ZoneId zone = context.timeZone();
        poolLock.lock();
        try {
            ProtectedRange range = cache.protectedRange();
            ZonedDateTime windowStart = range.start().atZone(zone);
            ZonedDateTime windowEnd = range.end().atZone(zone);
            ZonedDateTime fetchEnd = includeTomorrow
                    ? windowEnd
                    : LocalDate.now(poolClock.withZone(zone)).plusDays(1).atStartOfDay(zone);

            log.debug("Protected window request for subject {}: fetch {} to {}, return up to {}",
                    context.subjectId(), windowStart, fetchEnd, windowEnd);

            get(requestContext, windowStart, fetchEnd);
            return readCachedIntervals(windowStart, windowEnd);
        } finally {
            poolLock.unlock();
        }
    }

    /**
     * Inserts intervals fetched at {@code fetchedAt}, runs the collector and schedules a save.
     *
     * @return true if anything in the pool changed
     */
    public boolean addIntervals(List<PriceInterval> intervals, OffsetDateTime fetchedAt) {
        poolLock.lock();
        try {
            return insert(intervals, fetchedAt);
        } finally {
            poolLock.unlock();
        }
    }

    private boolean insert(List<PriceInterval> intervals, OffsetDateTime fetchedAt) {
        if (intervals.isEmpty()) {
            return false;
        }

        // Keyed by normalized start: sorted, and a duplicate in one batch keeps the last value
        Map<LocalDateTime, PriceInterval> fresh = new TreeMap<>();
        Set<LocalDateTime> touched = new TreeSet<>();
        for (PriceInterval interval : intervals) {
            LocalDateTime key = interval.normalizedStart();
            if (index.contains(key)) {
                touched.add(key);
            } else {
                fresh.put(key, interval);
            }
        }

        if (!touched.isEmpty()) {
            touch(touched, fetchedAt);
        }

        if (!fresh.isEmpty()) {
            List<PriceInterval> newIntervals = new ArrayList<>(fresh.values());
            int groupId = cache.addGroup(newIntervals, fetchedAt);
            for (int position = 0; position < newIntervals.size(); position++) {
                index.add(newIntervals.get(position), groupId, position);
            }
            addedCounter.increment(newIntervals.size());
            log.debug("Added fetch group {} for subject {}: {} new intervals (fetched at {})",
                    groupId, context.subjectId(), newIntervals.size(), fetchedAt);
        } else {
            log.debug("All {} intervals already cached for subject {} (touched only)",
                    intervals.size(), context.subjectId());
        }

        gc.runGc();
        scheduleSave();
        return true;
    }

    /**
     * Moves cached intervals into a new group without copying them.
     */
    private void touch(Set<LocalDateTime> timestamps, OffsetDateTime fetchedAt) {
        List<PriceInterval> existing = new ArrayList<>(timestamps.size());
        List<LocalDateTime> keys = new ArrayList<>(timestamps.size());
        for (LocalDateTime timestamp : timestamps) {
            Optional<IntervalLocation> location = index.get(timestamp);
            if (location.isPresent()) {
                existing.add(cache.intervalAt(location.get()));
                keys.add(timestamp);
            }
        }

        int groupId = cache.addGroup(existing, fetchedAt);
        List<TimestampIndex.IndexUpdate> updates = new ArrayList<>(keys.size());
        for (int position = 0; position < keys.size(); position++) {
            updates.add(new TimestampIndex.IndexUpdate(keys.get(position), groupId, position));
        }
        index.batchUpdate(updates);

        touchedCounter.increment(keys.size());
        log.debug("Touched {} cached intervals for subject {} (moved to fetch group {}, fetched at {})",
                keys.size(), context.subjectId(), groupId, fetchedAt);
    }

    /**
     * Reads the cached intervals of a range by point lookups on the expected interval starts.
     * Stepping runs on local wall time like the index keys, so the repeated hour of a DST
     * fall-back day is read once.
     */
    private List<PriceInterval> readCachedIntervals(ZonedDateTime start, ZonedDateTime end) {
        List<PriceInterval> result = new ArrayList<>();
        LocalDateTime localEnd = end.toLocalDateTime();
        LocalDateTime current = timeline.firstIntervalStartAtOrAfter(start.toLocalDateTime());
        while (current.isBefore(localEnd)) {
            Optional<IntervalLocation> location = index.get(current);
            if (location.isPresent()) {
                result.add(cache.intervalAt(location.get()));
            }
            current = timeline.nextIntervalStart(current);
        }
        log.trace("Read {} cached intervals for subject {} ({} to {})", result.size(), context.subjectId(), start, end);
        return result;
    }

    private void validate(SubjectContext requestContext, ZonedDateTime start, ZonedDateTime end) {
        if (requestContext == null) {
            throw new PoolValidationException("Subject context is required");
        }
        if (!context.subjectId().equals(requestContext.subjectId())) {
            throw new PoolValidationException("Pool for subject " + context.subjectId()
                    + " cannot serve subject " + requestContext.subjectId());
        }
        if (start == null || end == null) {
            throw new PoolValidationException("Range start and end are required");
        }
        if (!start.isBefore(end)) {
            throw new PoolValidationException("Invalid time range: start (" + start + ") must be before end (" + end + ")");
        }
    }

    // ---------------------------------------------------------------- persistence

    private void scheduleSave() {
        if (persistence == null || scheduler == null || shutdown) {
            return;
        }
        debounceLock.lock();
        try {
            if (pendingSave != null && !pendingSave.isDone()) {
                pendingSave.cancel(false);
                log.debug("Cancelled pending save for subject {} (new changes, resetting timer)", context.subjectId());
            }
            long generation = ++saveGeneration;
            pendingSave = scheduler.schedule(() -> runDebouncedSave(generation),
                    settings.debounce().toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            debounceLock.unlock();
        }
    }

    private void runDebouncedSave(long generation) {
        debounceLock.lock();
        try {
            if (generation != saveGeneration) {
                return;
            }
            pendingSave = null;
        } finally {
            debounceLock.unlock();
        }

        // The save thread is shared by all pools: never wait for a fetch in progress
        if (!poolLock.tryLock()) {
            if (!shutdown) {
                log.debug("Pool for subject {} is busy, deferring save", context.subjectId());
                scheduleSave();
                return;
            }
            poolLock.lock();
        }
        Snapshot snapshot;
        try {
            snapshot = snapshot();
        } finally {
            poolLock.unlock();
        }
        write(snapshot);
    }

    /**
     * Writes the current live state immediately.
     *
     * @return true if the state was written; false without persistence or on a storage failure
     */
    public boolean saveNow() {
        if (persistence == null) {
            return false;
        }
        Snapshot snapshot;
        poolLock.lock();
        try {
            snapshot = snapshot();
        } finally {
            poolLock.unlock();
        }
        return write(snapshot);
    }

    private Snapshot snapshot() {
        return new Snapshot(toState(), ++snapshotSequence);
    }

    private boolean write(Snapshot snapshot) {
        saveLock.lock();
        try {
            if (snapshot.sequence() < writtenSequence) {
                log.debug("Skipping stale snapshot {} for subject {} (snapshot {} already written)",
                        snapshot.sequence(), context.subjectId(), writtenSequence);
                return true;
            }
            boolean saved = persistence.save(snapshot.state());
            if (saved) {
                writtenSequence = snapshot.sequence();
            }
            return saved;
        } finally {
            saveLock.unlock();
        }
    }

    private record Snapshot(PoolState state, long sequence) {
    }

    /** Returns PENDING while a debounced save is scheduled. */
    public SaveState saveState() {
        debounceLock.lock();
        try {
            return pendingSave != null && !pendingSave.isDone() ? SaveState.PENDING : SaveState.IDLE;
        } finally {
            debounceLock.unlock();
        }
    }

    /**
     * Cancels the pending save; flushes it immediately when {@code flush} is set and one was pending.
     * No further saves are scheduled afterwards.
     */
    public void shutdown(boolean flush) {
        log.debug("Shutting down interval pool for subject {}", context.subjectId());
        shutdown = true;

        boolean wasPending;
        debounceLock.lock();
        try {
            wasPending = pendingSave != null && !pendingSave.isDone();
            if (pendingSave != null) {
                pendingSave.cancel(false);
                pendingSave = null;
            }
            saveGeneration++;
        } finally {
            debounceLock.unlock();
        }

        if (flush && wasPending) {
            saveNow();
        }
    }

    /**
     * Serializes the live intervals. Dead copies and groups left without live intervals are skipped.
     */
    public PoolState toState() {
        poolLock.lock();
        try {
            List<FetchGroup> groups = cache.groups();
            List<PoolState.FetchGroupState> states = new ArrayList<>(groups.size());
            for (int groupId = 0; groupId < groups.size(); groupId++) {
                final int id = groupId;
                FetchGroup live = groups.get(groupId).retain((interval, position) ->
                        index.get(interval.normalizedStart())
                                .map(location -> location.pointsAt(id, position))
                                .orElse(false));
                if (!live.isEmpty()) {
                    states.add(PoolState.FetchGroupState.from(live));
                }
            }
            return PoolState.of(context.subjectId(), states);
        } finally {
            poolLock.unlock();
        }
    }

    /**
     * Rebuilds a pool from persisted state without contacting the source.
     *
     * @throws CorruptStateException if the state belongs to another subject
     */
    public static IntervalPool restore(PoolState state,
                                       SubjectContext context,
                                       PoolSettings settings,
                                       ResolutionTimeline timeline,
                                       PriceRouter router,
                                       Clock poolClock,
                                       Clock wallClock,
                                       MeterRegistry meterRegistry,
                                       PoolPersistence persistence,
                                       ScheduledExecutorService scheduler) {
        if (!context.subjectId().equals(state.subjectId())) {
            throw new CorruptStateException("State for subject " + state.subjectId()
                    + " cannot restore pool for " + context.subjectId());
        }

        IntervalPool pool = new IntervalPool(context, settings, timeline, router, poolClock, wallClock,
                meterRegistry, persistence, scheduler);
        List<Integer> groupIds;
        try {
            groupIds = pool.cache.fromState(state.fetchGroups());
            for (int i = 0; i < groupIds.size(); i++) {
                int groupId = groupIds.get(i);
                List<PriceInterval> intervals = pool.cache.group(groupId).intervals();
                for (int position = 0; position < intervals.size(); position++) {
                    pool.index.add(intervals.get(position), groupId, position);
                }
            }
        } catch (RuntimeException e) {
            throw new CorruptStateException("State for subject " + context.subjectId()
                    + " holds an invalid fetch group", e);
        }

        log.info("Interval pool restored for subject {}: {} groups, {} intervals",
                context.subjectId(), groupIds.size(), pool.cache.totalIntervalCount());
        return pool;
    }

    // ---------------------------------------------------------------- diagnostics

    /**
     * Builds a diagnostic snapshot: protected-range coverage on a 15-minute grid, cache fill and timestamps.
     */
    public PoolStats stats() {
        poolLock.lock();
        try {
            ZoneId zone = context.timeZone();
            ProtectedRange range = cache.protectedRange();
            ZonedDateTime start = range.start().atZone(zone);
            ZonedDateTime end = range.end().atZone(zone);

            int expected = (int) (Duration.between(start, end).toMinutes() / STATS_STEP.toMinutes());
            int present = 0;
            for (ZonedDateTime current = start; current.isBefore(end); current = current.plus(STATS_STEP)) {
                if (index.contains(current.toLocalDateTime())) {
                    present++;
                }
            }

            int total = index.count();
            int limit = gc.maxIntervals();
            double fillPercent = limit > 0 ? Math.round(total * 1000.0 / limit) / 10.0 : 0.0;

            List<FetchGroup> groups = cache.groups();
            OffsetDateTime lastFetch = groups.stream()
                    .map(FetchGroup::fetchedAt)
                    .max(Comparator.naturalOrder())
                    .orElse(null);
            Set<LocalDateTime> timestamps = index.timestamps();
            LocalDateTime oldest = timestamps.stream().min(Comparator.naturalOrder()).orElse(null);
            LocalDateTime newest = timestamps.stream().max(Comparator.naturalOrder()).orElse(null);

            return new PoolStats(
                context.subjectId(),
                present,
                expected,
                present < expected,
                total,
                limit,
                fillPercent,
                Math.max(0, total - present),
                lastFetch,
                oldest,
                newest,
                groups.size()
            );
        } finally {
            poolLock.unlock();
        }
    }

    public String subjectId() {
        return context.subjectId();
    }

    public SubjectContext context() {
        return context;
    }

    /** Returns the number of live intervals. */
    public int size() {
        return index.count();
    }

    FetchGroupCache fetchGroupCache() {
        return cache;
    }

    TimestampIndex timestampIndex() {
        return index;
    }

    GarbageCollector garbageCollector() {
        return gc;
    }
}
