package com.fintech.intervalpool.service;

import com.fintech.intervalpool.config.IntervalPoolProperties;
import com.fintech.intervalpool.domain.PriceInterval;
import com.fintech.intervalpool.domain.SubjectContext;
import com.fintech.intervalpool.pool.IntervalPool;
import com.fintech.intervalpool.pool.PoolSettings;
import com.fintech.intervalpool.pool.PoolStats;
import com.fintech.intervalpool.pool.PoolValidationException;
import com.fintech.intervalpool.source.PriceRouter;
import com.fintech.intervalpool.storage.CorruptStateException;
import com.fintech.intervalpool.storage.PoolPersistence;
import com.fintech.intervalpool.storage.PoolState;
import com.fintech.intervalpool.util.ResolutionTimeline;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Registry of interval pools, one per subject.
 *
 * Responsibilities:
 * - Creating a pool on first access, restored from persisted state when present
 * - Resolving request parameters into a subject context
 * - Removing a subject together with its stored state
 * - Flushing pending saves on shutdown
 */
@Service
public class IntervalPoolService {

    private static final Logger log = LoggerFactory.getLogger(IntervalPoolService.class);

    private final IntervalPoolProperties properties;
    private final PoolSettings settings;
    private final ResolutionTimeline timeline;
    private final PriceRouter router;
    private final Clock poolClock;
    private final Clock wallClock;
    private final MeterRegistry meterRegistry;
    private final PoolPersistence persistence;
    private final ScheduledExecutorService scheduler;

    private final Map<String, IntervalPool> pools = new ConcurrentHashMap<>();

    public IntervalPoolService(
            IntervalPoolProperties properties,
            PoolSettings settings,
            ResolutionTimeline timeline,
            PriceRouter router,
            @Qualifier("poolClock") Clock poolClock,
            @Qualifier("wallClock") Clock wallClock,
            MeterRegistry meterRegistry,
            PoolPersistence persistence,
            ScheduledExecutorService scheduler) {
        this.properties = properties;
        this.settings = settings;
        this.timeline = timeline;
        this.router = router;
        this.poolClock = poolClock;
        this.wallClock = wallClock;
        this.meterRegistry = meterRegistry;
        this.persistence = properties.getPersistence().isEnabled() ? persistence : null;
        this.scheduler = scheduler;

        meterRegistry.gaugeMapSize("interval.pool.subjects", List.of(), pools);

        if (this.persistence == null) {
            log.info("Pool persistence disabled, pools are kept in memory only");
        }
    }

    /**
     * Builds a subject context, falling back to the configured default zone.
     *
     * @throws PoolValidationException on a blank subject id or an unknown zone
     */
    public SubjectContext contextFor(String subjectId, String timeZone) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new PoolValidationException("Subject id is required");
        }
        String zoneName = timeZone == null || timeZone.isBlank() ? properties.getDefaultTimeZone() : timeZone;
        try {
            return new SubjectContext(subjectId, ZoneId.of(zoneName));
        } catch (DateTimeException e) {
            throw new PoolValidationException("Unknown time zone: " + zoneName);
        }
    }

    /**
     * Returns the intervals of [start, end) for a subject, fetching what is missing.
     */
    public List<PriceInterval> getIntervals(SubjectContext context, ZonedDateTime start, ZonedDateTime end) {
        return poolFor(context).get(context, start, end);
    }

    /**
     * Returns the protected window of a subject.
     */
    public List<PriceInterval> getProtectedWindow(SubjectContext context, boolean includeTomorrow) {
        return poolFor(context).getProtectedWindow(context, includeTomorrow);
    }

    /**
     * Returns diagnostics for an existing pool.
     */
    public Optional<PoolStats> stats(String subjectId) {
        return Optional.ofNullable(pools.get(subjectId)).map(IntervalPool::stats);
    }

    /**
     * Drops a subject's pool and its stored state.
     *
     * @return true if a pool was loaded for the subject
     */
    public boolean removeSubject(String subjectId) {
        IntervalPool pool = pools.remove(subjectId);
        if (pool != null) {
            pool.shutdown(false);
        }
        if (persistence != null) {
            persistence.remove(subjectId);
        }
        log.info("Removed subject {} (pool loaded: {})", subjectId, pool != null);
        return pool != null;
    }

    /**
     * Returns the pool of a subject, creating or restoring it on first access.
     *
     * @throws PoolValidationException if the context is missing
     */
    public IntervalPool poolFor(SubjectContext context) {
        if (context == null) {
            throw new PoolValidationException("Subject context is required");
        }
        return pools.computeIfAbsent(context.subjectId(), id -> createPool(context));
    }

    public int poolCount() {
        return pools.size();
    }

    private IntervalPool createPool(SubjectContext context) {
        Optional<PoolState> stored = persistence != null
                ? persistence.load(context.subjectId())
                : Optional.empty();

        if (stored.isPresent()) {
            try {
                return IntervalPool.restore(stored.get(), context, settings, timeline, router,
                        poolClock, wallClock, meterRegistry, persistence, scheduler);
            } catch (CorruptStateException e) {
                log.warn("Discarding stored state for subject {}: {}", context.subjectId(), e.getMessage());
            }
        }

        log.info("Created interval pool for subject {} (zone {})", context.subjectId(), context.timeZone());
        return new IntervalPool(context, settings, timeline, router,
                poolClock, wallClock, meterRegistry, persistence, scheduler);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down {} interval pools", pools.size());
        pools.values().forEach(pool -> pool.shutdown(true));
    }
}
