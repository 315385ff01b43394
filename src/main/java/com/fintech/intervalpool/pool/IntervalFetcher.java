package com.fintech.intervalpool.pool;

import com.fintech.intervalpool.domain.PriceInterval;
import com.fintech.intervalpool.domain.SubjectContext;
import com.fintech.intervalpool.domain.TimeRange;
import com.fintech.intervalpool.source.PriceRouter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Fetches missing ranges through the router, one call per range, in order.
 * Each result is handed to the callback as soon as it arrives so the caller can cache it
 * before the next call; a failure aborts the remaining ranges.
 */
public class IntervalFetcher {

    private static final Logger log = LoggerFactory.getLogger(IntervalFetcher.class);

    private final PriceRouter router;
    private final Clock wallClock;
    private final Counter fetchCounter;

    public IntervalFetcher(PriceRouter router, Clock wallClock, String subjectId, MeterRegistry meterRegistry) {
        this.router = router;
        this.wallClock = wallClock;
        this.fetchCounter = meterRegistry.counter("interval.pool.fetches", "subject", subjectId);
    }

    /**
     * Fetches every gap sequentially.
     *
     * @param context Subject to fetch for
     * @param gaps Missing ranges, one upstream call each
     * @param onFetched Receives (intervals, fetch time) after each call
     * @return Fetched interval lists, one per gap
     * @throws com.fintech.intervalpool.source.UpstreamException from the first failing call
     */
    public List<List<PriceInterval>> fetchMissingRanges(SubjectContext context, List<TimeRange> gaps,
                                                        BiConsumer<List<PriceInterval>, OffsetDateTime> onFetched) {
        OffsetDateTime fetchTime = OffsetDateTime.now(wallClock);
        List<List<PriceInterval>> results = new ArrayList<>(gaps.size());

        for (int i = 0; i < gaps.size(); i++) {
            TimeRange gap = gaps.get(i);
            log.debug("Fetching range {}/{} for subject {}: {}", i + 1, gaps.size(), context.subjectId(), gap);

            List<PriceInterval> fetched = router.fetch(context, gap.start(), gap.end());
            fetchCounter.increment();
            results.add(fetched);

            log.debug("Received {} intervals for subject {}", fetched.size(), context.subjectId());
            if (onFetched != null) {
                onFetched.accept(fetched, fetchTime);
            }
        }
        return results;
    }
}
