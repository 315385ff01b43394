package com.fintech.intervalpool.source;

import com.fintech.intervalpool.domain.PriceInterval;
import com.fintech.intervalpool.domain.SubjectContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Routes a range request to the recent or the historical endpoint.
 *
 * The boundary is day-before-yesterday 00:00 in the subject's zone, computed from the
 * real wall clock. The recent endpoint returns a window anchored to the real current day,
 * so a shifted pool clock must not move the boundary.
 *
 * Results are returned unfiltered; the pool caches everything and filters afterwards.
 */
public class PriceRouter {

    private static final Logger log = LoggerFactory.getLogger(PriceRouter.class);

    private final PriceSource source;
    private final Clock wallClock;

    public PriceRouter(PriceSource source, Clock wallClock) {
        this.source = source;
        this.wallClock = wallClock;
    }

    /**
     * Fetches all intervals the endpoints return for [start, end).
     *
     * @throws UpstreamException if either endpoint fails
     */
    public List<PriceInterval> fetch(SubjectContext context, ZonedDateTime start, ZonedDateTime end) {
        ZonedDateTime boundary = boundary(context.timeZone());
        String subjectId = context.subjectId();

        log.debug("Routing request for subject {}: {} to {}, boundary {}", subjectId, start, end, boundary);

        if (!end.isAfter(boundary)) {
            log.debug("Range is fully historical, using range endpoint");
            return source.fetchRange(subjectId, start, end);
        }
        if (!start.isBefore(boundary)) {
            log.debug("Range is fully recent, using recent endpoint");
            return source.fetchRecent(subjectId, context.timeZone());
        }

        log.debug("Range spans boundary, splitting request");
        List<PriceInterval> historical = source.fetchRange(subjectId, start, boundary);
        List<PriceInterval> recent = source.fetchRecent(subjectId, context.timeZone());

        List<PriceInterval> combined = new ArrayList<>(historical.size() + recent.size());
        combined.addAll(historical);
        combined.addAll(recent);
        return combined;
    }

    /** Returns day-before-yesterday midnight in the zone, from real time. */
    public ZonedDateTime boundary(ZoneId zone) {
        LocalDate today = LocalDate.now(wallClock.withZone(zone));
        return today.minusDays(2).atStartOfDay(zone);
    }
}
