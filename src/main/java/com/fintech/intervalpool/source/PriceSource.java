package com.fintech.intervalpool.source;

import com.fintech.intervalpool.domain.PriceInterval;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Client for the remote price source.
 *
 * The source exposes two endpoints:
 * <ul>
 *   <li>a "recent" endpoint returning a fixed window around the real current day</li>
 *   <li>a "historical" endpoint returning an arbitrary past range</li>
 * </ul>
 *
 * Implementations own transport, authentication, retry and rate limiting. Any failure is
 * reported as {@link UpstreamException}; the pool propagates it unchanged.
 */
public interface PriceSource {

    /**
     * Fetches the recent window for a subject.
     * The returned window does not depend on any requested range.
     *
     * @param subjectId Subject to fetch for
     * @param zone Subject's time zone
     * @return Intervals sorted by start
     * @throws UpstreamException on any fetch failure
     */
    List<PriceInterval> fetchRecent(String subjectId, ZoneId zone);

    /**
     * Fetches historical intervals in [start, end).
     *
     * @param subjectId Subject to fetch for
     * @param start Range start (inclusive)
     * @param end Range end (exclusive)
     * @return Intervals sorted by start
     * @throws UpstreamException on any fetch failure
     */
    List<PriceInterval> fetchRange(String subjectId, ZonedDateTime start, ZonedDateTime end);
}
