package com.fintech.intervalpool.pool;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;

/**
 * Diagnostic snapshot of one pool.
 *
 * @param subjectId Subject served by the pool
 * @param protectedIntervalsCount Cached intervals inside the protected range (15-minute grid)
 * @param protectedIntervalsExpected Intervals the protected range holds at 15-minute resolution
 * @param protectedIntervalsHasGaps True if the protected range is not fully cached
 * @param cacheIntervalsTotal Live intervals in the pool
 * @param cacheIntervalsLimit Garbage collector ceiling
 * @param cacheFillPercent Total relative to the ceiling, one decimal
 * @param cacheIntervalsExtra Live intervals outside the protected range
 * @param lastFetch Most recent fetch time, null for an empty pool
 * @param oldestInterval Earliest cached interval start, null for an empty pool
 * @param newestInterval Latest cached interval start, null for an empty pool
 * @param fetchGroupCount Number of fetch groups
 */
public record PoolStats(
    String subjectId,
    int protectedIntervalsCount,
    int protectedIntervalsExpected,
    boolean protectedIntervalsHasGaps,
    int cacheIntervalsTotal,
    int cacheIntervalsLimit,
    double cacheFillPercent,
    int cacheIntervalsExtra,
    OffsetDateTime lastFetch,
    LocalDateTime oldestInterval,
    LocalDateTime newestInterval,
    int fetchGroupCount
) {
}
