package com.fintech.intervalpool.api;

import com.fintech.intervalpool.domain.PriceInterval;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Intervals of one subject for a requested range.
 */
@Schema(description = "Price intervals for a subject and range")
public record IntervalResponse(
    @Schema(description = "Subject the intervals belong to", example = "home-1")
    String subjectId,

    @Schema(description = "Zone the range was resolved in", example = "Europe/Berlin")
    String timeZone,

    @Schema(description = "Range start (inclusive)")
    OffsetDateTime start,

    @Schema(description = "Range end (exclusive)")
    OffsetDateTime end,

    @Schema(description = "Number of intervals returned", example = "96")
    int count,

    @Schema(description = "Intervals sorted by start")
    List<PriceInterval> intervals
) {

    public static IntervalResponse of(String subjectId, String timeZone,
                                      OffsetDateTime start, OffsetDateTime end,
                                      List<PriceInterval> intervals) {
        return new IntervalResponse(subjectId, timeZone, start, end, intervals.size(), intervals);
    }
}
