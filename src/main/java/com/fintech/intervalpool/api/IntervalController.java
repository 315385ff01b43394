package com.fintech.intervalpool.api;

import com.fintech.intervalpool.domain.PriceInterval;
import com.fintech.intervalpool.domain.SubjectContext;
import com.fintech.intervalpool.pool.PoolStats;
import com.fintech.intervalpool.service.IntervalPoolService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * REST API for querying cached price intervals.
 * Requests go through the subject's interval pool, so only missing ranges reach the price source.
 */
@RestController
@RequestMapping("/api/v1")
@Validated
@Tag(name = "Price Intervals", description = "Gap-aware price interval cache API")
public class IntervalController {

    private static final Logger log = LoggerFactory.getLogger(IntervalController.class);

    private static final String SUBJECT_PATTERN = "^[A-Za-z0-9._-]{1,64}$";

    private final IntervalPoolService poolService;
    private final MeterRegistry meterRegistry;

    public IntervalController(IntervalPoolService poolService, MeterRegistry meterRegistry) {
        this.poolService = poolService;
        this.meterRegistry = meterRegistry;
    }

    /**
     * GET /api/v1/intervals
     *
     * Returns the intervals of [start, end) for a subject, fetching only what the pool is missing.
     */
    @Operation(
        summary = "Get price intervals for a range",
        description = """
            Returns all price intervals starting in [start, end).
            Hourly before 2025-10-01, quarter-hourly from then on.

            **Example Request:**
            ```
            GET /api/v1/intervals?subjectId=home-1&start=2025-11-23T00:00:00%2B01:00&end=2025-11-24T00:00:00%2B01:00
            ```
            """,
        tags = {"Price Intervals"}
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successfully retrieved intervals",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = IntervalResponse.class)
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request parameters (e.g., start not before end)",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class),
                examples = @ExampleObject(
                    name = "Validation Error",
                    value = """
                        {
                          "status": 400,
                          "error": "VALIDATION_ERROR",
                          "message": "Invalid time range: start (2025-11-24T00:00+01:00) must be before end (2025-11-23T00:00+01:00)",
                          "path": "/api/v1/intervals",
                          "timestamp": "2025-11-23T10:30:00Z"
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "502",
            description = "Price source failed",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class)
            )
        )
    })
    @GetMapping("/intervals")
    public ResponseEntity<IntervalResponse> getIntervals(
            @Parameter(description = "Subject (home/account) id", example = "home-1", required = true)
            @RequestParam
            @NotBlank(message = "Subject id is required and cannot be blank")
            @Pattern(regexp = SUBJECT_PATTERN, message = "Subject id must be 1-64 characters of letters, digits, '.', '_' or '-'")
            String subjectId,

            @Parameter(description = "Range start, ISO-8601 with offset", example = "2025-11-23T00:00:00+01:00", required = true)
            @RequestParam
            @NotNull(message = "Start is required")
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
            OffsetDateTime start,

            @Parameter(description = "Range end (exclusive), ISO-8601 with offset", example = "2025-11-24T00:00:00+01:00", required = true)
            @RequestParam
            @NotNull(message = "End is required")
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
            OffsetDateTime end,

            @Parameter(description = "Subject time zone; defaults to the configured zone", example = "Europe/Berlin")
            @RequestParam(required = false)
            String timeZone) {

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            SubjectContext context = poolService.contextFor(subjectId, timeZone);
            ZonedDateTime rangeStart = start.atZoneSameInstant(context.timeZone());
            ZonedDateTime rangeEnd = end.atZoneSameInstant(context.timeZone());

            List<PriceInterval> intervals = poolService.getIntervals(context, rangeStart, rangeEnd);

            log.debug("Interval query: subject={}, start={}, end={}, results={}",
                    subjectId, start, end, intervals.size());

            return ResponseEntity.ok(IntervalResponse.of(subjectId, context.timeZone().getId(),
                    start, end, intervals));
        } finally {
            sample.stop(meterRegistry.timer("api.intervals.request.time", "endpoint", "range"));
        }
    }

    /**
     * GET /api/v1/intervals/protected
     *
     * Returns the protected window: day-before-yesterday through the end of tomorrow.
     */
    @Operation(
        summary = "Get the protected window",
        description = """
            Returns the intervals from day-before-yesterday 00:00 to day-after-tomorrow 00:00.
            With includeTomorrow=false nothing after today is fetched, but cached data for
            tomorrow is still returned.
            """,
        tags = {"Price Intervals"}
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Successfully retrieved intervals"),
        @ApiResponse(responseCode = "400", description = "Invalid request parameters",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "502", description = "Price source failed",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/intervals/protected")
    public ResponseEntity<List<PriceInterval>> getProtectedWindow(
            @Parameter(description = "Subject (home/account) id", example = "home-1", required = true)
            @RequestParam
            @NotBlank(message = "Subject id is required and cannot be blank")
            @Pattern(regexp = SUBJECT_PATTERN, message = "Subject id must be 1-64 characters of letters, digits, '.', '_' or '-'")
            String subjectId,

            @Parameter(description = "Fetch tomorrow's prices as well", example = "true")
            @RequestParam(defaultValue = "true")
            boolean includeTomorrow,

            @Parameter(description = "Subject time zone; defaults to the configured zone", example = "Europe/Berlin")
            @RequestParam(required = false)
            String timeZone) {

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            SubjectContext context = poolService.contextFor(subjectId, timeZone);
            return ResponseEntity.ok(poolService.getProtectedWindow(context, includeTomorrow));
        } finally {
            sample.stop(meterRegistry.timer("api.intervals.request.time", "endpoint", "protected"));
        }
    }

    /**
     * GET /api/v1/pools/{subjectId}/stats
     */
    @Operation(
        summary = "Get pool statistics",
        description = "Returns protected-window coverage, cache fill level and timestamps of a loaded pool.",
        tags = {"Monitoring"}
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Pool statistics",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = PoolStats.class))),
        @ApiResponse(responseCode = "404", description = "No pool loaded for the subject")
    })
    @GetMapping("/pools/{subjectId}/stats")
    public ResponseEntity<PoolStats> getStats(@PathVariable String subjectId) {
        return poolService.stats(subjectId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * DELETE /api/v1/pools/{subjectId}
     *
     * Drops the subject's pool and its stored state.
     */
    @Operation(
        summary = "Remove a subject",
        description = "Discards the subject's pool and its persisted state.",
        tags = {"Monitoring"}
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "204", description = "Subject removed"),
        @ApiResponse(responseCode = "404", description = "No pool loaded for the subject")
    })
    @DeleteMapping("/pools/{subjectId}")
    public ResponseEntity<Void> removeSubject(@PathVariable String subjectId) {
        boolean removed = poolService.removeSubject(subjectId);
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
