package com.fintech.intervalpool.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Error body of every non-2xx answer of the interval API.
 *
 * @param status HTTP status code
 * @param error Machine readable category: VALIDATION_ERROR, MISSING_PARAMETER, TYPE_MISMATCH, UPSTREAM_ERROR or INTERNAL_ERROR
 * @param message Human readable summary
 * @param path Request path
 * @param timestamp Time the error was produced
 * @param details One line per rejected parameter, omitted when empty
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@Schema(description = "Error response of the interval API")
public record ErrorResponse(
    @Schema(example = "400") int status,
    @Schema(example = "VALIDATION_ERROR") String error,
    @Schema(example = "Invalid time range: start must be before end") String message,
    @Schema(example = "/api/v1/intervals") String path,
    Instant timestamp,
    @Schema(example = "[\"subjectId: Subject id is required\"]") List<String> details
) {

    public ErrorResponse {
        details = details == null ? List.of() : List.copyOf(details);
    }
}
