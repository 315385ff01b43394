package com.fintech.intervalpool.api;

import com.fintech.intervalpool.pool.PoolValidationException;
import com.fintech.intervalpool.source.UpstreamException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

/**
 * Maps pool and request failures to {@link ErrorResponse} bodies.
 * Client mistakes answer 400, a failing price source 502.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(PoolValidationException.class)
    public ResponseEntity<ErrorResponse> handlePoolValidation(PoolValidationException ex, WebRequest request) {
        log.warn("Rejected pool request on {}: {}", pathOf(request), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), request, List.of());
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex, WebRequest request) {
        List<String> details = ex.getConstraintViolations().stream()
            .map(violation -> lastNode(violation.getPropertyPath().toString()) + ": " + violation.getMessage())
            .sorted()
            .toList();
        log.warn("Invalid parameters on {}: {}", pathOf(request), details);
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed", request, details);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex,
                                                                WebRequest request) {
        log.warn("Missing parameter on {}: {}", pathOf(request), ex.getParameterName());
        return respond(HttpStatus.BAD_REQUEST, "MISSING_PARAMETER",
            "Required parameter '" + ex.getParameterName() + "' is missing", request, List.of());
    }

    /**
     * Raised for timestamps that are not ISO-8601 with an offset and for non-boolean flags.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex, WebRequest request) {
        log.warn("Unparseable parameter on {}: {}={}", pathOf(request), ex.getName(), ex.getValue());
        return respond(HttpStatus.BAD_REQUEST, "TYPE_MISMATCH",
            "Parameter '" + ex.getName() + "' has an invalid value", request,
            List.of(ex.getName() + ": " + ex.getValue()));
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<ErrorResponse> handleUpstream(UpstreamException ex, WebRequest request) {
        log.error("Price source failed on {} (status {}): {}", pathOf(request), ex.getStatusCode(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "UPSTREAM_ERROR",
            "Price source request failed: " + ex.getMessage(), request, List.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, WebRequest request) {
        log.error("Unexpected error on {}: {}", pathOf(request), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
            "Unexpected error while serving intervals", request, List.of());
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                  WebRequest request, List<String> details) {
        ErrorResponse body = new ErrorResponse(status.value(), error, message, pathOf(request), Instant.now(), details);
        return ResponseEntity.status(status).body(body);
    }

    private static String pathOf(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }

    private static String lastNode(String propertyPath) {
        int lastDot = propertyPath.lastIndexOf('.');
        return lastDot >= 0 ? propertyPath.substring(lastDot + 1) : propertyPath;
    }
}
