package com.fintech.intervalpool.source;

/**
 * Failure reported by the remote price source.
 * Carries the upstream status code when one is known, 0 otherwise.
 */
public class UpstreamException extends RuntimeException {

    private final int statusCode;

    public UpstreamException(String message) {
        this(0, message, null);
    }

    public UpstreamException(String message, Throwable cause) {
        this(0, message, cause);
    }

    public UpstreamException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
