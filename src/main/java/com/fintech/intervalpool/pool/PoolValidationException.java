package com.fintech.intervalpool.pool;

/**
 * Invalid request against a pool: missing or foreign subject context, or an empty range.
 * Never retried.
 */
public class PoolValidationException extends RuntimeException {

    public PoolValidationException(String message) {
        super(message);
    }
}
