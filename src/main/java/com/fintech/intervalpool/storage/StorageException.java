package com.fintech.intervalpool.storage;

/**
 * Failure while reading or writing persisted pool state.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
