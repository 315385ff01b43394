package com.fintech.intervalpool.storage;

/**
 * Persisted state that cannot be read back: malformed JSON, an unknown version,
 * or an older multi-subject layout. Callers treat it as "no prior state".
 */
public class CorruptStateException extends StorageException {

    public CorruptStateException(String message) {
        super(message);
    }

    public CorruptStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
