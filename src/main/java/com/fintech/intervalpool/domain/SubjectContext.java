package com.fintech.intervalpool.domain;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Identifies the subject (home/account) a pool serves and the time zone its prices are published in.
 */
public record SubjectContext(String subjectId, ZoneId timeZone) {

    public SubjectContext {
        Objects.requireNonNull(subjectId, "Subject id cannot be null");
        Objects.requireNonNull(timeZone, "Time zone cannot be null");
        if (subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject id cannot be blank");
        }
    }
}
