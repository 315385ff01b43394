package com.fintech.intervalpool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Interval Pool Service
 *
 * Caches time-stamped price intervals fetched from a remote price source.
 *
 * Key Features:
 * - Gap detection: only the missing sub-ranges of a request are fetched
 * - O(1) timestamp index over append-only fetch groups
 * - Garbage collection of superseded copies and oldest-first eviction under a ceiling
 * - Protected window around today that is never evicted
 * - Debounced persistence to Chronicle Map
 *
 * @since 1.0.0
 */
@SpringBootApplication
public class IntervalPoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(IntervalPoolApplication.class, args);
    }
}
