package com.fintech.intervalpool.storage;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Persistence adapter between the pools and the {@link PoolStateStore}.
 *
 * Responsibilities:
 * - JSON encoding and decoding of pool state
 * - Circuit breaker around store writes
 * - Swallowing storage failures: a failed save never fails the cache operation that triggered it
 * - Treating corrupt state as absent
 */
@Component
public class PoolPersistence {

    private static final Logger log = LoggerFactory.getLogger(PoolPersistence.class);

    private final PoolStateStore store;
    private final CircuitBreaker circuitBreaker;
    private final MeterRegistry meterRegistry;

    public PoolPersistence(PoolStateStore store,
                           CircuitBreakerRegistry circuitBreakerRegistry,
                           MeterRegistry meterRegistry) {
        this.store = store;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("storage");
        this.meterRegistry = meterRegistry;

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Storage circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    /**
     * Loads and decodes the state of a subject.
     *
     * @return the stored state, or empty if none is stored, it is corrupt, or the store failed
     */
    public Optional<PoolState> load(String subjectId) {
        Optional<String> json;
        try {
            json = store.load(subjectId);
        } catch (StorageException e) {
            log.error("Failed to load pool state for subject {}, starting empty", subjectId, e);
            return Optional.empty();
        }
        if (json.isEmpty()) {
            log.debug("No stored pool state for subject {}", subjectId);
            return Optional.empty();
        }

        try {
            PoolState state = PoolStateCodec.decode(json.get());
            if (!subjectId.equals(state.subjectId())) {
                log.warn("Stored pool state for subject {} belongs to {}, discarding", subjectId, state.subjectId());
                return Optional.empty();
            }
            return Optional.of(state);
        } catch (CorruptStateException e) {
            log.warn("Stored pool state for subject {} is corrupt ({}), pool will rebuild from source",
                    subjectId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Encodes and writes a state through the circuit breaker.
     *
     * @return true if the state was written
     */
    public boolean save(PoolState state) {
        String subjectId = state.subjectId();
        try {
            String json = PoolStateCodec.encode(state);
            circuitBreaker.executeRunnable(() -> store.save(subjectId, json));
            meterRegistry.counter("interval.pool.saves", "subject", subjectId).increment();
            log.debug("Saved pool state for subject {}: {} groups, {} intervals",
                    subjectId, state.fetchGroups().size(), state.intervalCount());
            return true;

        } catch (CallNotPermittedException e) {
            meterRegistry.counter("interval.pool.save.failures", "subject", subjectId).increment();
            log.warn("Storage circuit breaker OPEN - save skipped for subject {}", subjectId);
            return false;

        } catch (Exception e) {
            meterRegistry.counter("interval.pool.save.failures", "subject", subjectId).increment();
            log.error("Failed to save pool state for subject {}", subjectId, e);
            return false;
        }
    }

    /**
     * Removes the stored state of a subject, logging failures.
     */
    public void remove(String subjectId) {
        try {
            store.remove(subjectId);
            log.info("Removed stored pool state for subject {}", subjectId);
        } catch (StorageException e) {
            log.error("Failed to remove pool state for subject {}", subjectId, e);
        }
    }

    public boolean isHealthy() {
        return store.isHealthy();
    }

    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }
}
