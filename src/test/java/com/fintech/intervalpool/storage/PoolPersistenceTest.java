package com.fintech.intervalpool.storage;

import com.fintech.intervalpool.domain.PriceInterval;
import com.fintech.intervalpool.domain.PriceLevel;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link PoolPersistence}.
 *
 * <p>Uses the in-memory store for happy paths and a Mockito store for failures.
 * Storage problems must never escape: loads fall back to empty, saves report false.
 */
@DisplayName("PoolPersistence Tests")
class PoolPersistenceTest {

    private InMemoryPoolStateStore store;
    private SimpleMeterRegistry meterRegistry;
    private PoolPersistence persistence;

    @BeforeEach
    void setUp() {
        store = new InMemoryPoolStateStore();
        meterRegistry = new SimpleMeterRegistry();
        persistence = new PoolPersistence(store, CircuitBreakerRegistry.ofDefaults(), meterRegistry);
    }

    private static PoolState state(String subjectId) {
        PriceInterval interval = PriceInterval.of(OffsetDateTime.parse("2025-11-23T10:00:00+01:00"),
            0.3, 0.2, 0.1, PriceLevel.NORMAL);
        return PoolState.of(subjectId, List.of(
            new PoolState.FetchGroupState(OffsetDateTime.parse("2025-11-23T11:00:00+01:00"), List.of(interval))));
    }

    @Test
    @DisplayName("Should save and load state")
    void testRoundTrip() {
        assertThat(persistence.save(state("home-1"))).isTrue();

        Optional<PoolState> loaded = persistence.load("home-1");

        assertThat(loaded).contains(state("home-1"));
        assertThat(meterRegistry.counter("interval.pool.saves", "subject", "home-1").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should load nothing for an unknown subject")
    void testMissing() {
        assertThat(persistence.load("home-1")).isEmpty();
    }

    @Test
    @DisplayName("Should treat corrupt state as absent")
    void testCorrupt() {
        store.save("home-1", "{\"homes\":{}}");

        assertThat(persistence.load("home-1")).isEmpty();
    }

    @Test
    @DisplayName("Should discard state stored under the wrong subject")
    void testSubjectMismatch() {
        store.save("home-1", PoolStateCodec.encode(state("home-2")));

        assertThat(persistence.load("home-1")).isEmpty();
    }

    @Test
    @DisplayName("Should remove stored state")
    void testRemove() {
        persistence.save(state("home-1"));

        persistence.remove("home-1");

        assertThat(store.count()).isZero();
    }

    @Test
    @DisplayName("Should swallow store failures and count them")
    void testFailuresSwallowed() {
        PoolStateStore failing = mock(PoolStateStore.class);
        doThrow(new StorageException("disk full")).when(failing).save(anyString(), anyString());
        when(failing.load(anyString())).thenThrow(new StorageException("unreadable"));
        doThrow(new StorageException("locked")).when(failing).remove(anyString());
        PoolPersistence failingPersistence =
            new PoolPersistence(failing, CircuitBreakerRegistry.ofDefaults(), meterRegistry);

        assertThat(failingPersistence.save(state("home-1"))).isFalse();
        assertThat(failingPersistence.load("home-1")).isEmpty();
        failingPersistence.remove("home-1");

        assertThat(meterRegistry.counter("interval.pool.save.failures", "subject", "home-1").count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should skip writes while the circuit breaker is open")
    void testCircuitBreakerOpens() {
        PoolStateStore failing = mock(PoolStateStore.class);
        doThrow(new StorageException("disk full")).when(failing).save(anyString(), anyString());
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .slidingWindowSize(2)
            .minimumNumberOfCalls(2)
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofMinutes(5))
            .build();
        PoolPersistence guarded = new PoolPersistence(failing, CircuitBreakerRegistry.of(config), meterRegistry);

        guarded.save(state("home-1"));
        guarded.save(state("home-1"));
        boolean third = guarded.save(state("home-1"));

        assertThat(third).isFalse();
        assertThat(guarded.getCircuitBreakerState()).isEqualTo("OPEN");
        verify(failing, times(2)).save(anyString(), anyString());
        assertThat(meterRegistry.counter("interval.pool.save.failures", "subject", "home-1").count())
            .isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should report store health")
    void testHealth() {
        assertThat(persistence.isHealthy()).isTrue();
        assertThat(persistence.getCircuitBreakerState()).isEqualTo("CLOSED");
    }
}
