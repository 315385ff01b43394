package com.fintech.intervalpool.service;

import com.fintech.intervalpool.config.IntervalPoolProperties;
import com.fintech.intervalpool.domain.PriceInterval;
import com.fintech.intervalpool.domain.SubjectContext;
import com.fintech.intervalpool.pool.IntervalPool;
import com.fintech.intervalpool.pool.PoolSettings;
import com.fintech.intervalpool.pool.PoolValidationException;
import com.fintech.intervalpool.source.PriceRouter;
import com.fintech.intervalpool.source.PriceSource;
import com.fintech.intervalpool.storage.InMemoryPoolStateStore;
import com.fintech.intervalpool.storage.PoolPersistence;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static com.fintech.intervalpool.TestIntervals.BERLIN;
import static com.fintech.intervalpool.TestIntervals.TIMELINE;
import static com.fintech.intervalpool.TestIntervals.day;
import static com.fintech.intervalpool.TestIntervals.fixedClock;
import static com.fintech.intervalpool.TestIntervals.intervals;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("IntervalPoolService Tests")
class IntervalPoolServiceTest {

    private IntervalPoolProperties properties;
    private PriceSource source;
    private InMemoryPoolStateStore store;
    private PoolPersistence persistence;
    private SimpleMeterRegistry meterRegistry;
    private ScheduledExecutorService scheduler;
    private Clock clock;

    @BeforeEach
    void setUp() {
        properties = new IntervalPoolProperties();
        source = mock(PriceSource.class);
        when(source.fetchRange(anyString(), any(ZonedDateTime.class), any(ZonedDateTime.class)))
            .thenAnswer(invocation -> intervals(invocation.getArgument(1), invocation.getArgument(2)));
        store = new InMemoryPoolStateStore();
        meterRegistry = new SimpleMeterRegistry();
        persistence = new PoolPersistence(store, CircuitBreakerRegistry.ofDefaults(), meterRegistry);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        clock = fixedClock();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private IntervalPoolService newService() {
        // long debounce keeps saves pending until a test flushes them
        PoolSettings settings = PoolSettings.defaults().withDebounce(Duration.ofMinutes(10));
        return new IntervalPoolService(properties, settings, TIMELINE, new PriceRouter(source, clock),
                clock, clock, meterRegistry, persistence, scheduler);
    }

    @Test
    @DisplayName("Should fall back to the configured zone")
    void testDefaultZone() {
        SubjectContext context = newService().contextFor("home-1", null);

        assertThat(context.timeZone()).isEqualTo(BERLIN);
    }

    @Test
    @DisplayName("Should use a requested zone")
    void testRequestedZone() {
        SubjectContext context = newService().contextFor("home-1", "Europe/Stockholm");

        assertThat(context.timeZone()).isEqualTo(ZoneId.of("Europe/Stockholm"));
    }

    @Test
    @DisplayName("Should reject unknown zones and blank subjects")
    void testInvalidContext() {
        IntervalPoolService service = newService();

        assertThatThrownBy(() -> service.contextFor("home-1", "Mars/Olympus"))
            .isInstanceOf(PoolValidationException.class)
            .hasMessageContaining("Mars/Olympus");
        assertThatThrownBy(() -> service.contextFor(" ", null))
            .isInstanceOf(PoolValidationException.class);
        assertThatThrownBy(() -> service.poolFor(null))
            .isInstanceOf(PoolValidationException.class);
    }

    @Test
    @DisplayName("Should keep one pool per subject")
    void testOnePoolPerSubject() {
        IntervalPoolService service = newService();
        SubjectContext first = service.contextFor("home-1", null);

        IntervalPool pool = service.poolFor(first);

        assertThat(service.poolFor(service.contextFor("home-1", null))).isSameAs(pool);
        assertThat(service.poolFor(service.contextFor("home-2", null))).isNotSameAs(pool);
        assertThat(service.poolCount()).isEqualTo(2);
        assertThat(meterRegistry.get("interval.pool.subjects").gauge().value()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should restore a pool from stored state instead of fetching")
    void testRestoreOnFirstAccess() {
        IntervalPoolService writer = newService();
        SubjectContext context = writer.contextFor("home-1", null);
        writer.getIntervals(context, day(2025, 11, 1), day(2025, 11, 2));
        writer.shutdown();
        clearInvocations(source);

        IntervalPoolService reader = newService();
        List<PriceInterval> result = reader.getIntervals(context, day(2025, 11, 1), day(2025, 11, 2));

        assertThat(result).hasSize(96);
        verify(source, never()).fetchRange(anyString(), any(), any());
    }

    @Test
    @DisplayName("Should start empty when stored state is corrupt")
    void testCorruptStoredState() {
        store.save("home-1", "{\"version\":99}");
        IntervalPoolService service = newService();
        SubjectContext context = service.contextFor("home-1", null);

        List<PriceInterval> result = service.getIntervals(context, day(2025, 11, 1), day(2025, 11, 2));

        assertThat(result).hasSize(96);
        verify(source, times(1)).fetchRange(anyString(), any(), any());
    }

    @Test
    @DisplayName("Should start empty when a stored fetch group has no fetch time")
    void testStoredGroupWithoutFetchTime() {
        store.save("home-1", "{\"version\":1,\"subjectId\":\"home-1\",\"fetchGroups\":[{\"intervals\":[]}]}");
        IntervalPoolService service = newService();
        SubjectContext context = service.contextFor("home-1", null);

        List<PriceInterval> result = service.getIntervals(context, day(2025, 11, 1), day(2025, 11, 2));

        assertThat(result).hasSize(96);
        assertThat(service.poolCount()).isEqualTo(1);
        verify(source, times(1)).fetchRange(anyString(), any(), any());
    }

    @Test
    @DisplayName("Should flush pending saves on shutdown")
    void testShutdownFlushes() {
        IntervalPoolService service = newService();
        SubjectContext context = service.contextFor("home-1", null);
        service.getIntervals(context, day(2025, 11, 1), day(2025, 11, 2));
        assertThat(store.count()).isZero();

        service.shutdown();

        assertThat(store.load("home-1")).isPresent();
    }

    @Test
    @DisplayName("Should not persist when persistence is disabled")
    void testPersistenceDisabled() {
        properties.getPersistence().setEnabled(false);
        IntervalPoolService service = newService();
        SubjectContext context = service.contextFor("home-1", null);
        service.getIntervals(context, day(2025, 11, 1), day(2025, 11, 2));

        service.shutdown();

        assertThat(store.count()).isZero();
        assertThat(service.poolFor(context).saveNow()).isFalse();
    }

    @Test
    @DisplayName("Should remove a loaded subject with its stored state")
    void testRemoveLoadedSubject() {
        IntervalPoolService service = newService();
        SubjectContext context = service.contextFor("home-1", null);
        service.getIntervals(context, day(2025, 11, 1), day(2025, 11, 2));
        service.poolFor(context).saveNow();

        boolean removed = service.removeSubject("home-1");

        assertThat(removed).isTrue();
        assertThat(service.poolCount()).isZero();
        assertThat(store.count()).isZero();
        assertThat(service.stats("home-1")).isEmpty();
    }

    @Test
    @DisplayName("Should still clear stored state for a subject that is not loaded")
    void testRemoveUnloadedSubject() {
        store.save("home-1", "{}");

        boolean removed = newService().removeSubject("home-1");

        assertThat(removed).isFalse();
        assertThat(store.count()).isZero();
    }

    @Test
    @DisplayName("Should expose stats for loaded pools only")
    void testStats() {
        IntervalPoolService service = newService();
        SubjectContext context = service.contextFor("home-1", null);
        service.getIntervals(context, day(2025, 11, 1), day(2025, 11, 2));

        assertThat(service.stats("home-1")).hasValueSatisfying(stats ->
            assertThat(stats.cacheIntervalsTotal()).isEqualTo(96));
        assertThat(service.stats("home-2")).isEmpty();
    }
}
