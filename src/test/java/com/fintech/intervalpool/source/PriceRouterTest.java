package com.fintech.intervalpool.source;

import com.fintech.intervalpool.domain.PriceInterval;
import com.fintech.intervalpool.domain.SubjectContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static com.fintech.intervalpool.TestIntervals.BERLIN;
import static com.fintech.intervalpool.TestIntervals.at;
import static com.fintech.intervalpool.TestIntervals.day;
import static com.fintech.intervalpool.TestIntervals.fixedClock;
import static com.fintech.intervalpool.TestIntervals.interval;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("PriceRouter Tests")
class PriceRouterTest {

    private static final SubjectContext CONTEXT = new SubjectContext("home-1", BERLIN);

    private PriceSource source;
    private PriceRouter router;

    @BeforeEach
    void setUp() {
        source = mock(PriceSource.class);
        router = new PriceRouter(source, fixedClock());
    }

    @Test
    @DisplayName("Should place the boundary at day-before-yesterday midnight")
    void testBoundary() {
        assertThat(router.boundary(BERLIN)).isEqualTo(day(2025, 11, 21));
    }

    @Test
    @DisplayName("Should compute the boundary from the subject's calendar day")
    void testBoundaryPerZone() {
        PriceRouter lateRouter = new PriceRouter(source,
            Clock.fixed(Instant.parse("2025-11-23T23:30:00Z"), ZoneOffset.UTC));

        assertThat(lateRouter.boundary(BERLIN)).isEqualTo(day(2025, 11, 22));
        assertThat(lateRouter.boundary(ZoneId.of("UTC")).toLocalDate()).isEqualTo("2025-11-21");
    }

    @Test
    @DisplayName("Should use the range endpoint for historical ranges")
    void testHistorical() {
        when(source.fetchRange(anyString(), any(), any())).thenReturn(List.of(interval(day(2025, 11, 1))));

        List<PriceInterval> result = router.fetch(CONTEXT, day(2025, 11, 1), day(2025, 11, 2));

        assertThat(result).hasSize(1);
        verify(source).fetchRange("home-1", day(2025, 11, 1), day(2025, 11, 2));
        verify(source, never()).fetchRecent(anyString(), any());
    }

    @Test
    @DisplayName("Should treat a range ending at the boundary as historical")
    void testEndAtBoundary() {
        when(source.fetchRange(anyString(), any(), any())).thenReturn(List.of());

        router.fetch(CONTEXT, day(2025, 11, 20), day(2025, 11, 21));

        verify(source).fetchRange("home-1", day(2025, 11, 20), day(2025, 11, 21));
        verifyNoMoreInteractions(source);
    }

    @Test
    @DisplayName("Should use the recent endpoint for ranges starting at or after the boundary")
    void testRecent() {
        when(source.fetchRecent(anyString(), any())).thenReturn(List.of(interval(day(2025, 11, 23))));

        router.fetch(CONTEXT, day(2025, 11, 21), day(2025, 11, 22));
        router.fetch(CONTEXT, at(2025, 11, 23, 10, 0), day(2025, 11, 25));

        verify(source, times(2)).fetchRecent("home-1", BERLIN);
        verify(source, never()).fetchRange(anyString(), any(), any());
    }

    @Test
    @DisplayName("Should split a range spanning the boundary and combine historical first")
    void testSpanningRange() {
        when(source.fetchRange(anyString(), any(), any())).thenReturn(List.of(interval(day(2025, 11, 20))));
        when(source.fetchRecent(anyString(), any())).thenReturn(List.of(interval(day(2025, 11, 22))));

        List<PriceInterval> result = router.fetch(CONTEXT, day(2025, 11, 20), day(2025, 11, 23));

        verify(source).fetchRange("home-1", day(2025, 11, 20), day(2025, 11, 21));
        verify(source).fetchRecent("home-1", BERLIN);
        assertThat(result).extracting(PriceInterval::startsAt)
            .containsExactly(day(2025, 11, 20).toOffsetDateTime(), day(2025, 11, 22).toOffsetDateTime());
    }

    @Test
    @DisplayName("Should propagate upstream failures")
    void testFailure() {
        when(source.fetchRange(anyString(), any(), any())).thenThrow(new UpstreamException(500, "boom", null));

        assertThatThrownBy(() -> router.fetch(CONTEXT, day(2025, 11, 1), day(2025, 11, 2)))
            .isInstanceOf(UpstreamException.class)
            .extracting("statusCode").isEqualTo(500);
    }
}
