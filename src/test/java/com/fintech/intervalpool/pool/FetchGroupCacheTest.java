package com.fintech.intervalpool.pool;

import com.fintech.intervalpool.domain.FetchGroup;
import com.fintech.intervalpool.domain.PriceInterval;
import com.fintech.intervalpool.storage.PoolState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.stream.Stream;

import static com.fintech.intervalpool.TestIntervals.BERLIN;
import static com.fintech.intervalpool.TestIntervals.at;
import static com.fintech.intervalpool.TestIntervals.day;
import static com.fintech.intervalpool.TestIntervals.fixedClock;
import static com.fintech.intervalpool.TestIntervals.interval;
import static com.fintech.intervalpool.TestIntervals.intervals;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FetchGroupCache Tests")
class FetchGroupCacheTest {

    private static final OffsetDateTime FETCHED_AT = OffsetDateTime.parse("2025-11-23T11:00:00+01:00");

    private FetchGroupCache cache;

    @BeforeEach
    void setUp() {
        cache = new FetchGroupCache(fixedClock(), BERLIN);
    }

    @Test
    @DisplayName("Should protect day-before-yesterday through the end of tomorrow")
    void testProtectedRange() {
        ProtectedRange range = cache.protectedRange();

        assertThat(range.start()).isEqualTo(LocalDateTime.of(2025, 11, 21, 0, 0));
        assertThat(range.end()).isEqualTo(LocalDateTime.of(2025, 11, 25, 0, 0));
        assertThat(range.startIso()).isEqualTo("2025-11-21T00:00:00");
        assertThat(range.endIso()).isEqualTo("2025-11-25T00:00:00");
    }

    @ParameterizedTest(name = "{0} protected: {1}")
    @MethodSource("boundaryProvider")
    @DisplayName("Should treat the protected range as half-open")
    void testProtectedBoundaries(ZonedDateTime start, boolean expected) {
        assertThat(cache.isProtected(interval(start))).isEqualTo(expected);
    }

    static Stream<Arguments> boundaryProvider() {
        return Stream.of(
            Arguments.of(at(2025, 11, 20, 23, 45), false),
            Arguments.of(at(2025, 11, 21, 0, 0), true),
            Arguments.of(at(2025, 11, 23, 12, 0), true),
            Arguments.of(at(2025, 11, 24, 23, 45), true),
            Arguments.of(at(2025, 11, 25, 0, 0), false)
        );
    }

    @Test
    @DisplayName("Should take today from the subject's zone, not UTC")
    void testTodayInSubjectZone() {
        // 23:30 UTC is already the next day in Berlin
        FetchGroupCache lateCache = new FetchGroupCache(
            new MutableClock(Instant.parse("2025-11-23T23:30:00Z"), ZoneOffset.UTC), BERLIN);

        assertThat(lateCache.protectedRange().start()).isEqualTo(LocalDateTime.of(2025, 11, 22, 0, 0));
    }

    @Test
    @DisplayName("Should move the protected range after midnight")
    void testRangeRollsOver() {
        MutableClock clock = new MutableClock(Instant.parse("2025-11-23T22:30:00Z"), BERLIN);
        FetchGroupCache rollingCache = new FetchGroupCache(clock, BERLIN);
        ProtectedRange before = rollingCache.protectedRange();

        clock.advance(Duration.ofHours(1));

        assertThat(before.start()).isEqualTo(LocalDateTime.of(2025, 11, 21, 0, 0));
        assertThat(rollingCache.protectedRange().start()).isEqualTo(LocalDateTime.of(2025, 11, 22, 0, 0));
        assertThat(rollingCache.isProtected(interval(at(2025, 11, 21, 12, 0)))).isFalse();
    }

    @Test
    @DisplayName("Should honour configured protected days")
    void testCustomProtectedDays() {
        FetchGroupCache narrow = new FetchGroupCache(fixedClock(), BERLIN, 0, 1);

        assertThat(narrow.protectedRange()).isEqualTo(new ProtectedRange(
            LocalDateTime.of(2025, 11, 23, 0, 0), LocalDateTime.of(2025, 11, 24, 0, 0)));
    }

    @Test
    @DisplayName("Should assign sequential group ids and look intervals up by location")
    void testAddGroup() {
        List<PriceInterval> first = intervals(day(2025, 11, 20), day(2025, 11, 21));
        List<PriceInterval> second = intervals(day(2025, 11, 21), day(2025, 11, 22));

        assertThat(cache.addGroup(first, FETCHED_AT)).isZero();
        assertThat(cache.addGroup(second, FETCHED_AT.plusMinutes(1))).isEqualTo(1);

        assertThat(cache.groupCount()).isEqualTo(2);
        assertThat(cache.totalIntervalCount()).isEqualTo(192);
        assertThat(cache.intervalAt(new IntervalLocation(1, 4))).isSameAs(second.get(4));
        assertThat(cache.group(1).fetchedAt()).isEqualTo(FETCHED_AT.plusMinutes(1));
    }

    @Test
    @DisplayName("Should replace all groups")
    void testReplaceGroups() {
        cache.addGroup(intervals(day(2025, 11, 20), day(2025, 11, 21)), FETCHED_AT);
        cache.addGroup(intervals(day(2025, 11, 21), day(2025, 11, 22)), FETCHED_AT);

        cache.replaceGroups(List.of(new FetchGroup(FETCHED_AT, List.of(interval(day(2025, 11, 23))))));

        assertThat(cache.groupCount()).isEqualTo(1);
        assertThat(cache.totalIntervalCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should restore serialized groups in order")
    void testStateRoundTrip() {
        cache.addGroup(intervals(day(2025, 11, 20), day(2025, 11, 21)), FETCHED_AT);
        cache.addGroup(intervals(day(2025, 11, 21), day(2025, 11, 22)), FETCHED_AT.plusHours(1));
        List<PoolState.FetchGroupState> states = cache.toState();

        FetchGroupCache restored = new FetchGroupCache(fixedClock(), BERLIN);
        List<Integer> ids = restored.fromState(states);

        assertThat(ids).containsExactly(0, 1);
        assertThat(restored.groups()).isEqualTo(cache.groups());
    }
}
