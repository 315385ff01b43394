package com.fintech.intervalpool.util;

import com.fintech.intervalpool.domain.Resolution;
import com.fintech.intervalpool.domain.TimeRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.stream.Stream;

import static com.fintech.intervalpool.TestIntervals.at;
import static com.fintech.intervalpool.TestIntervals.day;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResolutionTimeline Tests")
class ResolutionTimelineTest {

    private final ResolutionTimeline timeline = new ResolutionTimeline();

    @Test
    @DisplayName("Should use hourly resolution before the cutover and quarter-hourly from it")
    void testResolutionAt() {
        assertThat(timeline.resolutionAt(at(2025, 9, 30, 23, 0))).isEqualTo(Resolution.HOURLY);
        assertThat(timeline.resolutionAt(at(2025, 10, 1, 0, 0))).isEqualTo(Resolution.QUARTER_HOURLY);
    }

    @Test
    @DisplayName("Should place the cutover at local midnight in every zone")
    void testCutoverIsLocal() {
        ZoneId helsinki = ZoneId.of("Europe/Helsinki");

        assertThat(timeline.cutoverIn(helsinki).toLocalDateTime())
            .isEqualTo(timeline.cutoverIn(ZoneId.of("Europe/Berlin")).toLocalDateTime());
        assertThat(timeline.cutoverIn(helsinki).toInstant())
            .isNotEqualTo(timeline.cutoverIn(ZoneId.of("Europe/Berlin")).toInstant());
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @MethodSource("nextStartProvider")
    @DisplayName("Should step with the resolution in effect without skipping the cutover")
    void testNextIntervalStart(ZonedDateTime time, ZonedDateTime expected) {
        assertThat(timeline.nextIntervalStart(time)).isEqualTo(expected);
    }

    static Stream<Arguments> nextStartProvider() {
        return Stream.of(
            Arguments.of(at(2025, 9, 30, 22, 0), at(2025, 9, 30, 23, 0)),
            Arguments.of(at(2025, 9, 30, 23, 0), at(2025, 10, 1, 0, 0)),
            Arguments.of(at(2025, 9, 30, 23, 30), at(2025, 10, 1, 0, 0)),
            Arguments.of(at(2025, 10, 1, 0, 0), at(2025, 10, 1, 0, 15)),
            Arguments.of(at(2025, 11, 23, 23, 45), at(2025, 11, 24, 0, 0))
        );
    }

    @Test
    @DisplayName("Should split a range straddling the cutover into two halves meeting at it")
    void testSplitStraddlingRange() {
        TimeRange range = new TimeRange(at(2025, 9, 30, 20, 0), at(2025, 10, 1, 2, 0));

        List<TimeRange> split = timeline.splitAtCutover(List.of(range));

        assertThat(split).containsExactly(
            new TimeRange(at(2025, 9, 30, 20, 0), day(2025, 10, 1)),
            new TimeRange(day(2025, 10, 1), at(2025, 10, 1, 2, 0))
        );
    }

    @Test
    @DisplayName("Should not split ranges that only touch the cutover")
    void testNoSplitAtEdges() {
        TimeRange before = new TimeRange(at(2025, 9, 30, 20, 0), day(2025, 10, 1));
        TimeRange after = new TimeRange(day(2025, 10, 1), at(2025, 10, 1, 2, 0));

        assertThat(timeline.straddlesCutover(before)).isFalse();
        assertThat(timeline.straddlesCutover(after)).isFalse();
        assertThat(timeline.splitAtCutover(List.of(before, after))).containsExactly(before, after);
    }

    @ParameterizedTest(name = "[{0}, {1}) holds {2} intervals")
    @MethodSource("countProvider")
    @DisplayName("Should count interval starts per range")
    void testIntervalsBetween(ZonedDateTime start, ZonedDateTime end, long expected) {
        assertThat(timeline.intervalsBetween(start, end)).isEqualTo(expected);
    }

    static Stream<Arguments> countProvider() {
        return Stream.of(
            // hourly day
            Arguments.of(day(2025, 9, 29), day(2025, 9, 30), 24L),
            // quarter-hourly day
            Arguments.of(day(2025, 11, 23), day(2025, 11, 24), 96L),
            // 2 hourly + 4 quarter-hourly across the cutover
            Arguments.of(at(2025, 9, 30, 22, 0), at(2025, 10, 1, 1, 0), 6L),
            // 25-hour day at the end of daylight saving time
            Arguments.of(day(2025, 10, 26), day(2025, 10, 27), 100L),
            // unaligned start rounds up
            Arguments.of(at(2025, 11, 23, 10, 7), at(2025, 11, 23, 11, 0), 3L)
        );
    }

    @Test
    @DisplayName("Should step local wall time once through the repeated hour and onto the cutover")
    void testLocalStepping() {
        assertThat(timeline.nextIntervalStart(LocalDateTime.of(2025, 10, 26, 2, 45)))
            .isEqualTo(LocalDateTime.of(2025, 10, 26, 3, 0));
        assertThat(timeline.nextIntervalStart(LocalDateTime.of(2025, 9, 30, 23, 30)))
            .isEqualTo(LocalDateTime.of(2025, 10, 1, 0, 0));
        assertThat(timeline.firstIntervalStartAtOrAfter(LocalDateTime.of(2025, 11, 23, 10, 7)))
            .isEqualTo(LocalDateTime.of(2025, 11, 23, 10, 15));
        assertThat(timeline.resolutionAt(LocalDateTime.of(2025, 9, 30, 23, 59))).isEqualTo(Resolution.HOURLY);
    }
}
