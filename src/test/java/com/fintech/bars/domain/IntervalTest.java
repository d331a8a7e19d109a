package com.fintech.bars.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Interval Tests")
class IntervalTest {

    // 2024-01-01T00:00:00Z, a Monday
    private static final long JAN_1_2024 = 1_704_067_200_000L;
    // 2024-01-03T12:34:56Z
    private static final long JAN_3_2024_123456 = 1_704_285_296_000L;
    private static final long FEB_1_2024 = 1_706_745_600_000L;
    private static final long MAR_1_2024 = 1_709_251_200_000L;

    @ParameterizedTest(name = "{0}: {1} should align to {2}")
    @MethodSource("alignTimestampProvider")
    @DisplayName("alignTimestamp() should align to interval boundaries")
    void testAlignTimestamp(Interval interval, long timestamp, long expectedAligned) {
        assertThat(interval.alignTimestamp(timestamp)).isEqualTo(expectedAligned);
    }

    static Stream<Arguments> alignTimestampProvider() {
        return Stream.of(
            Arguments.of(Interval.M1, 60_000L, 60_000L),
            Arguments.of(Interval.M1, 119_999L, 60_000L),
            Arguments.of(Interval.M1, 120_000L, 120_000L),
            Arguments.of(Interval.M5, 599_999L, 300_000L),
            Arguments.of(Interval.M45, 2_700_000L + 1L, 2_700_000L),
            Arguments.of(Interval.H4, 14_400_000L * 3 + 5L, 14_400_000L * 3),
            Arguments.of(Interval.D1, JAN_3_2024_123456, JAN_1_2024 + 2 * 86_400_000L),
            Arguments.of(Interval.W1, JAN_3_2024_123456, JAN_1_2024),
            Arguments.of(Interval.MN1, JAN_3_2024_123456, JAN_1_2024),
            Arguments.of(Interval.MN1, MAR_1_2024 - 1, FEB_1_2024),

            // Pre-epoch timestamps floor downwards
            Arguments.of(Interval.M1, -1L, -60_000L),
            // 1970-01-01 was a Thursday; its week starts on Monday 1969-12-29
            Arguments.of(Interval.W1, 0L, -3 * 86_400_000L)
        );
    }

    @ParameterizedTest(name = "{0}: window starting at {1} should end at {2}")
    @MethodSource("windowEndProvider")
    @DisplayName("windowEnd() should return the exclusive end")
    void testWindowEnd(Interval interval, long windowStart, long expectedEnd) {
        assertThat(interval.windowEnd(windowStart)).isEqualTo(expectedEnd);
    }

    static Stream<Arguments> windowEndProvider() {
        return Stream.of(
            Arguments.of(Interval.M1, 60_000L, 120_000L),
            Arguments.of(Interval.H1, 3_600_000L, 7_200_000L),
            Arguments.of(Interval.D1, JAN_1_2024, JAN_1_2024 + 86_400_000L),
            Arguments.of(Interval.W1, JAN_1_2024, JAN_1_2024 + 7 * 86_400_000L),
            Arguments.of(Interval.MN1, JAN_1_2024, FEB_1_2024),
            Arguments.of(Interval.MN1, FEB_1_2024, MAR_1_2024)
        );
    }

    @ParameterizedTest
    @EnumSource(Interval.class)
    @DisplayName("Alignment should be idempotent")
    void testAlignmentIdempotent(Interval interval) {
        for (long ts : new long[] {0L, 1L, JAN_3_2024_123456, MAR_1_2024 - 1, -123_456_789L}) {
            long aligned = interval.alignTimestamp(ts);
            assertThat(interval.alignTimestamp(aligned)).isEqualTo(aligned);
            assertThat(aligned).isLessThanOrEqualTo(ts);
            assertThat(interval.windowEnd(aligned)).isGreaterThan(ts);
        }
    }

    @Test
    @DisplayName("fromCode() should distinguish minute and month")
    void testFromCodeCaseSensitive() {
        assertThat(Interval.fromCode("1m")).isEqualTo(Interval.M1);
        assertThat(Interval.fromCode("1M")).isEqualTo(Interval.MN1);
        assertThat(Interval.fromCode(" 4h ")).isEqualTo(Interval.H4);
    }

    @Test
    @DisplayName("fromCode() should reject unknown codes")
    void testFromCodeUnknown() {
        assertThatThrownBy(() -> Interval.fromCode("7m"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unsupported interval");
        assertThatThrownBy(() -> Interval.fromCode(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("fromCodes() should keep order and drop duplicates")
    void testFromCodes() {
        assertThat(Interval.fromCodes(List.of("1m", "5m", "1m", "1d")))
            .containsExactly(Interval.M1, Interval.M5, Interval.D1);
    }

    @Test
    @DisplayName("inSameWindow() should compare aligned starts")
    void testInSameWindow() {
        assertThat(Interval.M1.inSameWindow(60_000L, 119_999L)).isTrue();
        assertThat(Interval.M1.inSameWindow(119_999L, 120_000L)).isFalse();
    }
}
