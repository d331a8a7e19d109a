package com.fintech.bars.domain;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Bar intervals with window alignment.
 * Intraday intervals align to the Unix epoch with integer arithmetic; daily, weekly
 * and monthly intervals align to UTC calendar boundaries (midnight, ISO Monday,
 * first day of the month).
 */
public enum Interval {

    M1("1m", 60_000L),
    M3("3m", 180_000L),
    M5("5m", 300_000L),
    M15("15m", 900_000L),
    M30("30m", 1_800_000L),
    M45("45m", 2_700_000L),
    H1("1h", 3_600_000L),
    H2("2h", 7_200_000L),
    H3("3h", 10_800_000L),
    H4("4h", 14_400_000L),
    D1("1d", 86_400_000L),
    W1("1w", 604_800_000L),
    MN1("1M", 0L);

    private final String code;
    private final long milliseconds;

    Interval(String code, long milliseconds) {
        this.code = code;
        this.milliseconds = milliseconds;
    }

    /** Returns the wire/config code, e.g. "1m", "1h", "1M". */
    public String code() {
        return code;
    }

    /**
     * Returns the nominal duration in milliseconds.
     * Monthly bars have no fixed width and report a 30-day nominal length.
     */
    public long toMillis() {
        return this == MN1 ? 30L * 86_400_000L : milliseconds;
    }

    /** True for intervals whose boundaries come from the UTC calendar rather than fixed arithmetic. */
    public boolean isCalendarAligned() {
        return this == W1 || this == MN1;
    }

    /**
     * Aligns a timestamp to the start of its window.
     * Uses floor division so that pre-epoch timestamps align downwards too.
     */
    public long alignTimestamp(long timestamp) {
        switch (this) {
            case W1: {
                LocalDate date = Instant.ofEpochMilli(timestamp).atZone(ZoneOffset.UTC).toLocalDate();
                LocalDate monday = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                return monday.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
            }
            case MN1: {
                LocalDate date = Instant.ofEpochMilli(timestamp).atZone(ZoneOffset.UTC).toLocalDate();
                return date.withDayOfMonth(1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
            }
            default:
                return Math.floorDiv(timestamp, milliseconds) * milliseconds;
        }
    }

    /** Returns the exclusive window end for an aligned window start. */
    public long windowEnd(long windowStart) {
        if (this == MN1) {
            ZonedDateTime start = Instant.ofEpochMilli(windowStart).atZone(ZoneOffset.UTC);
            return start.plusMonths(1).toInstant().toEpochMilli();
        }
        return windowStart + milliseconds;
    }

    /** Returns true if both timestamps align to the same window start. */
    public boolean inSameWindow(long timestamp1, long timestamp2) {
        return alignTimestamp(timestamp1) == alignTimestamp(timestamp2);
    }

    /**
     * Resolves an interval code. Matching is case-sensitive because "1m" (minute)
     * and "1M" (month) differ only by case.
     *
     * @throws IllegalArgumentException for unknown codes
     */
    public static Interval fromCode(String code) {
        if (code != null) {
            String trimmed = code.trim();
            for (Interval interval : values()) {
                if (interval.code.equals(trimmed)) {
                    return interval;
                }
            }
        }
        throw new IllegalArgumentException(
            "Unsupported interval '" + code + "'. Allowed: " + allowedCodes()
        );
    }

    /** Parses a list of codes, preserving order and dropping duplicates. */
    public static List<Interval> fromCodes(List<String> codes) {
        return codes.stream()
            .map(Interval::fromCode)
            .distinct()
            .collect(Collectors.toList());
    }

    public static String allowedCodes() {
        return Arrays.stream(values())
            .map(Interval::code)
            .collect(Collectors.joining(", "));
    }
}
