package com.triplebarrier.backtest.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.function.ToLongFunction;

/**
 * Timestamp parsing and formatting (UTC, epoch millis internally)
 */
public final class Timestamps {

    private static final DateTimeFormatter DATETIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // tried in order
    private static final List<ToLongFunction<String>> PARSERS = List.of(
        Long::parseLong,
        text -> Instant.parse(text).toEpochMilli(),
        text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC).toEpochMilli(),
        text -> LocalDateTime.parse(text, DATETIME_FORMATTER).toInstant(ZoneOffset.UTC).toEpochMilli(),
        text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli()
    );

    private Timestamps() {
    }

    /**
     * Parse timestamp from string (supports milliseconds, ISO instant, ISO local date-time,
     * yyyy-MM-dd HH:mm:ss or yyyy-MM-dd)
     * @param value timestamp string
     * @return timestamp in milliseconds
     * @throws IllegalArgumentException if no format matches
     */
    public static long parse(String value) {
        String text = value == null ? "" : value.trim();
        RuntimeException lastFailure = null;
        for (ToLongFunction<String> parser : PARSERS) {
            try {
                return parser.applyAsLong(text);
            } catch (RuntimeException e) {
                lastFailure = e;
            }
        }
        throw new IllegalArgumentException("Invalid timestamp format: " + value, lastFailure);
    }

    /**
     * Format millis as ISO-8601 instant
     * @param millis epoch millis
     * @return e.g. 2024-01-02T00:00:00Z
     */
    public static String format(long millis) {
        return DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochMilli(millis));
    }
}
