package com.klinevault.core.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;

/**
 * Conversions between calendar values and Unix milliseconds. Values without an offset are UTC.
 */
public final class UtcTimes {

    private UtcTimes() {
    }

    public static long toEpochMillis(LocalDateTime dateTime) {
        return dateTime.toInstant(ZoneOffset.UTC).toEpochMilli();
    }

    public static long toEpochMillis(OffsetDateTime dateTime) {
        return dateTime.toInstant().toEpochMilli();
    }

    public static long toEpochMillis(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    public static LocalDateTime toUtcDateTime(long epochMillis) {
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), ZoneOffset.UTC);
    }

    /**
     * Parse "2026-01-01", "2026-01-01T12:00" or "2026-01-01T12:00+02:00".
     */
    public static long parseToEpochMillis(String text) {
        String value = text.trim();
        if (value.indexOf('T') < 0) {
            return toEpochMillis(LocalDate.parse(value));
        }
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value,
            OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return toEpochMillis(offsetDateTime);
        }
        return toEpochMillis((LocalDateTime) parsed);
    }
}
