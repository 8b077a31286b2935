package com.verlumen.curvestream.time;

import static com.google.common.base.Preconditions.checkNotNull;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/** Utility methods for the date-time strings used on the events stream. */
public final class DateTimes {
    /** Wire format of filter dates: ISO date and time separated by a space. */
    private static final DateTimeFormatter WIRE_FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");
    private static final int ISO_DATE_LENGTH = "2024-01-01".length();

    /**
     * Parse a date-time that may be given with or without an offset, with a "T" or a space
     * separating date and time. A bare date is promoted to midnight. Values without an offset are
     * taken to be UTC.
     *
     * @throws DateTimeParseException if the value is neither a date nor a date-time
     */
    public static OffsetDateTime parseOffsetDateTime(String value) {
        String normalized = normalize(value);
        if (normalized.length() == ISO_DATE_LENGTH) {
            return LocalDate.parse(normalized).atStartOfDay().atOffset(ZoneOffset.UTC);
        }
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
            .parseBest(normalized, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime) {
            return (OffsetDateTime) parsed;
        }
        return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
    }

    /**
     * Parse a date-time into local time. Offsets are dropped and a bare date is promoted to
     * midnight.
     *
     * @throws DateTimeParseException if the value is neither a date nor a date-time
     */
    public static LocalDateTime parseLocalDateTime(String value) {
        String normalized = normalize(value);
        if (normalized.length() == ISO_DATE_LENGTH) {
            return LocalDate.parse(normalized).atStartOfDay();
        }
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
            .parseBest(normalized, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toLocalDateTime();
        }
        return (LocalDateTime) parsed;
    }

    /** Format a local date-time the way filters are sent to the server. */
    public static String format(LocalDateTime dateTime) {
        return WIRE_FORMAT.format(dateTime);
    }

    private static String normalize(String value) {
        checkNotNull(value, "value");
        String trimmed = value.trim();
        // "2024-01-01 10:00" -> "2024-01-01T10:00"
        if (trimmed.length() > ISO_DATE_LENGTH && trimmed.charAt(ISO_DATE_LENGTH) == ' ') {
            return trimmed.substring(0, ISO_DATE_LENGTH) + 'T' + trimmed.substring(ISO_DATE_LENGTH + 1);
        }
        return trimmed;
    }

    private DateTimes() {} // Prevent instantiation
}
