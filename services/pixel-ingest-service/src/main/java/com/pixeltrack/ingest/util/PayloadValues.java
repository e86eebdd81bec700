package com.pixeltrack.ingest.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lenient readers for loosely typed pixel payload values.
 */
public final class PayloadValues {

    private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d+(\\.\\d+)?");

    private static final Pattern DECIMAL = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    private static final int DATE_LENGTH = 10;

    private static final DateTimeFormatter ISO_DATE_OR_DATE_TIME = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .appendLiteral('T')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart()
        .appendOffsetId()
        .optionalEnd()
        .optionalEnd()
        .toFormatter();

    private PayloadValues() {
    }

    /**
     * Parses an epoch-millisecond number or an ISO-8601 date/time. A space
     * may stand in for the {@code T} separator. Values without an offset are
     * read as UTC.
     */
    public static Optional<Instant> parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();
        if (EPOCH_MILLIS.matcher(text).matches()) {
            return Optional.of(Instant.ofEpochMilli((long) Double.parseDouble(text)));
        }
        try {
            TemporalAccessor parsed = ISO_DATE_OR_DATE_TIME.parseBest(withTimeSeparator(text),
                OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return Optional.of(offsetDateTime.toInstant());
            }
            if (parsed instanceof LocalDateTime localDateTime) {
                return Optional.of(localDateTime.toInstant(ZoneOffset.UTC));
            }
            return Optional.of(((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static String withTimeSeparator(String text) {
        if (text.length() > DATE_LENGTH && text.charAt(DATE_LENGTH) == ' ') {
            return text.substring(0, DATE_LENGTH) + 'T' + text.substring(DATE_LENGTH + 1);
        }
        return text;
    }

    /**
     * Parses plain decimal text such as {@code "-180"} or {@code "1.5e3"}, else null.
     */
    public static Double parseDecimal(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        return DECIMAL.matcher(trimmed).matches() ? Double.valueOf(trimmed) : null;
    }

    /**
     * Truncates a finite value that fits in a long, else null.
     */
    public static Long wholeNumber(Double value) {
        if (value == null || !Double.isFinite(value) || value < Long.MIN_VALUE || value > Long.MAX_VALUE) {
            return null;
        }
        return value.longValue();
    }

    /**
     * Returns the value as a double when it is a finite number, else null.
     */
    public static Double finiteDouble(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        return null;
    }

    /**
     * Returns the value rounded to an int when it is a finite, non-zero number
     * within int range, else null.
     */
    public static Integer nonZeroInt(Object value) {
        Double d = finiteDouble(value);
        if (d == null || d == 0d) {
            return null;
        }
        long rounded = Math.round(d);
        if (rounded < Integer.MIN_VALUE || rounded > Integer.MAX_VALUE) {
            return null;
        }
        return (int) rounded;
    }

    public static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
