package com.dragnet.core.scan;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/** Parses record timestamps into epoch seconds. */
final class DateFieldParser {

    private static final DateTimeFormatter ISO = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
            .toFormatter();

    private DateFieldParser() {}

    /**
     * Strings are ISO-8601 dates or date-times, UTC unless an offset is given; numbers are epoch milliseconds.
     *
     * @return epoch seconds, rounded down, or {@code null} if the value is not a date
     */
    static Long toEpochSeconds(Object value) {
        if (value instanceof Number n) {
            return Math.floorDiv(n.longValue(), 1000L);
        }
        if (!(value instanceof String s)) {
            return null;
        }
        try {
            TemporalAccessor parsed = ISO.parse(s.trim());
            ZoneOffset offset = parsed.isSupported(ChronoField.OFFSET_SECONDS) ? ZoneOffset.from(parsed) : ZoneOffset.UTC;
            long millis = LocalDateTime.from(parsed).toInstant(offset).toEpochMilli();
            return Math.floorDiv(millis, 1000L);
        } catch (DateTimeException e) {
            return null;
        }
    }
}
