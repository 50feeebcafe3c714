package com.dragnet.core.time;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/** Calendar fields that may appear in a partition pattern, largest first. */
public enum PartitionUnit {
    YEAR('Y', 4),
    MONTH('m', 2),
    DAY('d', 2),
    HOUR('H', 2);

    private final char conversion;
    private final int digits;

    PartitionUnit(char conversion, int digits) {
        this.conversion = conversion;
        this.digits = digits;
    }

    public char conversion() {
        return conversion;
    }

    String regex() {
        return "(\\d{" + digits + "})";
    }

    static PartitionUnit forConversion(char c) {
        for (PartitionUnit unit : values()) {
            if (unit.conversion == c) {
                return unit;
            }
        }
        return null;
    }

    String render(ZonedDateTime time) {
        return switch (this) {
            case YEAR -> String.valueOf(time.getYear());
            case MONTH -> twoDigits(time.getMonthValue());
            case DAY -> twoDigits(time.getDayOfMonth());
            case HOUR -> twoDigits(time.getHour());
        };
    }

    /** Month and year steps are calendar steps; day and hour steps are fixed durations. */
    ZonedDateTime increment(ZonedDateTime time) {
        return switch (this) {
            case YEAR -> time.plusYears(1);
            case MONTH -> time.plusMonths(1);
            case DAY -> time.plus(1, ChronoUnit.DAYS);
            case HOUR -> time.plus(1, ChronoUnit.HOURS);
        };
    }

    /** Rounds down to the start of the enclosing unit; minutes and below are always dropped. */
    ZonedDateTime alignDown(ZonedDateTime time) {
        ZonedDateTime t = time.truncatedTo(ChronoUnit.HOURS);
        return switch (this) {
            case YEAR -> t.withDayOfYear(1).withHour(0);
            case MONTH -> t.withDayOfMonth(1).withHour(0);
            case DAY -> t.withHour(0);
            case HOUR -> t;
        };
    }

    private static String twoDigits(int value) {
        return value < 10 ? "0" + value : String.valueOf(value);
    }
}
