package com.telcobright.chunkschema.time;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * A millisecond timestamp with day-granularity helpers.
 *
 * Values parsed from a {@code yyyy-MM-dd} string sit at 00:00:00 UTC of that day.
 * Values built from raw millis or instants carry exactly what they were given;
 * use {@link #truncatedToDay()} to normalize.
 */
public final class DayTime implements Comparable<DayTime> {

    public static final long MILLIS_PER_HOUR = 3_600_000L;
    public static final long MILLIS_PER_DAY = 24 * MILLIS_PER_HOUR;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    public static final DayTime EPOCH = new DayTime(0L);

    private final long millis;

    private DayTime(long millis) {
        this.millis = millis;
    }

    public static DayTime ofMillis(long millis) {
        return new DayTime(millis);
    }

    public static DayTime ofInstant(Instant instant) {
        return new DayTime(instant.toEpochMilli());
    }

    /**
     * Parse a calendar date such as {@code 2020-07-31} into midnight UTC of that day.
     *
     * @throws IllegalArgumentException if the text is not a valid ISO local date
     */
    public static DayTime parse(String date) {
        if (date == null) {
            throw new IllegalArgumentException("Date cannot be null");
        }
        try {
            LocalDate day = LocalDate.parse(date.trim(), DATE_FORMAT);
            return new DayTime(day.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                String.format("Invalid date '%s', expected yyyy-MM-dd", date), e);
        }
    }

    public long getMillis() {
        return millis;
    }

    public Instant toInstant() {
        return Instant.ofEpochMilli(millis);
    }

    /**
     * Number of whole UTC days since the epoch.
     */
    public long dayIndex() {
        return Math.floorDiv(millis, MILLIS_PER_DAY);
    }

    public DayTime truncatedToDay() {
        return new DayTime(dayIndex() * MILLIS_PER_DAY);
    }

    public boolean isBefore(DayTime other) {
        return millis < other.millis;
    }

    public boolean isAfter(DayTime other) {
        return millis > other.millis;
    }

    /**
     * The UTC calendar date of this instant, as {@code yyyy-MM-dd}.
     */
    public String format() {
        return LocalDate.ofInstant(toInstant(), ZoneOffset.UTC).format(DATE_FORMAT);
    }

    @Override
    public int compareTo(DayTime other) {
        return Long.compare(millis, other.millis);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DayTime)) return false;
        return millis == ((DayTime) o).millis;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(millis);
    }

    @Override
    public String toString() {
        return format();
    }
}
