package com.telcobright.chunkschema.table;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Describes one table family: a name prefix, a rollover period and the tags to put
 * on created tables.
 *
 * A zero period means a single static table named exactly {@code prefix}. Otherwise
 * the table for instant {@code t} is {@code prefix + floorDiv(t, period)}, counting
 * whole periods since the Unix epoch. An instant exactly on a period boundary
 * belongs to the period that starts there.
 */
@JsonPropertyOrder({"prefix", "period", "tags"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class PeriodicTableConfig {

    public static final PeriodicTableConfig EMPTY = new PeriodicTableConfig("", Duration.ZERO, null);

    private final String prefix;
    private final Duration period;
    private final Map<String, String> tags;

    @JsonCreator
    public PeriodicTableConfig(@JsonProperty("prefix") String prefix,
                               @JsonProperty("period") Duration period,
                               @JsonProperty("tags") Map<String, String> tags) {
        if (period != null && period.isNegative()) {
            throw new IllegalArgumentException("Table period cannot be negative: " + period);
        }
        if (period != null && period.getNano() % 1_000_000 != 0) {
            throw new IllegalArgumentException("Table period must have millisecond precision: " + period);
        }
        this.prefix = prefix == null ? "" : prefix;
        this.period = period == null ? Duration.ZERO : period;
        this.tags = tags == null || tags.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public static PeriodicTableConfig of(String prefix, Duration period) {
        return new PeriodicTableConfig(prefix, period, null);
    }

    /**
     * A single non-rotating table.
     */
    public static PeriodicTableConfig staticTable(String name) {
        return new PeriodicTableConfig(name, Duration.ZERO, null);
    }

    @JsonProperty("prefix")
    public String getPrefix() { return prefix; }

    @JsonProperty("period")
    public Duration getPeriod() { return period; }

    @JsonProperty("tags")
    public Map<String, String> getTags() { return tags; }

    @JsonIgnore
    public boolean isPeriodic() {
        return !period.isZero();
    }

    /**
     * Name of the table active at the given instant.
     *
     * @param timestampMillis epoch milliseconds
     */
    public String tableFor(long timestampMillis) {
        if (!isPeriodic()) {
            return prefix;
        }
        return tableForPeriod(Math.floorDiv(timestampMillis, period.toMillis()));
    }

    /**
     * Name of the table for an explicit period index.
     */
    public String tableForPeriod(long periodIndex) {
        return prefix + periodIndex;
    }

    /**
     * Tables that have to exist to hold data for {@code [from, through)}.
     *
     * <p>A table whose period starts exactly at {@code through} is not included. With a
     * positive retention, tables more than {@code retention / period} periods older
     * than the last one are left out. A table is active when the current time lies in
     * {@code [start - beginGrace, end + endGrace)}.
     *
     * @param from        start of the range, epoch millis (inclusive)
     * @param through     end of the range, epoch millis (exclusive)
     * @param beginGrace  how early a table becomes active before its period starts
     * @param endGrace    how long a table stays active after its period ends
     * @param retention   how much history to keep, zero for no limit
     * @param clock       source of the current time
     */
    public List<TableDesc> periodicTables(long from, long through, Duration beginGrace,
                                          Duration endGrace, Duration retention, Clock clock) {
        if (from > through) {
            throw new IllegalArgumentException(
                String.format("Range start %d is after its end %d", from, through));
        }
        if (!isPeriodic()) {
            return List.of(new TableDesc(prefix, tags, true));
        }

        long periodMillis = period.toMillis();
        long beginGraceMillis = beginGrace.toMillis();
        long endGraceMillis = endGrace.toMillis();
        long firstTable = Math.floorDiv(from, periodMillis);
        long lastTable = Math.floorDiv(through, periodMillis);
        long tablesToKeep = retention.toMillis() / periodMillis;
        long now = clock.millis();

        if (lastTable > firstTable && Math.floorMod(through, periodMillis) == 0) {
            lastTable--;
        }
        if (!retention.isZero() && lastTable - firstTable >= tablesToKeep) {
            firstTable = lastTable - tablesToKeep;
        }

        List<TableDesc> result = new ArrayList<>();
        for (long i = firstTable; i <= lastTable; i++) {
            long start = i * periodMillis;
            boolean active = start - beginGraceMillis <= now && now < start + periodMillis + endGraceMillis;
            result.add(new TableDesc(tableForPeriod(i), tags, active));
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeriodicTableConfig)) return false;
        PeriodicTableConfig that = (PeriodicTableConfig) o;
        return prefix.equals(that.prefix) && period.equals(that.period) && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, period, tags);
    }

    @Override
    public String toString() {
        return String.format("PeriodicTableConfig{prefix='%s', period=%s, tags=%s}", prefix, period, tags);
    }
}
