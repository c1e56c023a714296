package com.telcobright.chunkschema.schema;

import com.google.common.collect.Range;

import java.util.Objects;

/**
 * The part of a queried range that falls inside one schema period.
 */
public final class PeriodSlice {

    private final PeriodConfig period;
    private final Range<Long> range;

    public PeriodSlice(PeriodConfig period, Range<Long> range) {
        this.period = Objects.requireNonNull(period, "period");
        this.range = Objects.requireNonNull(range, "range");
    }

    public PeriodConfig getPeriod() { return period; }

    /**
     * Closed-open interval of epoch millis.
     */
    public Range<Long> getRange() { return range; }

    public long getFrom() { return range.lowerEndpoint(); }
    public long getThrough() { return range.upperEndpoint(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeriodSlice)) return false;
        PeriodSlice that = (PeriodSlice) o;
        return period.equals(that.period) && range.equals(that.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, range);
    }

    @Override
    public String toString() {
        return String.format("PeriodSlice{from=%s, schema='%s', range=%s}",
            period.getFrom(), period.getSchema(), range);
    }
}
