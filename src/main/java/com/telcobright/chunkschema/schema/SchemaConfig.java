package com.telcobright.chunkschema.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.Range;
import com.telcobright.chunkschema.exception.PeriodNotFoundException;
import com.telcobright.chunkschema.exception.SchemaConfigException;
import com.telcobright.chunkschema.exception.SchemaConfigException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The ordered list of schema periods of a deployment.
 *
 * <p>Periods are sorted by strictly increasing {@code from}; {@link #validate()} enforces
 * this together with the per-period rules. New periods are only ever appended with a
 * later {@code from}. Build one instance at startup, validate it, and hand the
 * validated value to whatever needs to address tables. Lookups assume a validated
 * configuration.
 */
public final class SchemaConfig {

    private static final Logger logger = LoggerFactory.getLogger(SchemaConfig.class);

    private final List<PeriodConfig> configs;

    @JsonCreator
    public SchemaConfig(@JsonProperty("configs") List<PeriodConfig> configs) {
        this.configs = configs == null ? List.of() : List.copyOf(configs);
    }

    public static SchemaConfig of(PeriodConfig... configs) {
        return new SchemaConfig(List.of(configs));
    }

    @JsonProperty("configs")
    public List<PeriodConfig> getConfigs() {
        return configs;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return configs.isEmpty();
    }

    /**
     * Apply defaults to every period and check the whole configuration.
     *
     * @return the configuration with defaults applied
     * @throws SchemaConfigException on the first broken rule
     */
    public SchemaConfig validate() throws SchemaConfigException {
        List<PeriodConfig> validated = new ArrayList<>(configs.size());
        for (int i = 0; i < configs.size(); i++) {
            PeriodConfig period = configs.get(i).withDefaults();
            if (period.getRowShards() != configs.get(i).getRowShards()) {
                logger.info("Applied default row_shards={} to period from {} (schema {})",
                    period.getRowShards(), period.getFrom(), period.getSchema());
            }
            period.validate();

            if (i + 1 < configs.size() && !period.getFrom().isBefore(configs.get(i + 1).getFrom())) {
                throw new SchemaConfigException(Reason.NON_INCREASING_FROM_TIME,
                    String.format("from time in schemas must be distinct and in increasing order: %s is followed by %s",
                        period.getFrom(), configs.get(i + 1).getFrom()));
            }
            validated.add(period);
        }
        logger.debug("Validated schema config with {} period(s)", validated.size());
        return new SchemaConfig(validated);
    }

    /**
     * The period active at {@code timestampMillis}: the last one whose {@code from} is
     * not after it.
     *
     * @throws PeriodNotFoundException if the timestamp predates every period
     */
    public PeriodConfig schemaForTime(long timestampMillis) throws PeriodNotFoundException {
        int index = activeIndex(timestampMillis);
        if (index < 0) {
            throw new PeriodNotFoundException(timestampMillis);
        }
        return configs.get(index);
    }

    /**
     * Name of the chunk table for {@code timestampMillis}, resolved against the period
     * active at that time.
     *
     * @throws PeriodNotFoundException if the timestamp predates every period
     */
    public String chunkTableFor(long timestampMillis) throws PeriodNotFoundException {
        return schemaForTime(timestampMillis).chunkTableFor(timestampMillis);
    }

    /**
     * Name of the index table for {@code timestampMillis}, resolved against the period
     * active at that time.
     *
     * @throws PeriodNotFoundException if the timestamp predates every period
     */
    public String indexTableFor(long timestampMillis) throws PeriodNotFoundException {
        return schemaForTime(timestampMillis).indexTableFor(timestampMillis);
    }

    /**
     * Cut {@code [from, through)} at period boundaries.
     *
     * <p>Slices come back in time order, one per period the range overlaps. Parts of the
     * range before the first period are dropped. An empty range yields one empty slice
     * if some period is active at {@code from}, otherwise nothing.
     */
    public List<PeriodSlice> splitByPeriod(long from, long through) {
        if (from > through) {
            throw new IllegalArgumentException(
                String.format("Range start %d is after its end %d", from, through));
        }

        List<PeriodSlice> result = new ArrayList<>();
        if (from == through) {
            int index = activeIndex(from);
            if (index >= 0) {
                result.add(new PeriodSlice(configs.get(index), Range.closedOpen(from, through)));
            }
            return result;
        }

        Range<Long> query = Range.closedOpen(from, through);
        for (int i = 0; i < configs.size(); i++) {
            long start = configs.get(i).getFrom().getMillis();
            Range<Long> active;
            if (i + 1 < configs.size()) {
                long end = configs.get(i + 1).getFrom().getMillis();
                if (end <= start) {
                    continue;
                }
                active = Range.closedOpen(start, end);
            } else {
                active = Range.atLeast(start);
            }

            if (active.isConnected(query)) {
                Range<Long> overlap = active.intersection(query);
                if (!overlap.isEmpty()) {
                    result.add(new PeriodSlice(configs.get(i), overlap));
                }
            }
        }
        return result;
    }

    private int activeIndex(long timestampMillis) {
        for (int i = configs.size() - 1; i >= 0; i--) {
            if (configs.get(i).getFrom().getMillis() <= timestampMillis) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SchemaConfig)) return false;
        return configs.equals(((SchemaConfig) o).configs);
    }

    @Override
    public int hashCode() {
        return configs.hashCode();
    }

    @Override
    public String toString() {
        return "SchemaConfig" + configs;
    }
}
