package com.telcobright.chunkschema.schema;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Suppliers;
import com.telcobright.chunkschema.exception.SchemaConfigException;
import com.telcobright.chunkschema.exception.SchemaConfigException.Reason;
import com.telcobright.chunkschema.exception.SchemaVersionFormatException;
import com.telcobright.chunkschema.store.StoreType;
import com.telcobright.chunkschema.table.PeriodicTableConfig;
import com.telcobright.chunkschema.time.DayTime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One schema generation: the storage layout in force from {@link #getFrom()} until the
 * next generation starts.
 *
 * <p>Instances are immutable. The integer schema version is parsed on first use and
 * memoized; the memo is not part of equality.
 */
@JsonPropertyOrder({"from", "store", "object_store", "schema", "index", "chunks", "row_shards"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class PeriodConfig {

    public static final int DEFAULT_ROW_SHARDS = 16;

    private static final Pattern VERSION_PATTERN = Pattern.compile("^v(\\d+)$");
    private static final long TABLE_PERIOD_UNIT_MILLIS = Duration.ofHours(24).toMillis();

    private final DayTime from;
    private final String indexType;
    private final String objectType;
    private final String schema;
    private final PeriodicTableConfig indexTables;
    private final PeriodicTableConfig chunkTables;
    private final int rowShards;

    private final Supplier<OptionalInt> schemaVersion = Suppliers.memoize(this::parseVersion);

    @JsonCreator
    PeriodConfig(@JsonProperty("from") DayTime from,
                 @JsonProperty("store") @JsonAlias("index_type") String indexType,
                 @JsonProperty("object_store") String objectType,
                 @JsonProperty("schema") String schema,
                 @JsonProperty("index") PeriodicTableConfig indexTables,
                 @JsonProperty("chunks") PeriodicTableConfig chunkTables,
                 @JsonProperty("row_shards") int rowShards) {
        if (rowShards < 0) {
            throw new IllegalArgumentException("Row shards cannot be negative: " + rowShards);
        }
        this.from = from == null ? DayTime.EPOCH : from;
        this.indexType = indexType == null ? "" : indexType;
        this.objectType = objectType == null ? "" : objectType;
        this.schema = schema == null ? "" : schema;
        this.indexTables = indexTables == null ? PeriodicTableConfig.EMPTY : indexTables;
        this.chunkTables = chunkTables == null ? PeriodicTableConfig.EMPTY : chunkTables;
        this.rowShards = rowShards;
    }

    @JsonProperty("from")
    public DayTime getFrom() { return from; }

    @JsonProperty("store")
    public String getIndexType() { return indexType; }

    @JsonProperty("object_store")
    public String getObjectType() { return objectType; }

    @JsonProperty("schema")
    public String getSchema() { return schema; }

    @JsonProperty("index")
    public PeriodicTableConfig getIndexTables() { return indexTables; }

    @JsonProperty("chunks")
    public PeriodicTableConfig getChunkTables() { return chunkTables; }

    @JsonProperty("row_shards")
    public int getRowShards() { return rowShards; }

    /**
     * The backend chunks are written to: the object store when one is set, otherwise
     * the index store.
     */
    public String effectiveObjectStore() {
        return objectType.isEmpty() ? indexType : objectType;
    }

    /**
     * The integer after the leading {@code v} of the schema string.
     *
     * @throws SchemaVersionFormatException if the schema is not of the form {@code v<N>}
     */
    public int versionAsInt() throws SchemaVersionFormatException {
        OptionalInt version = schemaVersion.get();
        if (version.isEmpty()) {
            throw new SchemaVersionFormatException(schema);
        }
        return version.getAsInt();
    }

    private OptionalInt parseVersion() {
        Matcher matcher = VERSION_PATTERN.matcher(schema);
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * A copy with load-time defaults applied: row-sharded schemas left at zero row
     * shards get {@value #DEFAULT_ROW_SHARDS}. Returns {@code this} when nothing changes.
     */
    public PeriodConfig withDefaults() {
        if (rowShards != 0) {
            return this;
        }
        OptionalInt version = schemaVersion.get();
        if (version.isPresent() && version.getAsInt() >= SchemaVersion.ROW_SHARDED_SINCE) {
            return toBuilder().rowShards(DEFAULT_ROW_SHARDS).build();
        }
        return this;
    }

    /**
     * Check this period on its own. Defaults are not applied here.
     *
     * @throws SchemaConfigException describing the first rule that is broken
     */
    public void validate() throws SchemaConfigException {
        boolean prefixRequired = StoreType.fromIdentifier(effectiveObjectStore())
            .map(StoreType::requiresChunkPrefix)
            .orElse(false);
        if (prefixRequired && chunkTables.getPrefix().isEmpty()) {
            throw new SchemaConfigException(Reason.CHUNK_PREFIX_NOT_SET,
                String.format("schema config for chunks is missing the 'prefix' setting (store %s)",
                    effectiveObjectStore()));
        }

        int version;
        try {
            version = versionAsInt();
        } catch (SchemaVersionFormatException e) {
            throw new SchemaConfigException(Reason.INVALID_SCHEMA_VERSION,
                "invalid schema version: " + e.getMessage(), e);
        }
        if (SchemaVersion.fromNumber(version).isEmpty()) {
            throw new SchemaConfigException(Reason.INVALID_SCHEMA_VERSION,
                String.format("invalid schema version: %s", schema));
        }

        if (version < SchemaVersion.ROW_SHARDED_SINCE) {
            return;
        }

        validateTablePeriod(indexTables);
        validateTablePeriod(chunkTables);

        if (rowShards <= 0) {
            throw new SchemaConfigException(Reason.ROW_SHARDS_REQUIRED,
                String.format("must have row_shards > 0 (current: %d) for schema (%s)", rowShards, schema));
        }
    }

    private void validateTablePeriod(PeriodicTableConfig tables) throws SchemaConfigException {
        long periodMillis = tables.getPeriod().toMillis();
        if (periodMillis > 0 && periodMillis % TABLE_PERIOD_UNIT_MILLIS != 0) {
            throw new SchemaConfigException(Reason.INVALID_TABLE_PERIOD,
                String.format("the table period must be a multiple of 24h, got %s for table prefix '%s'",
                    tables.getPeriod(), tables.getPrefix()));
        }
    }

    /**
     * Name of the chunk table holding data written at {@code timestampMillis}.
     */
    public String chunkTableFor(long timestampMillis) {
        return chunkTables.tableFor(timestampMillis);
    }

    /**
     * Name of the index table holding entries written at {@code timestampMillis}.
     */
    public String indexTableFor(long timestampMillis) {
        return indexTables.tableFor(timestampMillis);
    }

    /**
     * Buckets at the granularity of this period's schema version.
     *
     * @throws SchemaVersionFormatException if the schema string cannot be parsed
     */
    public List<Bucket> buckets(long from, long through, String userId) throws SchemaVersionFormatException {
        int version = versionAsInt();
        BucketGranularity granularity = SchemaVersion.fromNumber(version)
            .map(SchemaVersion::getBucketGranularity)
            .orElse(BucketGranularity.DAILY);
        return buckets(from, through, userId, granularity);
    }

    /**
     * Split {@code [from, through)} into calendar-day buckets.
     *
     * <p>Every day from the one containing {@code from} up to and including the one
     * containing {@code through} gets a bucket. When {@code through} falls exactly on
     * midnight the last bucket is empty ({@code 0..0}).
     *
     * @param from    epoch millis, inclusive
     * @param through epoch millis, exclusive; must not be before {@code from}
     * @param userId  tenant the hash keys are built for
     */
    public List<Bucket> dailyBuckets(long from, long through, String userId) {
        return buckets(from, through, userId, BucketGranularity.DAILY);
    }

    /**
     * Same as {@link #dailyBuckets(long, long, String)} with one-hour buckets.
     */
    public List<Bucket> hourlyBuckets(long from, long through, String userId) {
        return buckets(from, through, userId, BucketGranularity.HOURLY);
    }

    private List<Bucket> buckets(long from, long through, String userId, BucketGranularity granularity) {
        Objects.requireNonNull(userId, "userId");
        if (from > through) {
            throw new IllegalArgumentException(
                String.format("Range start %d is after its end %d", from, through));
        }

        long size = granularity.getBucketMillis();
        long first = Math.floorDiv(from, size);
        long last = Math.floorDiv(through, size);

        List<Bucket> result = new ArrayList<>((int) Math.min(last - first + 1, 1024));
        for (long i = first; i <= last; i++) {
            long start = i * size;
            long relativeFrom = Math.max(0, from - start);
            long relativeThrough = Math.min(size, through - start);
            result.add(new Bucket(relativeFrom, relativeThrough,
                indexTables.tableFor(start), granularity.hashKey(userId, i), (int) size));
        }
        return result;
    }

    public Builder toBuilder() {
        return new Builder()
            .from(from)
            .indexType(indexType)
            .objectType(objectType)
            .schema(schema)
            .indexTables(indexTables)
            .chunkTables(chunkTables)
            .rowShards(rowShards);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DayTime from = DayTime.EPOCH;
        private String indexType = "";
        private String objectType = "";
        private String schema = "";
        private PeriodicTableConfig indexTables = PeriodicTableConfig.EMPTY;
        private PeriodicTableConfig chunkTables = PeriodicTableConfig.EMPTY;
        private int rowShards;

        public Builder from(DayTime from) {
            this.from = from;
            return this;
        }

        public Builder from(String date) {
            this.from = DayTime.parse(date);
            return this;
        }

        public Builder indexType(String indexType) {
            this.indexType = indexType;
            return this;
        }

        public Builder objectType(String objectType) {
            this.objectType = objectType;
            return this;
        }

        /**
         * Use the same backend for index and chunks.
         */
        public Builder store(String store) {
            this.indexType = store;
            this.objectType = store;
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder indexTables(PeriodicTableConfig indexTables) {
            this.indexTables = indexTables;
            return this;
        }

        public Builder chunkTables(PeriodicTableConfig chunkTables) {
            this.chunkTables = chunkTables;
            return this;
        }

        public Builder rowShards(int rowShards) {
            this.rowShards = rowShards;
            return this;
        }

        public PeriodConfig build() {
            return new PeriodConfig(from, indexType, objectType, schema, indexTables, chunkTables, rowShards);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeriodConfig)) return false;
        PeriodConfig that = (PeriodConfig) o;
        return rowShards == that.rowShards
            && from.equals(that.from)
            && indexType.equals(that.indexType)
            && objectType.equals(that.objectType)
            && schema.equals(that.schema)
            && indexTables.equals(that.indexTables)
            && chunkTables.equals(that.chunkTables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, indexType, objectType, schema, indexTables, chunkTables, rowShards);
    }

    @Override
    public String toString() {
        return String.format("PeriodConfig{from=%s, store='%s', objectStore='%s', schema='%s', index=%s, chunks=%s, rowShards=%d}",
            from, indexType, objectType, schema, indexTables, chunkTables, rowShards);
    }
}
