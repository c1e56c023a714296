package com.telcobright.chunkschema.routing;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.telcobright.chunkschema.schema.Bucket;
import com.telcobright.chunkschema.schema.PeriodConfig;

import java.nio.charset.StandardCharsets;

/**
 * Spreads the index rows of one bucket over a period's row shards.
 *
 * Row-sharded schemas (v10 and later) prefix the bucket hash key with a two-digit
 * shard number derived from the series key, so that the rows of a busy tenant-day
 * do not all land on the same partition.
 */
public class RowShardRouter {

    private static final HashFunction HASH = Hashing.murmur3_32_fixed();

    private final int rowShards;

    public RowShardRouter(int rowShards) {
        if (rowShards <= 0) {
            throw new IllegalArgumentException("Row shards must be positive");
        }
        this.rowShards = rowShards;
    }

    /**
     * Router for a validated row-sharded period.
     *
     * @throws IllegalArgumentException if the period has no row shards configured
     */
    public static RowShardRouter forPeriod(PeriodConfig period) {
        if (period.getRowShards() <= 0) {
            throw new IllegalArgumentException(
                String.format("Period from %s (schema %s) has no row shards", period.getFrom(), period.getSchema()));
        }
        return new RowShardRouter(period.getRowShards());
    }

    public int getRowShards() {
        return rowShards;
    }

    /**
     * Shard of a series key, in {@code [0, rowShards)}.
     */
    public int shardFor(String seriesKey) {
        if (seriesKey == null) {
            throw new IllegalArgumentException("Series key cannot be null");
        }
        int hash = HASH.hashString(seriesKey, StandardCharsets.UTF_8).asInt();
        return Math.floorMod(hash, rowShards);
    }

    /**
     * Hash key of the bucket row for a series, e.g. {@code 07:tenant:d18000}.
     */
    public String shardedHashKey(Bucket bucket, String seriesKey) {
        return String.format("%02d:%s", shardFor(seriesKey), bucket.getHashKey());
    }

    /**
     * How many of the given keys land on each shard. Handy for checking spread.
     */
    public int[] distribution(Iterable<String> seriesKeys) {
        int[] distribution = new int[rowShards];
        for (String key : seriesKeys) {
            distribution[shardFor(key)]++;
        }
        return distribution;
    }
}
