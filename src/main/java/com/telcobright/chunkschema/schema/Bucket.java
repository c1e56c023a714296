package com.telcobright.chunkschema.schema;

import java.util.Objects;

/**
 * The part of one bucket (a calendar day, or an hour for v1) that a range covers,
 * for one tenant.
 *
 * {@code from} and {@code through} are millisecond offsets from the start of the
 * bucket. The hash key identifies the bucket independently of the physical table.
 */
public final class Bucket {

    private final long from;
    private final long through;
    private final String tableName;
    private final String hashKey;
    private final int bucketSize;

    public Bucket(long from, long through, String tableName, String hashKey, int bucketSize) {
        this.from = from;
        this.through = through;
        this.tableName = Objects.requireNonNull(tableName, "tableName");
        this.hashKey = Objects.requireNonNull(hashKey, "hashKey");
        this.bucketSize = bucketSize;
    }

    public long getFrom() { return from; }
    public long getThrough() { return through; }
    public String getTableName() { return tableName; }
    public String getHashKey() { return hashKey; }
    public int getBucketSize() { return bucketSize; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bucket)) return false;
        Bucket bucket = (Bucket) o;
        return from == bucket.from
            && through == bucket.through
            && bucketSize == bucket.bucketSize
            && tableName.equals(bucket.tableName)
            && hashKey.equals(bucket.hashKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, through, tableName, hashKey, bucketSize);
    }

    @Override
    public String toString() {
        return String.format("Bucket{table='%s', hashKey='%s', from=%d, through=%d, size=%d}",
            tableName, hashKey, from, through, bucketSize);
    }
}
