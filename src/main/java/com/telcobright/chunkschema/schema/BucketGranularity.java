package com.telcobright.chunkschema.schema;

import com.telcobright.chunkschema.time.DayTime;

/**
 * Size of the addressing buckets a schema generation splits index writes into.
 */
public enum BucketGranularity {

    HOURLY(DayTime.MILLIS_PER_HOUR, ":"),
    DAILY(DayTime.MILLIS_PER_DAY, ":d");

    private final long bucketMillis;
    private final String hashKeySeparator;

    BucketGranularity(long bucketMillis, String hashKeySeparator) {
        this.bucketMillis = bucketMillis;
        this.hashKeySeparator = hashKeySeparator;
    }

    public long getBucketMillis() {
        return bucketMillis;
    }

    /**
     * Hash key of bucket {@code index} for a tenant, e.g. {@code user:d18000} for days
     * and {@code user:432000} for hours.
     */
    public String hashKey(String userId, long index) {
        return userId + hashKeySeparator + index;
    }
}
