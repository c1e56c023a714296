package com.telcobright.chunkschema.schema;

import java.util.Arrays;
import java.util.Optional;

/**
 * The schema generations this layer knows how to address.
 *
 * v7 and v8 were never released. v1 buckets index rows by hour, every later version
 * by day. From v10 on, index rows are spread over row shards and table periods must
 * be whole days.
 */
public enum SchemaVersion {

    V1(1),
    V2(2),
    V3(3),
    V4(4),
    V5(5),
    V6(6),
    V9(9),
    V10(10),
    V11(11),
    V12(12);

    public static final int ROW_SHARDED_SINCE = 10;

    private final int number;

    SchemaVersion(int number) {
        this.number = number;
    }

    public int getNumber() {
        return number;
    }

    public boolean isRowSharded() {
        return number >= ROW_SHARDED_SINCE;
    }

    public BucketGranularity getBucketGranularity() {
        return this == V1 ? BucketGranularity.HOURLY : BucketGranularity.DAILY;
    }

    public static Optional<SchemaVersion> fromNumber(int number) {
        return Arrays.stream(values())
            .filter(version -> version.number == number)
            .findFirst();
    }

    @Override
    public String toString() {
        return "v" + number;
    }
}
