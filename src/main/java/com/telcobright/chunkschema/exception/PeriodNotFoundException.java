package com.telcobright.chunkschema.exception;

/**
 * No configured period is active at the requested timestamp, i.e. it predates every
 * configured {@code from}.
 */
public class PeriodNotFoundException extends ChunkSchemaException {

    private final long timestamp;

    public PeriodNotFoundException(long timestamp) {
        super(String.format("no schema period found for timestamp %d", timestamp));
        this.timestamp = timestamp;
    }

    public long getTimestamp() {
        return timestamp;
    }
}
