package com.telcobright.chunkschema.exception;

/**
 * Raised when a schema configuration is malformed. These errors are detected once,
 * at validation time, and must stop startup.
 */
public class SchemaConfigException extends ChunkSchemaException {

    /**
     * What is wrong with the configuration.
     */
    public enum Reason {
        INVALID_SCHEMA_VERSION("invalid schema version"),
        INVALID_TABLE_PERIOD("the table period must be a multiple of 24h"),
        ROW_SHARDS_REQUIRED("row shards must be greater than zero"),
        CHUNK_PREFIX_NOT_SET("schema config for chunks is missing the 'prefix' setting"),
        NON_INCREASING_FROM_TIME("from time in schemas must be distinct and in increasing order");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Reason reason;

    public SchemaConfigException(Reason reason) {
        this(reason, reason.getDescription());
    }

    public SchemaConfigException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SchemaConfigException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
