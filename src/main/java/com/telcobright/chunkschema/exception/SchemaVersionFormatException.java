package com.telcobright.chunkschema.exception;

/**
 * The schema string is not of the form {@code v<N>}.
 */
public class SchemaVersionFormatException extends ChunkSchemaException {

    private final String schema;

    public SchemaVersionFormatException(String schema) {
        super(String.format("malformed schema version '%s', expected v<N>", schema));
        this.schema = schema;
    }

    public SchemaVersionFormatException(String schema, Throwable cause) {
        super(String.format("malformed schema version '%s', expected v<N>", schema), cause);
        this.schema = schema;
    }

    public String getSchema() {
        return schema;
    }
}
