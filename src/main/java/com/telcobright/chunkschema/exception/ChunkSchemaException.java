package com.telcobright.chunkschema.exception;

/**
 * Base class for errors raised while resolving or validating the chunk schema.
 */
public class ChunkSchemaException extends Exception {

    public ChunkSchemaException(String message) {
        super(message);
    }

    public ChunkSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
