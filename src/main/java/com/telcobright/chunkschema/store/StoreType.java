package com.telcobright.chunkschema.store;

import java.util.Arrays;
import java.util.Optional;

/**
 * Storage backends a period can name as its index or object store.
 *
 * Backends that keep chunks in tables of their own need a chunk table prefix to
 * tell those tables apart; {@link #requiresChunkPrefix()} reports this.
 */
public enum StoreType {

    AWS_DYNAMO("aws-dynamo", true),
    CASSANDRA("cassandra", true),
    BIGTABLE("bigtable", true),
    BIGTABLE_HASHED("bigtable-hashed", true),
    GCP("gcp", true),
    GCP_COLUMNKEY("gcp-columnkey", true),
    GRPC_STORE("grpc-store", true),

    AWS("aws", false),
    S3("s3", false),
    GCS("gcs", false),
    AZURE("azure", false),
    SWIFT("swift", false),
    FILESYSTEM("filesystem", false),
    BOLTDB("boltdb", false),
    BOLTDB_SHIPPER("boltdb-shipper", false),
    INMEMORY("inmemory", false);

    private final String identifier;
    private final boolean chunkPrefixRequired;

    StoreType(String identifier, boolean chunkPrefixRequired) {
        this.identifier = identifier;
        this.chunkPrefixRequired = chunkPrefixRequired;
    }

    /**
     * The name used for this backend in configuration files.
     */
    public String getIdentifier() {
        return identifier;
    }

    public boolean requiresChunkPrefix() {
        return chunkPrefixRequired;
    }

    /**
     * Look up a backend by its configuration name. Unknown names are not an error;
     * they simply have no special requirements.
     */
    public static Optional<StoreType> fromIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.identifier.equals(identifier))
            .findFirst();
    }
}
