package com.telcobright.chunkschema.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

@DisplayName("StoreType Tests")
class StoreTypeTest {

    @Test
    @DisplayName("Should look up backends by their configuration name")
    void testFromIdentifier() {
        assertThat(StoreType.fromIdentifier("bigtable-hashed")).contains(StoreType.BIGTABLE_HASHED);
        assertThat(StoreType.fromIdentifier("boltdb-shipper")).contains(StoreType.BOLTDB_SHIPPER);
        assertThat(StoreType.fromIdentifier("some-new-store")).isEmpty();
        assertThat(StoreType.fromIdentifier("")).isEmpty();
        assertThat(StoreType.fromIdentifier(null)).isEmpty();
    }

    @Test
    @DisplayName("Should require a chunk prefix only for table-backed chunk stores")
    void testRequiresChunkPrefix() {
        assertThat(Arrays.stream(StoreType.values())
                .filter(StoreType::requiresChunkPrefix)
                .map(StoreType::getIdentifier)
                .collect(Collectors.toList()))
            .containsExactlyInAnyOrder("aws-dynamo", "cassandra", "bigtable", "bigtable-hashed",
                "gcp", "gcp-columnkey", "grpc-store");
    }
}
