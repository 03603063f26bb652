package org.eventsourcing.migrations.snapshot.jdbc;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Names of the target snapshot table in the new schema. Its primary key is
 * (persistence id, sequence number).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SnapshotTableConfig {
    String schemaName;
    @Builder.Default
    String tableName = "snapshot";
    @Builder.Default
    String persistenceIdColumn = "persistence_id";
    @Builder.Default
    String sequenceNumberColumn = "sequence_number";
    @Builder.Default
    String createdColumn = "created";
    @Builder.Default
    String serializerIdColumn = "snapshot_ser_id";
    @Builder.Default
    String serializerManifestColumn = "snapshot_ser_manifest";
    @Builder.Default
    String payloadColumn = "snapshot_payload";
    @Builder.Default
    String metaSerializerIdColumn = "meta_ser_id";
    @Builder.Default
    String metaSerializerManifestColumn = "meta_ser_manifest";
    @Builder.Default
    String metaPayloadColumn = "meta_payload";

    public static SnapshotTableConfig defaults() {
        return builder().build();
    }

    public String qualifiedTableName() {
        return TableNames.qualify(schemaName, tableName);
    }
}
