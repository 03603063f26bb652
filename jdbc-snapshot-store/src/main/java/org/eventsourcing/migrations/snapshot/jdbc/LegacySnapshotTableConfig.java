package org.eventsourcing.migrations.snapshot.jdbc;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Names of the legacy snapshot table and its columns.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LegacySnapshotTableConfig {
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
    String snapshotColumn = "snapshot";
    @Builder.Default
    String serializerIdColumn = "snapshot_ser_id";
    @Builder.Default
    String serializerManifestColumn = "snapshot_ser_manifest";

    public static LegacySnapshotTableConfig defaults() {
        return builder().build();
    }

    public String qualifiedTableName() {
        return TableNames.qualify(schemaName, tableName);
    }
}
