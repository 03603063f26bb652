package org.eventsourcing.migrations.snapshot.jdbc;

/**
 * SQL against the new snapshot table.
 */
public class SnapshotWriteQueries {
    private final SnapshotTableConfig table;

    public SnapshotWriteQueries(SnapshotTableConfig table) {
        this.table = table;
    }

    /**
     * Parameters: persistence id, sequence number, created, serializer id, manifest, payload.
     * Metadata columns are left NULL.
     */
    public String insert() {
        return "INSERT INTO " + table.qualifiedTableName() + " ("
            + String.join(", ",
                table.getPersistenceIdColumn(),
                table.getSequenceNumberColumn(),
                table.getCreatedColumn(),
                table.getSerializerIdColumn(),
                table.getSerializerManifestColumn(),
                table.getPayloadColumn(),
                table.getMetaSerializerIdColumn(),
                table.getMetaSerializerManifestColumn(),
                table.getMetaPayloadColumn())
            + ") VALUES (?, ?, ?, ?, ?, ?, NULL, NULL, NULL)";
    }

    /** One parameter: persistence id. */
    public String deleteByPersistenceId() {
        return "DELETE FROM " + table.qualifiedTableName() + " WHERE " + table.getPersistenceIdColumn() + " = ?";
    }

    /** Parameters: persistence id, sequence number. */
    public String deleteByKey() {
        return deleteByPersistenceId() + " AND " + table.getSequenceNumberColumn() + " = ?";
    }
}
