package org.eventsourcing.migrations.snapshot.jdbc;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Names of the journal table, consulted only for its persistence ids.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class JournalTableConfig {
    String schemaName;
    @Builder.Default
    String tableName = "journal";
    @Builder.Default
    String persistenceIdColumn = "persistence_id";

    public static JournalTableConfig defaults() {
        return builder().build();
    }

    public String qualifiedTableName() {
        return TableNames.qualify(schemaName, tableName);
    }
}
