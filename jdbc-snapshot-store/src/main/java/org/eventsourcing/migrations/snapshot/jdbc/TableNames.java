package org.eventsourcing.migrations.snapshot.jdbc;

final class TableNames {
    private TableNames() {}

    static String qualify(String schemaName, String tableName) {
        if (schemaName == null || schemaName.isBlank()) {
            return tableName;
        }
        return schemaName + "." + tableName;
    }
}
