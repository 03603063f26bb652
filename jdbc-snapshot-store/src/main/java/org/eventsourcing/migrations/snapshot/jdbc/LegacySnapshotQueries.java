package org.eventsourcing.migrations.snapshot.jdbc;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * SQL against the legacy schema. Every scan is ordered by persistence id then sequence number.
 */
public class LegacySnapshotQueries {
    private final String selectColumns;
    private final String from;
    private final String persistenceIdColumn;
    private final String scanOrder;
    private final String latestOrder;
    private final JournalTableConfig journal;
    private final SqlDialect snapshotDialect;
    private final SqlDialect journalDialect;

    public LegacySnapshotQueries(LegacySnapshotTableConfig snapshots, JournalTableConfig journal) {
        this(snapshots, SqlDialect.STANDARD, journal, SqlDialect.STANDARD);
    }

    /**
     * @param snapshotDialect dialect of the database holding the legacy snapshot table
     * @param journalDialect dialect of the database holding the journal
     */
    public LegacySnapshotQueries(LegacySnapshotTableConfig snapshots, SqlDialect snapshotDialect,
                                 JournalTableConfig journal, SqlDialect journalDialect) {
        this.selectColumns = String.join(", ",
            snapshots.getPersistenceIdColumn(),
            snapshots.getSequenceNumberColumn(),
            snapshots.getCreatedColumn(),
            snapshots.getSnapshotColumn(),
            snapshots.getSerializerIdColumn(),
            snapshots.getSerializerManifestColumn());
        this.from = snapshots.qualifiedTableName();
        this.persistenceIdColumn = snapshots.getPersistenceIdColumn();
        this.scanOrder = snapshots.getPersistenceIdColumn() + ", " + snapshots.getSequenceNumberColumn();
        this.latestOrder = snapshots.getSequenceNumberColumn() + " DESC, " + snapshots.getCreatedColumn() + " DESC";
        this.journal = journal;
        this.snapshotDialect = snapshotDialect;
        this.journalDialect = journalDialect;
    }

    /** One parameter: persistence id. Read only the first row. */
    public String selectLatestByPersistenceId() {
        return "SELECT " + selectColumns + " FROM " + from
            + " WHERE " + persistenceIdColumn + " = ?"
            + " ORDER BY " + latestOrder;
    }

    public String selectAll() {
        return "SELECT " + selectColumns + " FROM " + from + " ORDER BY " + scanOrder;
    }

    /** Parameters are bound with {@link #bindPage}. */
    public String selectPage() {
        return selectAll() + snapshotDialect.page();
    }

    public void bindPage(PreparedStatement statement, long offset, int limit) throws SQLException {
        snapshotDialect.bindPage(statement, offset, limit);
    }

    /** One parameter, the row count, when {@code limited}. */
    public String selectDistinctPersistenceIds(boolean limited) {
        var column = journal.getPersistenceIdColumn();
        var sql = "SELECT DISTINCT " + column + " FROM " + journal.qualifiedTableName() + " ORDER BY " + column;
        return limited ? sql + journalDialect.firstRows() : sql;
    }
}
