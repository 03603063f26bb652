package org.eventsourcing.migrations.snapshot.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;

import org.eventsourcing.migrations.snapshot.pipeline.codec.SnapshotCodec;
import org.eventsourcing.migrations.snapshot.pipeline.ir.DecodedSnapshot;
import org.eventsourcing.migrations.snapshot.pipeline.ir.TargetSnapshotRow;
import org.eventsourcing.migrations.snapshot.pipeline.sink.SnapshotSink;
import org.eventsourcing.migrations.snapshot.pipeline.sink.WriteMode;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Writes snapshots into the new snapshot table, one transaction per snapshot.
 *
 * REPLACE_LATEST deletes every row of the entity before inserting, so the table ends up with
 * one row per entity. UPSERT deletes only the row with the same key. INSERT relies on the
 * table's primary key to reject duplicates.
 */
@Slf4j
public class JdbcSnapshotSink implements SnapshotSink {
    private final DataSource dataSource;
    private final SnapshotWriteQueries queries;
    private final SnapshotCodec codec;

    public JdbcSnapshotSink(DataSource dataSource, SnapshotWriteQueries queries, SnapshotCodec codec) {
        this.dataSource = dataSource;
        this.queries = queries;
        this.codec = codec;
    }

    @Override
    public Mono<Void> save(DecodedSnapshot snapshot, WriteMode mode) {
        return Mono.fromRunnable(() -> write(TargetSnapshotRow.of(snapshot.metadata(), codec.encode(snapshot.payload())), mode))
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }

    private void write(TargetSnapshotRow row, WriteMode mode) {
        var operation = "write snapshot of " + row.persistenceId() + " at sequence number " + row.sequenceNumber();
        try (var connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                switch (mode) {
                    case REPLACE_LATEST:
                        deleteEntity(connection, row);
                        break;
                    case UPSERT:
                        deleteKey(connection, row);
                        break;
                    case INSERT:
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown write mode " + mode);
                }
                insert(connection, row);
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw SqlExceptionTranslator.forWrite(operation, e);
        }
    }

    private void deleteEntity(Connection connection, TargetSnapshotRow row) throws SQLException {
        try (var statement = connection.prepareStatement(queries.deleteByPersistenceId())) {
            statement.setString(1, row.persistenceId());
            int deleted = statement.executeUpdate();
            if (deleted > 0) {
                log.atDebug().setMessage("Replacing {} existing snapshots of {}")
                    .addArgument(deleted).addArgument(row.persistenceId()).log();
            }
        }
    }

    private void deleteKey(Connection connection, TargetSnapshotRow row) throws SQLException {
        try (var statement = connection.prepareStatement(queries.deleteByKey())) {
            statement.setString(1, row.persistenceId());
            statement.setLong(2, row.sequenceNumber());
            statement.executeUpdate();
        }
    }

    private void insert(Connection connection, TargetSnapshotRow row) throws SQLException {
        try (var statement = connection.prepareStatement(queries.insert())) {
            statement.setString(1, row.persistenceId());
            statement.setLong(2, row.sequenceNumber());
            statement.setLong(3, row.created());
            statement.setInt(4, row.serializerId());
            statement.setString(5, row.serializerManifest());
            statement.setBytes(6, row.payload());
            statement.executeUpdate();
        }
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackException) {
            log.error("Failed to rollback transaction", rollbackException);
            cause.addSuppressed(rollbackException);
        }
    }
}
