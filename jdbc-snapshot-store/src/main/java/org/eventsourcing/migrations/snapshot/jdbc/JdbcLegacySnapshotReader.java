package org.eventsourcing.migrations.snapshot.jdbc;

import java.sql.ResultSet;
import java.sql.SQLException;
import javax.sql.DataSource;

import org.eventsourcing.migrations.snapshot.pipeline.ir.LegacySnapshotRow;
import org.eventsourcing.migrations.snapshot.pipeline.source.LegacySnapshotReader;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Reads the legacy snapshot table. Columns are read by position, in the order
 * {@link LegacySnapshotQueries} selects them.
 */
@Slf4j
public class JdbcLegacySnapshotReader implements LegacySnapshotReader {
    private final DataSource dataSource;
    private final LegacySnapshotQueries queries;
    private final int fetchSize;

    public JdbcLegacySnapshotReader(DataSource dataSource, LegacySnapshotQueries queries, int fetchSize) {
        this.dataSource = dataSource;
        this.queries = queries;
        this.fetchSize = fetchSize;
    }

    @Override
    public Mono<LegacySnapshotRow> latestFor(String persistenceId) {
        return Mono.fromCallable(() -> selectLatest(persistenceId))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<LegacySnapshotRow> streamAll() {
        return JdbcRowStream.query(dataSource, queries.selectAll(), statement -> {}, JdbcLegacySnapshotReader::toRow,
            fetchSize, "scan legacy snapshots");
    }

    @Override
    public Flux<LegacySnapshotRow> readPage(long offset, int limit) {
        return JdbcRowStream.query(
            dataSource,
            queries.selectPage(),
            statement -> queries.bindPage(statement, offset, limit),
            JdbcLegacySnapshotReader::toRow,
            Math.min(fetchSize, limit),
            "read legacy snapshots from offset " + offset
        );
    }

    private LegacySnapshotRow selectLatest(String persistenceId) {
        try (var connection = dataSource.getConnection();
             var statement = connection.prepareStatement(queries.selectLatestByPersistenceId())) {
            statement.setMaxRows(1);
            statement.setString(1, persistenceId);
            try (var resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return null;
                }
                var row = toRow(resultSet);
                log.atTrace().setMessage("Latest legacy snapshot of {} is at sequence number {}")
                    .addArgument(persistenceId).addArgument(row.sequenceNumber()).log();
                return row;
            }
        } catch (SQLException e) {
            throw SqlExceptionTranslator.forRead("read latest snapshot of " + persistenceId, e);
        }
    }

    static LegacySnapshotRow toRow(ResultSet resultSet) throws SQLException {
        var persistenceId = resultSet.getString(1);
        var sequenceNumber = resultSet.getLong(2);
        var created = resultSet.getLong(3);
        var snapshot = resultSet.getBytes(4);
        int serializerId = resultSet.getInt(5);
        Integer nullableSerializerId = resultSet.wasNull() ? null : serializerId;
        var manifest = resultSet.getString(6);
        return new LegacySnapshotRow(persistenceId, sequenceNumber, created, snapshot, nullableSerializerId, manifest);
    }
}
