package org.eventsourcing.migrations.snapshot.jdbc;

import javax.sql.DataSource;

import org.eventsourcing.migrations.snapshot.pipeline.source.EntityEnumerator;

import reactor.core.publisher.Flux;

/**
 * Distinct persistence ids of the journal table, in ascending order.
 */
public class JdbcEntityEnumerator implements EntityEnumerator {
    private final DataSource journalDataSource;
    private final LegacySnapshotQueries queries;
    private final int fetchSize;

    public JdbcEntityEnumerator(DataSource journalDataSource, LegacySnapshotQueries queries, int fetchSize) {
        this.journalDataSource = journalDataSource;
        this.queries = queries;
        this.fetchSize = fetchSize;
    }

    @Override
    public Flux<String> enumerate(long limit) {
        if (limit <= 0) {
            return Flux.empty();
        }
        boolean limited = limit < Long.MAX_VALUE;
        return JdbcRowStream.query(
            journalDataSource,
            queries.selectDistinctPersistenceIds(limited),
            statement -> {
                if (limited) {
                    statement.setLong(1, limit);
                }
            },
            resultSet -> resultSet.getString(1),
            fetchSize,
            "enumerate persistence ids"
        );
    }
}
