package org.eventsourcing.migrations.snapshot.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import javax.sql.DataSource;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * Exposes a JDBC result set as a Flux that reads one row per requested element.
 *
 * The connection is borrowed on subscription and returned when the Flux completes, fails or is
 * cancelled. All cursor access happens on one bounded-elastic worker.
 */
@Slf4j
final class JdbcRowStream {
    private JdbcRowStream() {}

    @FunctionalInterface
    interface StatementBinder {
        void bind(PreparedStatement statement) throws SQLException;
    }

    @FunctionalInterface
    interface RowMapper<T> {
        T map(ResultSet resultSet) throws SQLException;
    }

    static <T> Flux<T> query(
        DataSource dataSource,
        String sql,
        StatementBinder binder,
        RowMapper<T> mapper,
        int fetchSize,
        String operation
    ) {
        return Flux.<T, OpenCursor>generate(
                () -> OpenCursor.open(dataSource, sql, binder, fetchSize, operation),
                (cursor, sink) -> {
                    try {
                        if (cursor.resultSet.next()) {
                            sink.next(mapper.map(cursor.resultSet));
                        } else {
                            sink.complete();
                        }
                    } catch (SQLException e) {
                        sink.error(SqlExceptionTranslator.forRead(operation, e));
                    }
                    return cursor;
                },
                OpenCursor::close)
            .subscribeOn(Schedulers.boundedElastic());
    }

    private static final class OpenCursor {
        private final Connection connection;
        private final PreparedStatement statement;
        private final ResultSet resultSet;
        private final boolean autoCommit;
        private final String operation;

        private OpenCursor(Connection connection, PreparedStatement statement, ResultSet resultSet,
                           boolean autoCommit, String operation) {
            this.connection = connection;
            this.statement = statement;
            this.resultSet = resultSet;
            this.autoCommit = autoCommit;
            this.operation = operation;
        }

        static OpenCursor open(DataSource dataSource, String sql, StatementBinder binder, int fetchSize,
                               String operation) {
            Connection connection = null;
            PreparedStatement statement = null;
            try {
                connection = dataSource.getConnection();
                boolean autoCommit = connection.getAutoCommit();
                // Drivers such as PostgreSQL only stream with a fetch size inside a transaction
                connection.setAutoCommit(false);
                statement = connection.prepareStatement(sql, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
                statement.setFetchSize(fetchSize);
                binder.bind(statement);
                log.atDebug().setMessage("Opening cursor to {}: {}").addArgument(operation).addArgument(sql).log();
                return new OpenCursor(connection, statement, statement.executeQuery(), autoCommit, operation);
            } catch (SQLException e) {
                var translated = SqlExceptionTranslator.forRead(operation, e);
                closeAfterFailure(statement, connection, translated);
                throw translated;
            }
        }

        void close() {
            try {
                resultSet.close();
                statement.close();
                connection.rollback();
                connection.setAutoCommit(autoCommit);
            } catch (SQLException e) {
                log.warn("Failed to release cursor used to {}", operation, e);
            } finally {
                try {
                    connection.close();
                } catch (SQLException e) {
                    log.warn("Failed to close connection used to {}", operation, e);
                }
            }
            log.atDebug().setMessage("Closed cursor used to {}").addArgument(operation).log();
        }

        private static void closeAfterFailure(PreparedStatement statement, Connection connection, Exception primary) {
            try {
                if (statement != null) {
                    statement.close();
                }
                if (connection != null) {
                    connection.close();
                }
            } catch (SQLException e) {
                primary.addSuppressed(e);
            }
        }
    }
}
