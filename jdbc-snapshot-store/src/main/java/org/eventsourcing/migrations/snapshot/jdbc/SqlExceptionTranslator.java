package org.eventsourcing.migrations.snapshot.jdbc;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTransientConnectionException;

import org.eventsourcing.migrations.snapshot.pipeline.error.ConnectionException;
import org.eventsourcing.migrations.snapshot.pipeline.error.QueryException;
import org.eventsourcing.migrations.snapshot.pipeline.error.SnapshotMigrationException;
import org.eventsourcing.migrations.snapshot.pipeline.error.WriteException;

/**
 * Maps SQLExceptions onto the migration error taxonomy using the exception type and the
 * SQLState class: {@code 08} connection, {@code 23} integrity violation, {@code 42} syntax or
 * missing object.
 */
public final class SqlExceptionTranslator {
    private SqlExceptionTranslator() {}

    public static SnapshotMigrationException forRead(String operation, SQLException e) {
        var message = describe(operation, e);
        if (isConnectionFailure(e)) {
            return new ConnectionException(message, e);
        }
        return new QueryException(message, e);
    }

    public static SnapshotMigrationException forWrite(String operation, SQLException e) {
        var message = describe(operation, e);
        if (isConnectionFailure(e)) {
            return new ConnectionException(message, e);
        }
        if (isSyntaxError(e)) {
            return new QueryException(message, e);
        }
        return new WriteException(message, e);
    }

    static boolean isConnectionFailure(SQLException e) {
        return e instanceof SQLTransientConnectionException
            || e instanceof SQLNonTransientConnectionException
            || hasStateClass(e, "08");
    }

    static boolean isIntegrityViolation(SQLException e) {
        return e instanceof SQLIntegrityConstraintViolationException || hasStateClass(e, "23");
    }

    static boolean isSyntaxError(SQLException e) {
        return e instanceof SQLSyntaxErrorException || hasStateClass(e, "42");
    }

    private static boolean hasStateClass(SQLException e, String stateClass) {
        return e.getSQLState() != null && e.getSQLState().startsWith(stateClass);
    }

    private static String describe(String operation, SQLException e) {
        var kind = isIntegrityViolation(e) ? " (constraint violation)" : "";
        return "Failed to " + operation + kind + ": " + e.getMessage() + " [SQLState " + e.getSQLState() + "]";
    }
}
