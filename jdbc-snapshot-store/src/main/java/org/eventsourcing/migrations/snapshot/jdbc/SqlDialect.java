package org.eventsourcing.migrations.snapshot.jdbc;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Row-limiting syntax of the database. Both forms expect an ORDER BY before them.
 */
public enum SqlDialect {
    /** SQL:2008 {@code OFFSET ... FETCH}: PostgreSQL, Oracle 12c+, SQL Server 2012+, DB2, H2. */
    STANDARD {
        @Override
        String firstRows() {
            return " OFFSET 0 ROWS FETCH NEXT ? ROWS ONLY";
        }

        @Override
        String page() {
            return " OFFSET ? ROWS FETCH NEXT ? ROWS ONLY";
        }

        @Override
        void bindPage(PreparedStatement statement, long offset, int limit) throws SQLException {
            statement.setLong(1, offset);
            statement.setInt(2, limit);
        }
    },
    /** {@code LIMIT ... OFFSET}: MySQL and MariaDB. */
    MYSQL {
        @Override
        String firstRows() {
            return " LIMIT ?";
        }

        @Override
        String page() {
            return " LIMIT ? OFFSET ?";
        }

        @Override
        void bindPage(PreparedStatement statement, long offset, int limit) throws SQLException {
            statement.setInt(1, limit);
            statement.setLong(2, offset);
        }
    };

    /** Clause with one parameter, the row count. */
    abstract String firstRows();

    /** Clause with an offset and a row count, bound through {@link #bindPage}. */
    abstract String page();

    abstract void bindPage(PreparedStatement statement, long offset, int limit) throws SQLException;

    public static SqlDialect forJdbcUrl(String jdbcUrl) {
        var url = jdbcUrl == null ? "" : jdbcUrl.toLowerCase(Locale.ROOT);
        if (url.startsWith("jdbc:mysql:") || url.startsWith("jdbc:mariadb:") || url.contains(";mode=mysql")) {
            return MYSQL;
        }
        return STANDARD;
    }
}
