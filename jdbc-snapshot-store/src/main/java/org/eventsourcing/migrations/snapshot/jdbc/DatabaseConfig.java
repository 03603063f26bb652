package org.eventsourcing.migrations.snapshot.jdbc;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Connection and pool settings for one database.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DatabaseConfig {
    String jdbcUrl;
    String username;
    @ToString.Exclude
    String password;
    /** Optional, the driver is normally found from the URL. */
    String driverClassName;
    @Builder.Default
    int maximumPoolSize = 4;
    @Builder.Default
    int minimumIdle = 1;
    @Builder.Default
    long connectionTimeoutMs = 30_000;
    @Builder.Default
    long idleTimeoutMs = 600_000;
    @Builder.Default
    long maxLifetimeMs = 1_800_000;
    /** Rows fetched per round trip while streaming a scan. */
    @Builder.Default
    int fetchSize = 500;
    /** Optional, derived from the URL when absent. */
    SqlDialect sqlDialect;

    public SqlDialect effectiveSqlDialect() {
        return sqlDialect != null ? sqlDialect : SqlDialect.forJdbcUrl(jdbcUrl);
    }
}
