package org.eventsourcing.migrations.snapshot.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds HikariCP pools. The caller owns the pool and closes it.
 */
@Slf4j
public final class DataSourceFactory {
    private DataSourceFactory() {}

    public static HikariDataSource create(String poolName, DatabaseConfig config) {
        if (config == null || config.getJdbcUrl() == null || config.getJdbcUrl().isBlank()) {
            throw new IllegalArgumentException("A JDBC URL is required for the " + poolName + " database");
        }
        var hikariConfig = new HikariConfig();
        hikariConfig.setPoolName(poolName);
        hikariConfig.setJdbcUrl(config.getJdbcUrl());
        hikariConfig.setUsername(config.getUsername());
        hikariConfig.setPassword(config.getPassword());
        if (config.getDriverClassName() != null && !config.getDriverClassName().isBlank()) {
            hikariConfig.setDriverClassName(config.getDriverClassName());
        }
        hikariConfig.setMaximumPoolSize(config.getMaximumPoolSize());
        hikariConfig.setMinimumIdle(Math.min(config.getMinimumIdle(), config.getMaximumPoolSize()));
        hikariConfig.setConnectionTimeout(config.getConnectionTimeoutMs());
        hikariConfig.setIdleTimeout(config.getIdleTimeoutMs());
        hikariConfig.setMaxLifetime(config.getMaxLifetimeMs());

        // Pools are created before the database may be reachable; connection errors surface per query
        hikariConfig.setInitializationFailTimeout(-1);

        if (config.getJdbcUrl().contains("postgresql")) {
            hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
        }

        log.info("Creating connection pool {} for {} (user: {}, maxPoolSize: {})",
            poolName, sanitizeUrl(config.getJdbcUrl()), config.getUsername(), config.getMaximumPoolSize());
        return new HikariDataSource(hikariConfig);
    }

    /** Strips query parameters, which may carry credentials. */
    static String sanitizeUrl(String jdbcUrl) {
        int parameters = jdbcUrl.indexOf('?');
        return parameters < 0 ? jdbcUrl : jdbcUrl.substring(0, parameters);
    }
}
