package org.eventsourcing.migrations.snapshot;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.zaxxer.hikari.HikariDataSource;

import org.eventsourcing.migrations.snapshot.jdbc.DataSourceFactory;
import org.eventsourcing.migrations.snapshot.jdbc.DatabaseConfig;
import org.eventsourcing.migrations.snapshot.jdbc.JdbcEntityEnumerator;
import org.eventsourcing.migrations.snapshot.jdbc.JdbcLegacySnapshotReader;
import org.eventsourcing.migrations.snapshot.jdbc.JdbcSnapshotSink;
import org.eventsourcing.migrations.snapshot.jdbc.LegacySnapshotQueries;
import org.eventsourcing.migrations.snapshot.jdbc.SnapshotWriteQueries;
import org.eventsourcing.migrations.snapshot.pipeline.MigrationMode;
import org.eventsourcing.migrations.snapshot.pipeline.SnapshotMigrationPipeline;
import org.eventsourcing.migrations.snapshot.pipeline.codec.SnapshotCodec;
import org.eventsourcing.migrations.snapshot.pipeline.cursor.CursorStore;
import org.eventsourcing.migrations.snapshot.pipeline.cursor.FileCursorStore;
import org.eventsourcing.migrations.snapshot.pipeline.cursor.InMemoryCursorStore;
import org.eventsourcing.migrations.snapshot.pipeline.error.SnapshotMigrationException;
import org.eventsourcing.migrations.snapshot.pipeline.ir.MigrationSummary;
import org.eventsourcing.migrations.snapshot.pipeline.sink.WriteMode;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Copies snapshots from the legacy snapshot table into the new one.
 *
 * Exit codes: 0 when the migration completed, 1 when it failed, 2 for invalid options or
 * configuration.
 */
@Slf4j
@Command(
    name = "snapshot-migration",
    description = "Migrate snapshots from the legacy snapshot table to the new snapshot table",
    mixinStandardHelpOptions = true,
    version = "0.1.0"
)
public class SnapshotMigrationCommand implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_MIGRATION_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @Option(names = {"--config", "-c"}, required = true, description = "YAML or JSON configuration file")
    Path configFile;

    @Option(names = {"--mode", "-m"}, description = "latest, all or paged. Overrides the configured mode.")
    MigrationMode mode;

    @Option(names = {"--parallelism"}, description = "Entities migrated concurrently")
    Integer parallelism;

    @Option(names = {"--entity-limit"}, description = "Maximum number of entities in latest mode")
    Long entityLimit;

    @Option(names = {"--page-size"}, description = "Rows per page in paged mode")
    Integer pageSize;

    @Option(names = {"--cursor-file"}, description = "Progress cursor of the paged mode")
    Path cursorFile;

    @Option(names = {"--reset-cursor"}, description = "Start the paged mode from the first row")
    boolean resetCursor;

    @Option(names = {"--history-write-mode"}, description = "insert or upsert, used by mode all")
    WriteMode historyWriteMode;

    private final MigrationConfigLoader configLoader;
    private final PoolFactory poolFactory;

    public SnapshotMigrationCommand() {
        this(new MigrationConfigLoader(), DataSourceFactory::create);
    }

    SnapshotMigrationCommand(MigrationConfigLoader configLoader, PoolFactory poolFactory) {
        this.configLoader = configLoader;
        this.poolFactory = poolFactory;
    }

    public static void main(String[] args) {
        System.exit(commandLine(new SnapshotMigrationCommand()).execute(args));
    }

    static CommandLine commandLine(SnapshotMigrationCommand command) {
        return new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        MigrationConfig config;
        try {
            config = withOverrides(configLoader.load(configFile));
        } catch (InvalidConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        }

        try {
            var summary = run(config);
            log.info("Migration finished: {} snapshots migrated, {} entities skipped in {}",
                summary.migrated(), summary.skipped(), summary.elapsed());
            return EXIT_OK;
        } catch (InvalidConfigurationException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        } catch (SnapshotMigrationException | UncheckedIOException e) {
            log.error("Migration failed", e);
            return EXIT_MIGRATION_FAILED;
        }
    }

    MigrationConfig withOverrides(MigrationConfig config) {
        var builder = config.toBuilder();
        if (mode != null) {
            builder.mode(mode);
        }
        if (parallelism != null) {
            builder.parallelism(parallelism);
        }
        if (entityLimit != null) {
            builder.entityLimit(entityLimit);
        }
        if (pageSize != null) {
            builder.pageSize(pageSize);
        }
        if (cursorFile != null) {
            builder.cursorFile(cursorFile.toString());
        }
        if (historyWriteMode != null) {
            builder.historyWriteMode(historyWriteMode);
        }
        return builder.build();
    }

    private MigrationSummary run(MigrationConfig config) {
        var registry = SerializerRegistryFactory.create(config);
        var codec = new SnapshotCodec(registry);
        var cursorStore = cursorStore(config);
        var fetchSize = config.getSource().getFetchSize();
        var queries = new LegacySnapshotQueries(
            config.getLegacySnapshotTable(), config.getSource().effectiveSqlDialect(),
            config.getJournalTable(), config.journalOrSource().effectiveSqlDialect());

        try (var pools = new Pools(config, poolFactory)) {
            var pipeline = new SnapshotMigrationPipeline(
                new JdbcEntityEnumerator(pools.journal(), queries, config.journalOrSource().getFetchSize()),
                new JdbcLegacySnapshotReader(pools.source, queries, fetchSize),
                codec,
                new JdbcSnapshotSink(pools.target, new SnapshotWriteQueries(config.getSnapshotTable()), codec),
                cursorStore,
                config.toSettings());

            log.info("Starting {} migration with serializer ids {}", config.getMode(), registry.registeredIds());
            switch (config.getMode()) {
                case LATEST:
                    return pipeline.migrateLatest().block();
                case ALL:
                    return pipeline.migrateAll().block();
                case PAGED:
                    pipeline.migratePaged().blockLast();
                    return pipeline.currentRun().summary();
                default:
                    throw new InvalidConfigurationException("Unsupported mode " + config.getMode());
            }
        }
    }

    private CursorStore cursorStore(MigrationConfig config) {
        if (config.getMode() != MigrationMode.PAGED) {
            return new InMemoryCursorStore();
        }
        if (config.getCursorFile() == null || config.getCursorFile().isBlank()) {
            throw new InvalidConfigurationException("The paged mode needs a cursor file");
        }
        var store = new FileCursorStore(Path.of(config.getCursorFile()));
        if (resetCursor) {
            log.info("Resetting progress cursor {}", config.getCursorFile());
            store.reset();
        }
        return store;
    }

    @FunctionalInterface
    interface PoolFactory {
        HikariDataSource create(String poolName, DatabaseConfig config);
    }

    /** Connection pools of one run. The journal pool exists only when the journal has its own database. */
    static final class Pools implements AutoCloseable {
        final HikariDataSource source;
        final HikariDataSource target;
        final HikariDataSource journal;

        Pools(MigrationConfig config, PoolFactory factory) {
            HikariDataSource sourcePool = null;
            HikariDataSource targetPool = null;
            HikariDataSource journalPool;
            try {
                sourcePool = factory.create("legacy-snapshots", config.getSource());
                targetPool = factory.create("snapshots", config.getTarget());
                journalPool = config.getJournal() != null ? factory.create("journal", config.getJournal()) : null;
            } catch (RuntimeException e) {
                closeAfterFailure(targetPool, e);
                closeAfterFailure(sourcePool, e);
                throw e;
            }
            this.source = sourcePool;
            this.target = targetPool;
            this.journal = journalPool;
        }

        HikariDataSource journal() {
            return journal != null ? journal : source;
        }

        private static void closeAfterFailure(HikariDataSource pool, RuntimeException cause) {
            if (pool == null) {
                return;
            }
            try {
                pool.close();
            } catch (RuntimeException e) {
                cause.addSuppressed(e);
            }
        }

        @Override
        public void close() {
            if (journal != null) {
                journal.close();
            }
            target.close();
            source.close();
        }
    }
}
