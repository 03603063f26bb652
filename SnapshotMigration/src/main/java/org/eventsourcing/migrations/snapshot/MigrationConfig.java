package org.eventsourcing.migrations.snapshot;

import java.util.List;

import org.eventsourcing.migrations.snapshot.jdbc.DatabaseConfig;
import org.eventsourcing.migrations.snapshot.jdbc.JournalTableConfig;
import org.eventsourcing.migrations.snapshot.jdbc.LegacySnapshotTableConfig;
import org.eventsourcing.migrations.snapshot.jdbc.SnapshotTableConfig;
import org.eventsourcing.migrations.snapshot.pipeline.MigrationMode;
import org.eventsourcing.migrations.snapshot.pipeline.MigrationSettings;
import org.eventsourcing.migrations.snapshot.pipeline.codec.ByteArraySnapshotSerializer;
import org.eventsourcing.migrations.snapshot.pipeline.sink.WriteMode;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Contents of the migration configuration file. Every field except the source and target
 * databases has a default.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MigrationConfig {
    /** Database holding the legacy snapshot table. */
    DatabaseConfig source;
    /** Database holding the new snapshot table. */
    DatabaseConfig target;
    /** Database holding the journal; the source database when absent. */
    DatabaseConfig journal;

    @Builder.Default
    LegacySnapshotTableConfig legacySnapshotTable = LegacySnapshotTableConfig.defaults();
    @Builder.Default
    JournalTableConfig journalTable = JournalTableConfig.defaults();
    @Builder.Default
    SnapshotTableConfig snapshotTable = SnapshotTableConfig.defaults();

    @Builder.Default
    MigrationMode mode = MigrationMode.LATEST;
    @Builder.Default
    int parallelism = 1;
    @Builder.Default
    long entityLimit = Long.MAX_VALUE;
    @Builder.Default
    int pageSize = MigrationSettings.DEFAULT_PAGE_SIZE;
    @Builder.Default
    WriteMode historyWriteMode = WriteMode.INSERT;
    @Builder.Default
    long progressLogInterval = MigrationSettings.DEFAULT_PROGRESS_LOG_INTERVAL;
    /** Cursor file of the paged mode. */
    String cursorFile;

    /** Serializer id assumed for rows whose serializer id column is NULL. */
    @Builder.Default
    int defaultSerializerId = ByteArraySnapshotSerializer.IDENTIFIER;
    @Builder.Default
    List<JsonSerializerConfig> jsonSerializers = List.of();

    public MigrationSettings toSettings() {
        return MigrationSettings.builder()
            .parallelism(parallelism)
            .entityLimit(entityLimit)
            .pageSize(pageSize)
            .historyWriteMode(historyWriteMode)
            .progressLogInterval(progressLogInterval)
            .build();
    }

    public DatabaseConfig journalOrSource() {
        return journal != null ? journal : source;
    }
}
