package org.eventsourcing.migrations.snapshot.pipeline;

import org.eventsourcing.migrations.snapshot.pipeline.sink.WriteMode;

import lombok.Builder;
import lombok.Value;

/**
 * Tuning of a {@link SnapshotMigrationPipeline}.
 */
@Value
@Builder(toBuilder = true)
public class MigrationSettings {
    public static final int DEFAULT_PAGE_SIZE = 1000;
    public static final long DEFAULT_PROGRESS_LOG_INTERVAL = 1000;

    /** Entities processed concurrently. Rows of one entity are always written one at a time. */
    @Builder.Default
    int parallelism = 1;

    /** Upper bound on enumerated entities in latest mode. */
    @Builder.Default
    long entityLimit = Long.MAX_VALUE;

    /** INSERT rejects rows already present in the target, UPSERT overwrites them. */
    @Builder.Default
    WriteMode historyWriteMode = WriteMode.INSERT;

    @Builder.Default
    int pageSize = DEFAULT_PAGE_SIZE;

    /** Log an info line every this many migrated snapshots. */
    @Builder.Default
    long progressLogInterval = DEFAULT_PROGRESS_LOG_INTERVAL;

    public static MigrationSettings defaults() {
        return builder().build();
    }

    void validate() {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
        if (entityLimit < 0) {
            throw new IllegalArgumentException("entityLimit must not be negative, was " + entityLimit);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1, was " + pageSize);
        }
        if (progressLogInterval < 1) {
            throw new IllegalArgumentException("progressLogInterval must be at least 1, was " + progressLogInterval);
        }
        if (historyWriteMode == WriteMode.REPLACE_LATEST) {
            throw new IllegalArgumentException("historyWriteMode must be INSERT or UPSERT");
        }
    }
}
