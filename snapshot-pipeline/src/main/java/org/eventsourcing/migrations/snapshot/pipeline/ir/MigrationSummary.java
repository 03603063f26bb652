package org.eventsourcing.migrations.snapshot.pipeline.ir;

import java.time.Duration;

import org.eventsourcing.migrations.snapshot.pipeline.MigrationMode;

/**
 * Result of a successful migration run.
 */
public record MigrationSummary(
    MigrationMode mode,
    long migrated,
    long skipped,
    Duration elapsed
) {}
