package org.eventsourcing.migrations.snapshot.pipeline;

public enum MigrationMode {
    /** Only the newest snapshot of every journal entity, keyed by persistence id. */
    LATEST,
    /** Every legacy row, keyed by persistence id and sequence number. */
    ALL,
    /** Like ALL, page by page, resuming from a stored cursor. */
    PAGED
}
