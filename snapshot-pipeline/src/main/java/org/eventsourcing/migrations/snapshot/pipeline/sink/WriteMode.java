package org.eventsourcing.migrations.snapshot.pipeline.sink;

/**
 * How a snapshot is keyed when written to the target.
 */
public enum WriteMode {
    /** Keyed by persistence id alone: any earlier target row of the entity is replaced. */
    REPLACE_LATEST,
    /** Keyed by (persistence id, sequence number); an existing row is a {@code WriteException}. */
    INSERT,
    /** Keyed by (persistence id, sequence number); an existing row is overwritten. */
    UPSERT
}
