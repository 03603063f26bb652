package org.eventsourcing.migrations.snapshot.pipeline.error;

/**
 * Base of every failure that aborts a snapshot migration run.
 */
public abstract class SnapshotMigrationException extends RuntimeException {

    protected SnapshotMigrationException(String message) {
        super(message);
    }

    protected SnapshotMigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
