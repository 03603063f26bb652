package org.eventsourcing.migrations.snapshot.pipeline.error;

/**
 * The target store refused a snapshot, e.g. a duplicate key when inserting history.
 */
public class WriteException extends SnapshotMigrationException {

    public WriteException(String message) {
        super(message);
    }

    public WriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
