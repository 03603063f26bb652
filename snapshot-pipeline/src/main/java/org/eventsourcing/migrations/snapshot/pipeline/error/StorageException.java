package org.eventsourcing.migrations.snapshot.pipeline.error;

/**
 * The source or target database could not serve a request.
 */
public abstract class StorageException extends SnapshotMigrationException {

    protected StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
