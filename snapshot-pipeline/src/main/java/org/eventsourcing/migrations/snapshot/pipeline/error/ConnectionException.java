package org.eventsourcing.migrations.snapshot.pipeline.error;

/**
 * The database was unreachable or the connection was lost mid-request.
 */
public class ConnectionException extends StorageException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
