package org.eventsourcing.migrations.snapshot.pipeline.error;

/**
 * A query could not be executed, typically a missing table or column.
 */
public class QueryException extends StorageException {

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
