package org.eventsourcing.migrations.snapshot.pipeline.error;

/**
 * A legacy payload could not be decoded: its serializer is not registered or the bytes
 * do not match that serializer's wire format.
 */
public class DeserializationException extends SnapshotMigrationException {

    public DeserializationException(String message) {
        super(message);
    }

    public DeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
