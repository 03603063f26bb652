package org.eventsourcing.migrations.snapshot.pipeline.ir;

/**
 * Identifies a snapshot independently of its payload. {@code timestamp} is epoch millis.
 */
public record SnapshotMetadata(
    String persistenceId,
    long sequenceNumber,
    long timestamp
) {
    @Override
    public String toString() {
        return "SnapshotMetadata(" + persistenceId + ", " + sequenceNumber + ", " + timestamp + ")";
    }
}
