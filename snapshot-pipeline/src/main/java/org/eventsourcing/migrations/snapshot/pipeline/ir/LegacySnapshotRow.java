package org.eventsourcing.migrations.snapshot.pipeline.ir;

/**
 * One row of the legacy snapshot table, exactly as stored.
 *
 * The payload is opaque here; {@code serializerId} and {@code serializerManifest} are nullable
 * because older rows were written before the serializer columns were populated.
 */
public record LegacySnapshotRow(
    String persistenceId,
    long sequenceNumber,
    long created,
    byte[] snapshot,
    Integer serializerId,
    String serializerManifest
) {
    public SnapshotMetadata metadata() {
        return new SnapshotMetadata(persistenceId, sequenceNumber, created);
    }
}
