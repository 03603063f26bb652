package org.eventsourcing.migrations.snapshot.pipeline.ir;

/**
 * Row shape of the new snapshot schema. The metadata columns of that schema are not
 * modelled since legacy rows never carry snapshot metadata payloads.
 */
public record TargetSnapshotRow(
    String persistenceId,
    long sequenceNumber,
    long created,
    int serializerId,
    String serializerManifest,
    byte[] payload
) {
    public static TargetSnapshotRow of(SnapshotMetadata metadata, EncodedSnapshot encoded) {
        return new TargetSnapshotRow(
            metadata.persistenceId(),
            metadata.sequenceNumber(),
            metadata.timestamp(),
            encoded.serializerId(),
            encoded.manifest(),
            encoded.bytes()
        );
    }
}
