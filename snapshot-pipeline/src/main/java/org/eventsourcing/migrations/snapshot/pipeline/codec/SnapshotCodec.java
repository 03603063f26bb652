package org.eventsourcing.migrations.snapshot.pipeline.codec;

import org.eventsourcing.migrations.snapshot.pipeline.error.DeserializationException;
import org.eventsourcing.migrations.snapshot.pipeline.error.SnapshotMigrationException;
import org.eventsourcing.migrations.snapshot.pipeline.error.WriteException;
import org.eventsourcing.migrations.snapshot.pipeline.ir.DecodedSnapshot;
import org.eventsourcing.migrations.snapshot.pipeline.ir.EncodedSnapshot;
import org.eventsourcing.migrations.snapshot.pipeline.ir.LegacySnapshotRow;
import org.eventsourcing.migrations.snapshot.pipeline.ir.SnapshotPayload;

import lombok.RequiredArgsConstructor;

/**
 * Turns legacy rows into typed snapshots and typed snapshots back into bytes.
 */
@RequiredArgsConstructor
public class SnapshotCodec {
    private final SerializerRegistry registry;

    public DecodedSnapshot decode(LegacySnapshotRow row) {
        var metadata = row.metadata();
        if (row.snapshot() == null) {
            throw new DeserializationException("Snapshot of " + metadata.persistenceId()
                + " at sequence number " + metadata.sequenceNumber() + " has no payload");
        }
        try {
            var serializer = registry.resolve(row.serializerId(), row.serializerManifest());
            return new DecodedSnapshot(metadata, decodePayload(serializer, row));
        } catch (DeserializationException e) {
            throw new DeserializationException("Cannot decode snapshot of " + metadata.persistenceId()
                + " at sequence number " + metadata.sequenceNumber() + ": " + e.getMessage(), e);
        }
    }

    public EncodedSnapshot encode(SnapshotPayload<?> payload) {
        try {
            return payload.encode();
        } catch (SnapshotMigrationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new WriteException("Cannot encode payload with serializer "
                + payload.serializer().identifier(), e);
        }
    }

    private static <T> SnapshotPayload<T> decodePayload(SnapshotSerializer<T> serializer, LegacySnapshotRow row) {
        var manifest = row.serializerManifest() != null ? row.serializerManifest() : "";
        return new SnapshotPayload<>(serializer.fromBinary(row.snapshot(), manifest), serializer, manifest);
    }
}
