package org.eventsourcing.migrations.snapshot.pipeline.ir;

import org.eventsourcing.migrations.snapshot.pipeline.codec.SnapshotSerializer;

/**
 * A decoded payload paired with the serializer that produced it, so it can be written back
 * without anyone inspecting its runtime type.
 *
 * @param manifest manifest written next to the encoded payload; for decoded rows this is the
 *                 manifest the row was stored with
 */
public record SnapshotPayload<T>(T value, SnapshotSerializer<T> serializer, String manifest) {

    public SnapshotPayload {
        manifest = manifest != null ? manifest : "";
    }

    /** A payload that did not come from a stored row, taking the serializer's own manifest. */
    public SnapshotPayload(T value, SnapshotSerializer<T> serializer) {
        this(value, serializer, serializer.manifest(value));
    }

    public EncodedSnapshot encode() {
        return new EncodedSnapshot(serializer.toBinary(value), serializer.identifier(), manifest);
    }
}
