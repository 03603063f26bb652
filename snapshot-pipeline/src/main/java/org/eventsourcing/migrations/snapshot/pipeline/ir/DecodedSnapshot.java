package org.eventsourcing.migrations.snapshot.pipeline.ir;

/**
 * What flows from the codec to the sink: metadata plus the typed payload.
 */
public record DecodedSnapshot(
    SnapshotMetadata metadata,
    SnapshotPayload<?> payload
) {}
