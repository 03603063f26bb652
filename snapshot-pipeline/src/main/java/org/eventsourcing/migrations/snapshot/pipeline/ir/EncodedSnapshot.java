package org.eventsourcing.migrations.snapshot.pipeline.ir;

/**
 * Payload bytes together with the serializer id and manifest needed to decode them again.
 */
public record EncodedSnapshot(
    byte[] bytes,
    int serializerId,
    String manifest
) {}
