package org.eventsourcing.migrations.snapshot.pipeline.codec;

import org.eventsourcing.migrations.snapshot.pipeline.error.DeserializationException;

/**
 * A decoding scheme for snapshot payloads, identified by its numeric id (the value stored in
 * the {@code snapshot_ser_id} column) and, optionally, a manifest.
 *
 * @param <T> type of the decoded payload
 */
public interface SnapshotSerializer<T> {

    /** Serializer id as stored alongside the payload. */
    int identifier();

    /**
     * Decode payload bytes.
     *
     * @throws DeserializationException if the bytes are not in this serializer's format
     */
    T fromBinary(byte[] bytes, String manifest);

    byte[] toBinary(T value);

    /** Manifest for a value that was not decoded from a stored row. */
    default String manifest(T value) {
        return "";
    }
}
