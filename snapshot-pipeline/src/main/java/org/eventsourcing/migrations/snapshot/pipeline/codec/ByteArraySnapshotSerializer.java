package org.eventsourcing.migrations.snapshot.pipeline.codec;

/**
 * Passes payload bytes through untouched.
 */
public class ByteArraySnapshotSerializer implements SnapshotSerializer<byte[]> {
    public static final int IDENTIFIER = 4;

    @Override
    public int identifier() {
        return IDENTIFIER;
    }

    @Override
    public byte[] fromBinary(byte[] bytes, String manifest) {
        return bytes;
    }

    @Override
    public byte[] toBinary(byte[] value) {
        return value;
    }
}
