package org.eventsourcing.migrations.snapshot.pipeline;

import java.nio.charset.StandardCharsets;

import org.eventsourcing.migrations.snapshot.pipeline.codec.StringSnapshotSerializer;
import org.eventsourcing.migrations.snapshot.pipeline.ir.LegacySnapshotRow;
import org.eventsourcing.migrations.snapshot.pipeline.ir.TargetSnapshotRow;

/**
 * Fixtures for legacy rows holding UTF-8 text payloads.
 */
final class SnapshotRows {
    static final int UNREGISTERED_SERIALIZER = 999;

    private SnapshotRows() {}

    static LegacySnapshotRow textRow(String persistenceId, long sequenceNumber) {
        return textRow(persistenceId, sequenceNumber, 1000L + sequenceNumber);
    }

    static LegacySnapshotRow textRow(String persistenceId, long sequenceNumber, long created) {
        return new LegacySnapshotRow(
            persistenceId,
            sequenceNumber,
            created,
            (persistenceId + "@" + sequenceNumber).getBytes(StandardCharsets.UTF_8),
            StringSnapshotSerializer.IDENTIFIER,
            ""
        );
    }

    static LegacySnapshotRow undecodableRow(String persistenceId, long sequenceNumber) {
        return new LegacySnapshotRow(persistenceId, sequenceNumber, 1000L + sequenceNumber,
            new byte[] { 1, 2, 3 }, UNREGISTERED_SERIALIZER, null);
    }

    static String text(TargetSnapshotRow row) {
        return new String(row.payload(), StandardCharsets.UTF_8);
    }
}
