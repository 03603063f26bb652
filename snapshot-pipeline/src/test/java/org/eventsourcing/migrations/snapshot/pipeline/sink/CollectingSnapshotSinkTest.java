package org.eventsourcing.migrations.snapshot.pipeline.sink;

import org.eventsourcing.migrations.snapshot.pipeline.codec.SerializerRegistry;
import org.eventsourcing.migrations.snapshot.pipeline.codec.SnapshotCodec;
import org.eventsourcing.migrations.snapshot.pipeline.codec.StringSnapshotSerializer;
import org.eventsourcing.migrations.snapshot.pipeline.error.WriteException;
import org.eventsourcing.migrations.snapshot.pipeline.ir.DecodedSnapshot;
import org.eventsourcing.migrations.snapshot.pipeline.ir.SnapshotMetadata;
import org.eventsourcing.migrations.snapshot.pipeline.ir.SnapshotPayload;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class CollectingSnapshotSinkTest {

    private final CollectingSnapshotSink sink = new CollectingSnapshotSink(new SnapshotCodec(SerializerRegistry.defaults()));

    private static DecodedSnapshot snapshot(String persistenceId, long sequenceNumber, String state) {
        return new DecodedSnapshot(
            new SnapshotMetadata(persistenceId, sequenceNumber, 0),
            new SnapshotPayload<>(state, new StringSnapshotSerializer())
        );
    }

    @Test
    void replaceLatestKeepsOneRowPerEntity() {
        StepVerifier.create(sink.save(snapshot("A", 1, "one"), WriteMode.REPLACE_LATEST)).verifyComplete();
        StepVerifier.create(sink.save(snapshot("A", 3, "three"), WriteMode.REPLACE_LATEST)).verifyComplete();
        StepVerifier.create(sink.save(snapshot("B", 1, "b"), WriteMode.REPLACE_LATEST)).verifyComplete();

        var rows = sink.rowsFor("A");
        assertEquals(1, rows.size());
        assertEquals(3, rows.get(0).sequenceNumber());
        assertEquals(2, sink.getRows().size());
    }

    @Test
    void insertRejectsAnExistingKey() {
        StepVerifier.create(sink.save(snapshot("A", 1, "one"), WriteMode.INSERT)).verifyComplete();

        StepVerifier.create(sink.save(snapshot("A", 1, "again"), WriteMode.INSERT))
            .expectError(WriteException.class)
            .verify();
        assertEquals("one", new String(sink.getRows().get(0).payload()));
    }

    @Test
    void upsertOverwritesAnExistingKey() {
        StepVerifier.create(sink.save(snapshot("A", 1, "one"), WriteMode.UPSERT)).verifyComplete();
        StepVerifier.create(sink.save(snapshot("A", 1, "again"), WriteMode.UPSERT)).verifyComplete();
        StepVerifier.create(sink.save(snapshot("A", 2, "two"), WriteMode.UPSERT)).verifyComplete();

        assertEquals(2, sink.getRows().size());
        assertEquals("again", new String(sink.getRows().get(0).payload()));
    }

    @Test
    void saveIsLazy() {
        var pending = sink.save(snapshot("A", 1, "one"), WriteMode.INSERT);

        assertTrue(sink.getRows().isEmpty());
        StepVerifier.create(pending).verifyComplete();
        assertEquals(1, sink.getWrites().size());
    }
}
