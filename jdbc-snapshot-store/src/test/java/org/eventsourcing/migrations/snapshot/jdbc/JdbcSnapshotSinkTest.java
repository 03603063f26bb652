package org.eventsourcing.migrations.snapshot.jdbc;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import com.zaxxer.hikari.HikariDataSource;

import org.eventsourcing.migrations.snapshot.pipeline.codec.JsonSnapshotSerializer;
import org.eventsourcing.migrations.snapshot.pipeline.codec.SerializerRegistry;
import org.eventsourcing.migrations.snapshot.pipeline.codec.SnapshotCodec;
import org.eventsourcing.migrations.snapshot.pipeline.error.QueryException;
import org.eventsourcing.migrations.snapshot.pipeline.error.WriteException;
import org.eventsourcing.migrations.snapshot.pipeline.ir.DecodedSnapshot;
import org.eventsourcing.migrations.snapshot.pipeline.ir.LegacySnapshotRow;
import org.eventsourcing.migrations.snapshot.pipeline.sink.WriteMode;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.eventsourcing.migrations.snapshot.jdbc.H2Databases.targetRows;
import static org.eventsourcing.migrations.snapshot.jdbc.H2Databases.text;
import static org.eventsourcing.migrations.snapshot.jdbc.H2Databases.textRow;
import static org.junit.jupiter.api.Assertions.*;

class JdbcSnapshotSinkTest {

    private HikariDataSource dataSource;
    private SnapshotCodec codec;
    private JdbcSnapshotSink sink;

    @BeforeEach
    void setUp() {
        dataSource = H2Databases.target();
        codec = new SnapshotCodec(SerializerRegistry.defaults());
        sink = new JdbcSnapshotSink(dataSource, new SnapshotWriteQueries(SnapshotTableConfig.defaults()), codec);
    }

    @AfterEach
    void tearDown() {
        H2Databases.drop(dataSource);
    }

    private DecodedSnapshot decoded(String persistenceId, long sequenceNumber) {
        return codec.decode(textRow(persistenceId, sequenceNumber));
    }

    @Test
    void insertWritesTheNewRowShape() {
        StepVerifier.create(sink.save(decoded("A", 3), WriteMode.INSERT)).verifyComplete();

        var rows = targetRows(dataSource);
        assertEquals(1, rows.size());
        var row = rows.get(0);
        assertEquals("A", row.persistenceId());
        assertEquals(3, row.sequenceNumber());
        assertEquals(1003, row.created());
        assertEquals(20, row.serializerId());
        assertEquals("", row.serializerManifest());
        assertEquals("A@3", text(row));
        assertEquals(0, H2Databases.countWhereMetadataIsSet(dataSource));
    }

    @Test
    void storedManifestAndExactPayloadReachTheTarget() {
        var json = "{\"owner\":\"ada\",\"balance\":12345678901234567.89}";
        var legacyRow = new LegacySnapshotRow("cart-9", 4, 1004, json.getBytes(StandardCharsets.UTF_8),
            JsonSnapshotSerializer.DEFAULT_IDENTIFIER, "com.acme.Cart");

        StepVerifier.create(sink.save(codec.decode(legacyRow), WriteMode.INSERT)).verifyComplete();

        var row = targetRows(dataSource).get(0);
        assertEquals(JsonSnapshotSerializer.DEFAULT_IDENTIFIER, row.serializerId());
        assertEquals("com.acme.Cart", row.serializerManifest());
        assertEquals(json, text(row));
    }

    @Test
    void duplicateInsertFailsWithWriteException() {
        StepVerifier.create(sink.save(decoded("A", 3), WriteMode.INSERT)).verifyComplete();

        StepVerifier.create(sink.save(decoded("A", 3), WriteMode.INSERT))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(WriteException.class, e);
                assertTrue(e.getMessage().contains("constraint violation"), e.getMessage());
            })
            .verify();
        assertEquals(1, targetRows(dataSource).size());
    }

    @Test
    void replaceLatestKeepsOneRowPerEntity() {
        StepVerifier.create(sink.save(decoded("A", 1), WriteMode.INSERT)
                .then(sink.save(decoded("A", 2), WriteMode.INSERT))
                .then(sink.save(decoded("B", 1), WriteMode.INSERT))
                .then(sink.save(decoded("A", 5), WriteMode.REPLACE_LATEST)))
            .verifyComplete();

        var rows = targetRows(dataSource).stream()
            .map(row -> row.persistenceId() + row.sequenceNumber())
            .collect(Collectors.toList());
        assertEquals(List.of("A5", "B1"), rows);
    }

    @Test
    void replaceLatestIsIdempotent() {
        StepVerifier.create(sink.save(decoded("A", 5), WriteMode.REPLACE_LATEST)
                .then(sink.save(decoded("A", 5), WriteMode.REPLACE_LATEST)))
            .verifyComplete();

        assertEquals(1, targetRows(dataSource).size());
    }

    @Test
    void upsertOverwritesOnlyTheSameKey() {
        StepVerifier.create(sink.save(decoded("A", 1), WriteMode.INSERT)
                .then(sink.save(decoded("A", 2), WriteMode.INSERT))
                .then(sink.save(decoded("A", 2), WriteMode.UPSERT))
                .then(sink.save(decoded("A", 3), WriteMode.UPSERT)))
            .verifyComplete();

        assertEquals(3, targetRows(dataSource).size());
    }

    @Test
    void failedWriteRollsBackTheDelete() {
        H2Databases.execute(dataSource, "ALTER TABLE snapshot ADD CONSTRAINT small_sequence_numbers "
            + "CHECK (sequence_number < 100)");
        StepVerifier.create(sink.save(decoded("A", 1), WriteMode.INSERT)).verifyComplete();

        StepVerifier.create(sink.save(decoded("A", 200), WriteMode.REPLACE_LATEST))
            .expectError(WriteException.class)
            .verify();

        var rows = targetRows(dataSource);
        assertEquals(1, rows.size());
        assertEquals(1, rows.get(0).sequenceNumber());
    }

    @Test
    void missingTargetTableFailsWithQueryException() {
        H2Databases.execute(dataSource, "DROP TABLE snapshot");

        StepVerifier.create(sink.save(decoded("A", 1), WriteMode.INSERT))
            .expectError(QueryException.class)
            .verify();
    }
}
