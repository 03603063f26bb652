package org.eventsourcing.migrations.snapshot.pipeline.sink;

import org.eventsourcing.migrations.snapshot.pipeline.ir.DecodedSnapshot;

import reactor.core.publisher.Mono;

/**
 * Port for writing snapshots into the new schema.
 *
 * Each call is its own transaction; nothing is batched across calls.
 */
public interface SnapshotSink {

    /**
     * Persist one snapshot. Completes once the write is committed.
     */
    Mono<Void> save(DecodedSnapshot snapshot, WriteMode mode);
}
