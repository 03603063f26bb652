package org.eventsourcing.migrations.snapshot.pipeline.source;

import org.eventsourcing.migrations.snapshot.pipeline.ir.LegacySnapshotRow;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Port for reading the legacy snapshot table.
 *
 * Scans are ordered by persistence id, then sequence number, so the full scan and the paged
 * windows over it are reproducible.
 */
public interface LegacySnapshotReader {

    /** The row with the highest sequence number for the entity, or empty if it has none. */
    Mono<LegacySnapshotRow> latestFor(String persistenceId);

    /** Every legacy row, pulled from an open cursor as the subscriber requests them. */
    Flux<LegacySnapshotRow> streamAll();

    /** A window of {@link #streamAll()} starting at row {@code offset}. */
    Flux<LegacySnapshotRow> readPage(long offset, int limit);
}
