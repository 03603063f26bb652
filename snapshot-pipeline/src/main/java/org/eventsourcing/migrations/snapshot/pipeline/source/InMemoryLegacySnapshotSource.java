package org.eventsourcing.migrations.snapshot.pipeline.source;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import org.eventsourcing.migrations.snapshot.pipeline.ir.LegacySnapshotRow;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Journal and legacy snapshot table held in memory, for exercising the pipeline without a
 * database. Also counts open scans so tests can check that cancelled scans are released.
 */
public class InMemoryLegacySnapshotSource implements EntityEnumerator, LegacySnapshotReader {

    private static final Comparator<LegacySnapshotRow> SCAN_ORDER = Comparator
        .comparing(LegacySnapshotRow::persistenceId)
        .thenComparingLong(LegacySnapshotRow::sequenceNumber);

    private final List<String> journalEntries = new CopyOnWriteArrayList<>();
    private final List<LegacySnapshotRow> snapshots = new CopyOnWriteArrayList<>();
    private final AtomicInteger openScans = new AtomicInteger();

    /** Record journal events for entities, which makes them visible to the enumerator. */
    public InMemoryLegacySnapshotSource withJournalEntries(String... persistenceIds) {
        journalEntries.addAll(List.of(persistenceIds));
        return this;
    }

    /** Add a legacy snapshot row; its entity is added to the journal too. */
    public InMemoryLegacySnapshotSource withSnapshot(LegacySnapshotRow row) {
        snapshots.add(row);
        journalEntries.add(row.persistenceId());
        return this;
    }

    @Override
    public Flux<String> enumerate(long limit) {
        return Flux.defer(() -> Flux.fromStream(journalEntries.stream().distinct().sorted()))
            .take(limit);
    }

    @Override
    public Mono<LegacySnapshotRow> latestFor(String persistenceId) {
        return Mono.fromCallable(() -> {
            LegacySnapshotRow latest = null;
            for (var row : snapshots) {
                if (row.persistenceId().equals(persistenceId) && isNewer(row, latest)) {
                    latest = row;
                }
            }
            return latest;
        });
    }

    @Override
    public Flux<LegacySnapshotRow> streamAll() {
        return scan(0, Long.MAX_VALUE);
    }

    @Override
    public Flux<LegacySnapshotRow> readPage(long offset, int limit) {
        return scan(offset, limit);
    }

    public int getOpenScans() {
        return openScans.get();
    }

    private Flux<LegacySnapshotRow> scan(long offset, long limit) {
        return Flux.defer(() -> {
            openScans.incrementAndGet();
            return Flux.fromStream(snapshots.stream().sorted(SCAN_ORDER).skip(offset).limit(limit));
        }).doFinally(signal -> openScans.decrementAndGet());
    }

    private static boolean isNewer(LegacySnapshotRow candidate, LegacySnapshotRow current) {
        if (current == null) {
            return true;
        }
        if (candidate.sequenceNumber() != current.sequenceNumber()) {
            return candidate.sequenceNumber() > current.sequenceNumber();
        }
        return candidate.created() > current.created();
    }
}
