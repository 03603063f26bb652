package org.eventsourcing.migrations.snapshot.pipeline.sink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import org.eventsourcing.migrations.snapshot.pipeline.codec.SnapshotCodec;
import org.eventsourcing.migrations.snapshot.pipeline.error.WriteException;
import org.eventsourcing.migrations.snapshot.pipeline.ir.DecodedSnapshot;
import org.eventsourcing.migrations.snapshot.pipeline.ir.SnapshotMetadata;
import org.eventsourcing.migrations.snapshot.pipeline.ir.TargetSnapshotRow;

import reactor.core.publisher.Mono;

/**
 * A SnapshotSink that keeps the target table in memory, for testing the reading side and the
 * orchestration without a target database. It records the write order and how many writes
 * overlapped, overall and per entity.
 */
public class CollectingSnapshotSink implements SnapshotSink {

    private static final Comparator<RowKey> KEY_ORDER = Comparator
        .comparing(RowKey::persistenceId)
        .thenComparingLong(RowKey::sequenceNumber);

    private final SnapshotCodec codec;
    private final TreeMap<RowKey, TargetSnapshotRow> rows = new TreeMap<>(KEY_ORDER);
    private final List<SnapshotMetadata> writes = new CopyOnWriteArrayList<>();
    private final Set<String> entitiesInFlight = ConcurrentHashMap.newKeySet();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final AtomicInteger overlappingEntityWrites = new AtomicInteger();
    private Duration writeDelay = Duration.ZERO;
    private Predicate<SnapshotMetadata> failWhen = metadata -> false;

    public CollectingSnapshotSink(SnapshotCodec codec) {
        this.codec = codec;
    }

    /** Hold each write open for a while so overlapping writes become observable. */
    public CollectingSnapshotSink withWriteDelay(Duration delay) {
        this.writeDelay = delay;
        return this;
    }

    /** Reject matching snapshots with a WriteException. */
    public CollectingSnapshotSink failWhen(Predicate<SnapshotMetadata> predicate) {
        this.failWhen = predicate;
        return this;
    }

    @Override
    public Mono<Void> save(DecodedSnapshot snapshot, WriteMode mode) {
        var persistenceId = snapshot.metadata().persistenceId();
        return Mono.defer(() -> {
            var entered = new AtomicBoolean();
            Mono<Void> delay = writeDelay.isZero() ? Mono.empty() : Mono.delay(writeDelay).then();
            return Mono.fromRunnable(() -> {
                    enter(persistenceId);
                    entered.set(true);
                })
                .then(delay)
                .then(Mono.fromRunnable(() -> store(snapshot, mode)))
                .doFinally(signal -> {
                    if (entered.get()) {
                        exit(persistenceId);
                    }
                })
                .then();
        });
    }

    public List<TargetSnapshotRow> getRows() {
        synchronized (rows) {
            return List.copyOf(rows.values());
        }
    }

    public List<TargetSnapshotRow> rowsFor(String persistenceId) {
        var matching = new ArrayList<TargetSnapshotRow>();
        for (var row : getRows()) {
            if (row.persistenceId().equals(persistenceId)) {
                matching.add(row);
            }
        }
        return matching;
    }

    /** Metadata of every committed write, in commit order. */
    public List<SnapshotMetadata> getWrites() {
        return Collections.unmodifiableList(writes);
    }

    public int getMaxConcurrentWrites() {
        return maxInFlight.get();
    }

    public int getOverlappingEntityWrites() {
        return overlappingEntityWrites.get();
    }

    private void enter(String persistenceId) {
        if (!entitiesInFlight.add(persistenceId)) {
            overlappingEntityWrites.incrementAndGet();
        }
        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
    }

    private void exit(String persistenceId) {
        inFlight.decrementAndGet();
        entitiesInFlight.remove(persistenceId);
    }

    private void store(DecodedSnapshot snapshot, WriteMode mode) {
        var metadata = snapshot.metadata();
        if (failWhen.test(metadata)) {
            throw new WriteException("Rejected snapshot " + metadata);
        }
        var row = TargetSnapshotRow.of(metadata, codec.encode(snapshot.payload()));
        var key = new RowKey(metadata.persistenceId(), metadata.sequenceNumber());
        synchronized (rows) {
            switch (mode) {
                case REPLACE_LATEST:
                    rows.keySet().removeIf(existing -> existing.persistenceId().equals(key.persistenceId()));
                    rows.put(key, row);
                    break;
                case INSERT:
                    if (rows.containsKey(key)) {
                        throw new WriteException("Duplicate snapshot key " + key);
                    }
                    rows.put(key, row);
                    break;
                case UPSERT:
                    rows.put(key, row);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown write mode " + mode);
            }
        }
        writes.add(metadata);
    }

    private record RowKey(String persistenceId, long sequenceNumber) {}
}
