package org.eventsourcing.migrations.snapshot.pipeline;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import org.eventsourcing.migrations.snapshot.pipeline.codec.SnapshotCodec;
import org.eventsourcing.migrations.snapshot.pipeline.cursor.CursorStore;
import org.eventsourcing.migrations.snapshot.pipeline.cursor.InMemoryCursorStore;
import org.eventsourcing.migrations.snapshot.pipeline.ir.DecodedSnapshot;
import org.eventsourcing.migrations.snapshot.pipeline.ir.LegacySnapshotRow;
import org.eventsourcing.migrations.snapshot.pipeline.ir.MigrationSummary;
import org.eventsourcing.migrations.snapshot.pipeline.ir.ProgressCursor;
import org.eventsourcing.migrations.snapshot.pipeline.sink.SnapshotSink;
import org.eventsourcing.migrations.snapshot.pipeline.sink.WriteMode;
import org.eventsourcing.migrations.snapshot.pipeline.source.EntityEnumerator;
import org.eventsourcing.migrations.snapshot.pipeline.source.LegacySnapshotReader;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Moves legacy snapshots through the codec into the sink.
 *
 * The pipeline knows nothing about JDBC or any concrete serializer. It pulls one row at a time
 * (or one per entity in flight when {@code parallelism > 1}), decodes it, waits for the write
 * to commit and only then pulls the next. The first error from a query, decode or write aborts
 * the run; whatever was written before it stays written and nothing is retried.
 */
@Slf4j
public class SnapshotMigrationPipeline {

    private final EntityEnumerator enumerator;
    private final LegacySnapshotReader reader;
    private final SnapshotCodec codec;
    private final SnapshotSink sink;
    private final CursorStore cursorStore;
    private final MigrationSettings settings;
    private final AtomicReference<MigrationRun> currentRun = new AtomicReference<>();

    public SnapshotMigrationPipeline(
        EntityEnumerator enumerator,
        LegacySnapshotReader reader,
        SnapshotCodec codec,
        SnapshotSink sink,
        MigrationSettings settings
    ) {
        this(enumerator, reader, codec, sink, new InMemoryCursorStore(), settings);
    }

    public SnapshotMigrationPipeline(
        EntityEnumerator enumerator,
        LegacySnapshotReader reader,
        SnapshotCodec codec,
        SnapshotSink sink,
        CursorStore cursorStore,
        MigrationSettings settings
    ) {
        settings.validate();
        this.enumerator = enumerator;
        this.reader = reader;
        this.codec = codec;
        this.sink = sink;
        this.cursorStore = cursorStore;
        this.settings = settings;
    }

    /**
     * Migrate the newest snapshot of every entity in the journal, replacing whatever the target
     * holds for that entity. Entities without a snapshot are skipped. Safe to re-run.
     */
    public Mono<MigrationSummary> migrateLatest() {
        return execute(MigrationMode.LATEST, run -> enumerator.enumerate(settings.getEntityLimit())
            .flatMap(persistenceId -> migrateLatestFor(persistenceId, run), settings.getParallelism(), 1)
            .then());
    }

    /**
     * Migrate every legacy row, in persistence id then sequence number order, with the configured
     * history write mode.
     */
    public Mono<MigrationSummary> migrateAll() {
        return execute(MigrationMode.ALL, run -> writeRows(reader.streamAll(), settings.getHistoryWriteMode(), run));
    }

    /**
     * Migrate every legacy row page by page, storing a cursor after each page so a later call
     * resumes after the last completed page. Pages are written with {@link WriteMode#UPSERT} since a
     * page interrupted halfway is written again on resume.
     * Emits one cursor per page written.
     */
    public Flux<ProgressCursor> migratePaged() {
        return track(MigrationMode.PAGED, run -> Mono.fromCallable(cursorStore::load)
            .flatMapMany(start -> {
                if (start.exhausted()) {
                    log.info("Cursor {} is exhausted, nothing left to migrate", start);
                    return Flux.empty();
                }
                return migratePage(start, run)
                    .expand(cursor -> cursor.exhausted() ? Mono.empty() : migratePage(cursor, run));
            }));
    }

    /** The most recently started run, or null if none was started. */
    public MigrationRun currentRun() {
        return currentRun.get();
    }

    private Mono<Void> migrateLatestFor(String persistenceId, MigrationRun run) {
        return reader.latestFor(persistenceId)
            .map(codec::decode)
            .flatMap(snapshot -> write(snapshot, WriteMode.REPLACE_LATEST, run).thenReturn(Boolean.TRUE))
            .defaultIfEmpty(Boolean.FALSE)
            .doOnNext(written -> {
                if (!written) {
                    run.recordSkipped();
                    log.debug("No snapshot for {}, skipping", persistenceId);
                }
            })
            .then();
    }

    private Mono<ProgressCursor> migratePage(ProgressCursor from, MigrationRun run) {
        return Mono.defer(() -> {
            var rowsInPage = new AtomicLong();
            var page = reader.readPage(from.nextOffset(), settings.getPageSize())
                .doOnNext(row -> rowsInPage.incrementAndGet());
            return writeRows(page, WriteMode.UPSERT, run)
                .then(Mono.fromCallable(() -> {
                    var next = from.advance(rowsInPage.get(), rowsInPage.get() < settings.getPageSize());
                    cursorStore.save(next);
                    log.info("Migrated page of {} snapshots, next offset {}", next.rowsInPage(), next.nextOffset());
                    return next;
                }));
        });
    }

    /**
     * Rows of one entity arrive consecutively, so each run of equal persistence ids is written
     * sequentially while up to {@code parallelism} entities are in flight.
     */
    private Mono<Void> writeRows(Flux<LegacySnapshotRow> rows, WriteMode mode, MigrationRun run) {
        if (settings.getParallelism() == 1) {
            return rows.concatMap(row -> decodeAndWrite(row, mode, run), 1).then();
        }
        return rows.windowUntilChanged(LegacySnapshotRow::persistenceId)
            .flatMap(entityRows -> entityRows.concatMap(row -> decodeAndWrite(row, mode, run), 1),
                settings.getParallelism(), 1)
            .then();
    }

    private Mono<Void> decodeAndWrite(LegacySnapshotRow row, WriteMode mode, MigrationRun run) {
        return Mono.fromCallable(() -> codec.decode(row))
            .flatMap(snapshot -> write(snapshot, mode, run));
    }

    private Mono<Void> write(DecodedSnapshot snapshot, WriteMode mode, MigrationRun run) {
        return Mono.defer(() -> {
                log.debug("Migrating snapshot for {}", snapshot.metadata());
                return sink.save(snapshot, mode);
            })
            .doOnSuccess(unused -> {
                long migrated = run.recordMigrated();
                if (migrated % settings.getProgressLogInterval() == 0) {
                    log.info("{} snapshots migrated so far", migrated);
                }
            });
    }

    private Mono<MigrationSummary> execute(MigrationMode mode, Function<MigrationRun, Mono<Void>> body) {
        return Mono.defer(() -> {
            var run = begin(mode);
            return body.apply(run)
                .then(Mono.fromCallable(() -> complete(run)))
                .doOnError(error -> fail(run, error))
                .doOnCancel(() -> fail(run, new CancellationException("Migration cancelled")));
        });
    }

    private <T> Flux<T> track(MigrationMode mode, Function<MigrationRun, Flux<T>> body) {
        return Flux.defer(() -> {
            var run = begin(mode);
            return body.apply(run)
                .doOnComplete(() -> complete(run))
                .doOnError(error -> fail(run, error))
                .doOnCancel(() -> fail(run, new CancellationException("Migration cancelled")));
        });
    }

    private MigrationRun begin(MigrationMode mode) {
        var previous = currentRun.get();
        if (previous != null && previous.getState() == MigrationRun.State.RUNNING) {
            throw new IllegalStateException("A " + previous.getMode() + " migration is already running");
        }
        var run = new MigrationRun(mode);
        if (!currentRun.compareAndSet(previous, run)) {
            throw new IllegalStateException("Another migration was started concurrently");
        }
        run.start();
        log.info("Starting {} snapshot migration with parallelism {}", mode, settings.getParallelism());
        return run;
    }

    private MigrationSummary complete(MigrationRun run) {
        var summary = run.complete();
        log.info("{} snapshot migration completed: {} migrated, {} skipped in {}",
            summary.mode(), summary.migrated(), summary.skipped(), summary.elapsed());
        return summary;
    }

    private void fail(MigrationRun run, Throwable error) {
        if (run.fail(error)) {
            log.error("{} snapshot migration failed after {} migrated snapshots",
                run.getMode(), run.getMigrated(), error);
        }
    }
}
