package org.eventsourcing.migrations.snapshot.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.eventsourcing.migrations.snapshot.pipeline.ir.MigrationSummary;

import lombok.Getter;

/**
 * State of one invocation of a migration: {@code IDLE -> RUNNING -> COMPLETED | FAILED}.
 * COMPLETED and FAILED are terminal.
 */
public final class MigrationRun {

    public enum State {
        IDLE,
        RUNNING,
        COMPLETED,
        FAILED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }
    }

    @Getter
    private final MigrationMode mode;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicLong migrated = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private volatile Throwable failure;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    MigrationRun(MigrationMode mode) {
        this.mode = mode;
    }

    public State getState() {
        return state.get();
    }

    public long getMigrated() {
        return migrated.get();
    }

    public long getSkipped() {
        return skipped.get();
    }

    /** The error that moved this run to FAILED, or null. */
    public Throwable getFailure() {
        return failure;
    }

    public Duration getElapsed() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt != null ? finishedAt : Instant.now());
    }

    void start() {
        if (!state.compareAndSet(State.IDLE, State.RUNNING)) {
            throw new IllegalStateException("Run has already been started, state is " + state.get());
        }
        startedAt = Instant.now();
    }

    long recordMigrated() {
        return migrated.incrementAndGet();
    }

    void recordSkipped() {
        skipped.incrementAndGet();
    }

    MigrationSummary complete() {
        if (!state.compareAndSet(State.RUNNING, State.COMPLETED)) {
            throw new IllegalStateException("Only a running migration can complete, state is " + state.get());
        }
        finishedAt = Instant.now();
        return summary();
    }

    /** @return false if the run had already reached a terminal state */
    boolean fail(Throwable cause) {
        if (!state.compareAndSet(State.RUNNING, State.FAILED)) {
            return false;
        }
        failure = cause;
        finishedAt = Instant.now();
        return true;
    }

    public MigrationSummary summary() {
        return new MigrationSummary(mode, migrated.get(), skipped.get(), getElapsed());
    }
}
