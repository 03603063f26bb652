package org.eventsourcing.migrations.snapshot.pipeline.cursor;

import java.util.concurrent.atomic.AtomicReference;

import org.eventsourcing.migrations.snapshot.pipeline.ir.ProgressCursor;

public class InMemoryCursorStore implements CursorStore {
    private final AtomicReference<ProgressCursor> cursor = new AtomicReference<>(ProgressCursor.start());

    @Override
    public ProgressCursor load() {
        return cursor.get();
    }

    @Override
    public void save(ProgressCursor cursor) {
        this.cursor.set(cursor);
    }

    @Override
    public void reset() {
        cursor.set(ProgressCursor.start());
    }
}
