package org.eventsourcing.migrations.snapshot.pipeline.cursor;

import org.eventsourcing.migrations.snapshot.pipeline.ir.ProgressCursor;

/**
 * Keeps the paged migration's position between runs.
 */
public interface CursorStore {

    /** The stored cursor, or {@link ProgressCursor#start()} if nothing was stored yet. */
    ProgressCursor load();

    void save(ProgressCursor cursor);

    /** Forget the stored position so the next paged run starts from the first row. */
    void reset();
}
