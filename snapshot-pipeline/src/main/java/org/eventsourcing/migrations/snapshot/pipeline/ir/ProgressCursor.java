package org.eventsourcing.migrations.snapshot.pipeline.ir;

/**
 * Progress cursor emitted by the paged migration after each page is written.
 * Persisted between runs so an interrupted migration resumes at {@code nextOffset}.
 */
public record ProgressCursor(
    long nextOffset,
    long rowsInPage,
    long totalRows,
    boolean exhausted
) {
    public static ProgressCursor start() {
        return new ProgressCursor(0, 0, 0, false);
    }

    public ProgressCursor advance(long rowsWritten, boolean lastPage) {
        return new ProgressCursor(nextOffset + rowsWritten, rowsWritten, totalRows + rowsWritten, lastPage);
    }
}
