package org.eventsourcing.migrations.snapshot.pipeline.cursor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.eventsourcing.migrations.snapshot.pipeline.ir.ProgressCursor;

import lombok.extern.slf4j.Slf4j;

/**
 * Stores the cursor as a small JSON document. Writes go to a sibling temp file which is then
 * moved over the cursor file, so a crash never leaves a truncated cursor behind.
 */
@Slf4j
public class FileCursorStore implements CursorStore {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Path cursorFile;

    public FileCursorStore(Path cursorFile) {
        this.cursorFile = cursorFile;
    }

    @Override
    public ProgressCursor load() {
        if (!Files.exists(cursorFile)) {
            log.info("No cursor at {}, starting from the first row", cursorFile);
            return ProgressCursor.start();
        }
        try {
            var cursor = objectMapper.readValue(cursorFile.toFile(), ProgressCursor.class);
            log.info("Resuming from cursor {} stored at {}", cursor, cursorFile);
            return cursor;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read cursor file " + cursorFile, e);
        }
    }

    @Override
    public void save(ProgressCursor cursor) {
        var tempFile = cursorFile.resolveSibling(cursorFile.getFileName() + ".tmp");
        try {
            var parent = cursorFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(tempFile.toFile(), cursor);
            Files.move(tempFile, cursorFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write cursor file " + cursorFile, e);
        }
        log.atDebug().setMessage("Saved cursor {} to {}").addArgument(cursor).addArgument(cursorFile).log();
    }

    @Override
    public void reset() {
        try {
            Files.deleteIfExists(cursorFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete cursor file " + cursorFile, e);
        }
    }
}
