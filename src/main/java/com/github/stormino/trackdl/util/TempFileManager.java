package com.github.stormino.trackdl.util;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Creates scratch files for one conversion and deletes them on close.
 * Intended for try-with-resources.
 */
@Slf4j
public class TempFileManager implements Closeable {

    private final Path directory;
    private final List<Path> tempFiles = new CopyOnWriteArrayList<>();
    private volatile boolean closed = false;

    /**
     * @param directory Directory for scratch files, or null for the system temp directory
     */
    public TempFileManager(Path directory) {
        this.directory = directory;
    }

    public TempFileManager() {
        this(null);
    }

    /**
     * Create an empty temp file that is deleted when this manager is closed.
     *
     * @param suffix File suffix including the dot, e.g. ".m4a"
     */
    public Path createTempFile(String suffix) throws IOException {
        if (closed) {
            throw new IllegalStateException("TempFileManager is already closed");
        }
        Path file = directory != null
                ? Files.createTempFile(directory, "trackdl-", suffix)
                : Files.createTempFile("trackdl-", suffix);
        tempFiles.add(file);
        log.debug("Created temp file: {}", file);
        return file;
    }

    /**
     * Register an externally created file for cleanup, e.g. a tool's output file.
     */
    public void registerTempFile(Path file) {
        if (closed) {
            log.warn("TempFileManager is already closed, cannot register file: {}", file);
            return;
        }
        tempFiles.add(file);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        for (Path file : new ArrayList<>(tempFiles)) {
            try {
                if (Files.deleteIfExists(file)) {
                    log.debug("Deleted temp file: {}", file);
                }
            } catch (IOException e) {
                log.warn("Failed to delete temp file: {}", file, e);
            }
        }
        tempFiles.clear();
    }

    public int getTempFileCount() {
        return tempFiles.size();
    }

    public boolean isClosed() {
        return closed;
    }
}
