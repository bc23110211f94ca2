package com.github.stormino.trackdl.exception;

import java.nio.file.Path;

/**
 * Exception thrown when a downloaded file cannot be written to storage.
 */
public class StorageException extends DownloadException {

    private final Path path;

    public StorageException(String message, Path path) {
        super(message);
        this.path = path;
    }

    public StorageException(String message, Throwable cause, Path path) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
