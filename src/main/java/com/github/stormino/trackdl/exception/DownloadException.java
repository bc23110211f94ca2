package com.github.stormino.trackdl.exception;

/**
 * Unchecked base of every failure raised by the download pipeline. The orchestrator
 * catches it and maps subclasses onto error codes; plain instances are classified by message.
 */
public class DownloadException extends RuntimeException {

    public DownloadException(String message) {
        super(message);
    }

    public DownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
