package com.github.stormino.trackdl.exception;

/**
 * Thrown when work observes that its cancellation signal was triggered.
 */
public class DownloadCancelledException extends DownloadException {

    public DownloadCancelledException() {
        super("Download was cancelled");
    }

    public DownloadCancelledException(String message) {
        super(message != null ? message : "Download was cancelled");
    }
}
