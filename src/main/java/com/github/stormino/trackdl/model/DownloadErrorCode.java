package com.github.stormino.trackdl.model;

/**
 * Semantic error kinds reported by the orchestrator, each with a fixed retry flag.
 */
public enum DownloadErrorCode {
    DOWNLOAD_CANCELLED(false, "Download cancelled"),
    NETWORK_ERROR(true, "Network error while downloading. Please try again."),
    STORAGE_ERROR(true, "Storage error while saving the file. Please check available space."),
    CONVERSION_ERROR(false, "Conversion failed for this track. Please try a different format."),
    SERVER_ERROR(true, "Server error while saving the download. Please try again."),
    FOREIGN_NOT_SUPPORTED(false, "This track must be converted to the catalog before it can be downloaded."),
    CONVERSION_FAILED(false, "This track could not be matched in the catalog."),
    UNKNOWN_ERROR(false, "Unexpected download error. Please try again.");

    private final boolean retryable;
    private final String userMessage;

    DownloadErrorCode(boolean retryable, String userMessage) {
        this.retryable = retryable;
        this.userMessage = userMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
