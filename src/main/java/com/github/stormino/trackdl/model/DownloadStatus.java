package com.github.stormino.trackdl.model;

public enum DownloadStatus {
    QUEUED("Queued"),
    DOWNLOADING("Downloading"),
    EMBEDDING("Embedding metadata"),
    UPLOADING("Uploading"),
    COMPLETED("Completed"),
    FAILED("Failed"),
    CANCELLED("Cancelled");

    private final String displayName;

    DownloadStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isActive() {
        return this == DOWNLOADING || this == EMBEDDING || this == UPLOADING;
    }

    public static DownloadStatus forStage(DownloadProgress.Stage stage) {
        switch (stage) {
            case EMBEDDING:
                return EMBEDDING;
            case UPLOADING:
                return UPLOADING;
            default:
                return DOWNLOADING;
        }
    }
}
