package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * UI-visible record of one download attempt.
 */
@Data
@Builder
public class DownloadTask {

    @Builder.Default
    private String id = UUID.randomUUID().toString();

    private String targetId;
    private String title;
    private String artistName;
    private String filename;
    private String subtitle;
    private StorageTarget storage;

    @Builder.Default
    private volatile DownloadStatus status = DownloadStatus.QUEUED;

    /**
     * Completion fraction in [0, 1].
     */
    @Builder.Default
    private volatile double progress = 0.0;

    private Long receivedBytes;
    private Long totalBytes;

    private String errorMessage;

    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    private LocalDateTime completedAt;

    @ToString.Exclude
    @Builder.Default
    private CancellationSignal controller = new CancellationSignal();

    public String getDisplayName() {
        if (title == null) {
            return filename != null ? filename : "Track " + targetId;
        }
        return artistName != null ? artistName + " - " + title : title;
    }

    public boolean isCompleted() {
        return status == DownloadStatus.COMPLETED;
    }

    public boolean isFailed() {
        return status == DownloadStatus.FAILED;
    }

    public boolean isActive() {
        return status.isActive();
    }
}
