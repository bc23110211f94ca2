package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Snapshot of a task pushed to registry listeners after every change.
 */
@Value
@Builder
public class ProgressUpdate {

    String taskId;
    String filename;
    DownloadStatus status;

    /**
     * Overall progress in [0, 1] across all phases.
     */
    double progress;

    Long receivedBytes;
    Long totalBytes;
    String errorMessage;

    /**
     * Status label or error text for display, null for plain progress ticks.
     */
    String message;

    @Builder.Default
    LocalDateTime timestamp = LocalDateTime.now();

    public static ProgressUpdate forTask(DownloadTask task, String message) {
        return ProgressUpdate.builder()
                .taskId(task.getId())
                .filename(task.getFilename())
                .status(task.getStatus())
                .progress(task.getProgress())
                .receivedBytes(task.getReceivedBytes())
                .totalBytes(task.getTotalBytes())
                .errorMessage(task.getErrorMessage())
                .message(message)
                .build();
    }
}
