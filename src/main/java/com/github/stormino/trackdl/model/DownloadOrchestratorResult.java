package com.github.stormino.trackdl.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of one orchestrated download. Check {@link #isSuccess()} before reading
 * {@link #getFilename()} or {@link #getError()}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DownloadOrchestratorResult {

    boolean success;
    String filename;

    /**
     * Present on success and on every failure after the UI task was created.
     */
    String taskId;

    DownloadError error;

    public static DownloadOrchestratorResult success(String filename, String taskId) {
        return new DownloadOrchestratorResult(true, filename, taskId, null);
    }

    public static DownloadOrchestratorResult failure(DownloadError error) {
        return new DownloadOrchestratorResult(false, null, null, error);
    }

    public static DownloadOrchestratorResult failure(DownloadError error, String taskId) {
        return new DownloadOrchestratorResult(false, null, taskId, error);
    }

    public Optional<String> getTaskIdOptional() {
        return Optional.ofNullable(taskId);
    }

    public DownloadErrorCode getErrorCode() {
        return error != null ? error.getCode() : null;
    }
}
