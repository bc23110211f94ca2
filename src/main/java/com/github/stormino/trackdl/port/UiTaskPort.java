package com.github.stormino.trackdl.port;

import com.github.stormino.trackdl.model.DownloadProgress;
import com.github.stormino.trackdl.model.DownloadTarget;
import com.github.stormino.trackdl.model.TaskHandle;
import com.github.stormino.trackdl.model.TaskMeta;

/**
 * UI-facing task store. Every method except {@link #beginTask} must tolerate unknown or
 * already finished task ids.
 */
public interface UiTaskPort {

    TaskHandle beginTask(DownloadTarget target, String filename, TaskMeta meta);

    void updateProgress(String taskId, long receivedBytes, Long totalBytes);

    void updatePhase(String taskId, DownloadProgress.Stage phase);

    /**
     * @param progress overall completion fraction in [0, 1]
     */
    void updateStage(String taskId, double progress);

    void completeTask(String taskId);

    void errorTask(String taskId, String message);

    void cancelTask(String taskId);
}
