package com.github.stormino.trackdl.service.progress;

import com.github.stormino.trackdl.model.CancellationSignal;
import com.github.stormino.trackdl.model.DownloadProgress;
import com.github.stormino.trackdl.model.StorageTarget;
import com.github.stormino.trackdl.port.UiTaskPort;
import com.github.stormino.trackdl.util.DownloadConstants;
import com.github.stormino.trackdl.util.FormatUtils;
import com.github.stormino.trackdl.util.ProgressCalculator;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;

/**
 * Translates phase-tagged progress events of one attempt into UI task updates.
 * <p>
 * Client saves report raw byte counts while downloading and the embedding fraction afterwards;
 * uploads are ignored. Server saves report a single weighted fraction combining the download
 * and upload phases. Events arriving after the attempt was cancelled are dropped.
 */
@Slf4j
public class ProgressTracker implements Consumer<DownloadProgress> {

    private final String taskId;
    private final boolean server;
    private final UiTaskPort ui;
    private final double downloadWeight;
    private final CancellationSignal signal;
    private final ProgressState state = new ProgressState();

    public ProgressTracker(@NonNull String taskId, @NonNull StorageTarget storage, @NonNull UiTaskPort ui,
                           double downloadWeight, CancellationSignal signal) {
        this.taskId = taskId;
        this.server = storage == StorageTarget.SERVER;
        this.ui = ui;
        this.downloadWeight = downloadWeight;
        this.signal = signal;
    }

    public ProgressTracker(String taskId, StorageTarget storage, UiTaskPort ui, CancellationSignal signal) {
        this(taskId, storage, ui, DownloadConstants.DEFAULT_DOWNLOAD_WEIGHT, signal);
    }

    @Override
    public synchronized void accept(DownloadProgress progress) {
        if (progress == null) {
            return;
        }
        if (signal != null && signal.isCancelled()) {
            log.trace("Dropping {} progress for cancelled task {}", progress.getStage(), taskId);
            return;
        }

        switch (progress.getStage()) {
            case DOWNLOADING:
                onDownloading(progress);
                break;
            case EMBEDDING:
                onEmbedding(progress);
                break;
            case UPLOADING:
                onUploading(progress);
                break;
        }
    }

    ProgressState getState() {
        return state;
    }

    private void onDownloading(DownloadProgress progress) {
        ui.updatePhase(taskId, DownloadProgress.Stage.DOWNLOADING);
        long received = progress.getReceivedBytes() != null ? progress.getReceivedBytes() : 0L;

        if (!server) {
            ui.updateProgress(taskId, received, progress.getTotalBytes());
            return;
        }
        double fraction = ProgressCalculator.calculateDownloadFraction(
                received, progress.getTotalBytes(), state.getDownloadFraction());
        state.advanceDownload(fraction);
        reportWeighted();
    }

    private void onEmbedding(DownloadProgress progress) {
        ui.updatePhase(taskId, DownloadProgress.Stage.EMBEDDING);
        double raw = progress.getProgress() != null ? progress.getProgress() : 0.0;

        if (!server) {
            ui.updateStage(taskId, state.advanceEmbedding(ProgressCalculator.clampFraction(raw)));
            return;
        }
        state.advanceDownload(ProgressCalculator.calculateEmbeddingFraction(raw));
        reportWeighted();
    }

    private void onUploading(DownloadProgress progress) {
        if (!server) {
            return;
        }
        ui.updatePhase(taskId, DownloadProgress.Stage.UPLOADING);
        long uploaded = progress.getUploadedBytes() != null ? progress.getUploadedBytes() : 0L;
        double fraction = ProgressCalculator.calculateUploadFraction(
                uploaded, progress.getTotalBytes(), state.getUploadFraction());
        state.advanceUpload(fraction);
        if (progress.getSpeed() != null) {
            log.debug("Task {} uploading at {}", taskId, FormatUtils.formatSpeed(progress.getSpeed()));
        }
        reportWeighted();
    }

    private void reportWeighted() {
        double overall = ProgressCalculator.calculateWeightedProgress(
                state.getDownloadFraction(), state.getUploadFraction(), downloadWeight);
        ui.updateStage(taskId, overall);
    }
}
