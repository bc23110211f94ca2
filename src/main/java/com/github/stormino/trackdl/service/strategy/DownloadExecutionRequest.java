package com.github.stormino.trackdl.service.strategy;

import com.github.stormino.trackdl.model.AudioQuality;
import com.github.stormino.trackdl.model.CancellationSignal;
import com.github.stormino.trackdl.model.ConflictResolution;
import com.github.stormino.trackdl.model.DownloadProgress;
import com.github.stormino.trackdl.model.NativeTrack;
import com.github.stormino.trackdl.model.StorageTarget;
import lombok.Builder;
import lombok.Data;

import java.util.function.Consumer;

/**
 * Request object encapsulating all parameters needed by an execution strategy.
 */
@Data
@Builder
public class DownloadExecutionRequest {

    /**
     * Resolved native track to save.
     */
    private final NativeTrack track;

    private final AudioQuality quality;

    /**
     * Target filename, including extension.
     */
    private final String filename;

    private final StorageTarget storage;

    private final boolean convertAacToMp3;

    private final boolean downloadCoversSeparately;

    private final ConflictResolution conflictResolution;

    /**
     * Cancellation signal of the attempt.
     */
    private final CancellationSignal signal;

    /**
     * Progress consumer, usually the attempt's progress tracker.
     */
    private final Consumer<DownloadProgress> onProgress;

    public void reportProgress(DownloadProgress progress) {
        if (onProgress != null) {
            onProgress.accept(progress);
        }
    }
}
