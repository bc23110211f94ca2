package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.function.Consumer;

/**
 * Request handled by the download coordinator.
 */
@Value
@Builder(toBuilder = true)
public class DownloadRequest {
    @NonNull NativeTrack track;
    @NonNull AudioQuality quality;
    @NonNull StorageTarget storage;
    String filename;
    boolean convertAacToMp3;
    boolean downloadCoversSeparately;
    ConflictResolution conflictResolution;
    CancellationSignal signal;
    Consumer<DownloadProgress> onProgress;

    public void reportProgress(DownloadProgress progress) {
        if (onProgress != null) {
            onProgress.accept(progress);
        }
    }
}
