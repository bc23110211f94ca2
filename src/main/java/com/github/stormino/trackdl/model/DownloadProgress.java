package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Phase-tagged progress event emitted while a track is being saved.
 */
@Value
@Builder
public class DownloadProgress {

    @NonNull Stage stage;

    Long receivedBytes;
    Long uploadedBytes;

    /**
     * Total size of the current phase, null when the transport does not know it.
     */
    Long totalBytes;

    /**
     * Embedding progress in [0, 1].
     */
    Double progress;

    /**
     * Upload speed in bytes per second, when reported.
     */
    Double speed;

    /**
     * Upload ETA in seconds, when reported.
     */
    Long eta;

    public enum Stage {
        DOWNLOADING,
        EMBEDDING,
        UPLOADING
    }

    public static DownloadProgress downloading(long receivedBytes, Long totalBytes) {
        return DownloadProgress.builder()
                .stage(Stage.DOWNLOADING)
                .receivedBytes(receivedBytes)
                .totalBytes(totalBytes)
                .build();
    }

    public static DownloadProgress embedding(double progress) {
        return DownloadProgress.builder()
                .stage(Stage.EMBEDDING)
                .progress(progress)
                .build();
    }

    public static DownloadProgress uploading(long uploadedBytes, Long totalBytes) {
        return DownloadProgress.builder()
                .stage(Stage.UPLOADING)
                .uploadedBytes(uploadedBytes)
                .totalBytes(totalBytes)
                .build();
    }
}
