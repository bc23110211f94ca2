package com.github.stormino.trackdl.service.progress;

import com.github.stormino.trackdl.model.DownloadProgress;
import com.github.stormino.trackdl.model.ServerDownloadProgress;
import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Converts progress reported by the server save operation into phase-tagged events.
 * Unknown stages are treated as uploading.
 */
@UtilityClass
public class ProgressNormalizer {

    public static DownloadProgress normalizeServerProgress(ServerDownloadProgress progress) {
        String stage = progress.getStage() != null ? progress.getStage().toLowerCase(Locale.ROOT) : "";

        switch (stage) {
            case "downloading":
                return DownloadProgress.builder()
                        .stage(DownloadProgress.Stage.DOWNLOADING)
                        .receivedBytes(progress.getReceivedBytes())
                        .totalBytes(progress.getTotalBytes())
                        .build();
            case "embedding":
                return DownloadProgress.builder()
                        .stage(DownloadProgress.Stage.EMBEDDING)
                        .progress(progress.getProgress())
                        .build();
            default:
                return DownloadProgress.builder()
                        .stage(DownloadProgress.Stage.UPLOADING)
                        .uploadedBytes(progress.getUploadedBytes())
                        .totalBytes(progress.getTotalBytes())
                        .speed(progress.getSpeed())
                        .eta(progress.getEta())
                        .build();
        }
    }
}
