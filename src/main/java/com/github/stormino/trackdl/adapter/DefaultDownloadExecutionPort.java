package com.github.stormino.trackdl.adapter;

import com.github.stormino.trackdl.exception.DownloadException;
import com.github.stormino.trackdl.model.AudioQuality;
import com.github.stormino.trackdl.model.ConflictResolution;
import com.github.stormino.trackdl.model.DownloadProgress;
import com.github.stormino.trackdl.model.DownloadRequest;
import com.github.stormino.trackdl.model.DownloadResult;
import com.github.stormino.trackdl.model.NativeTrack;
import com.github.stormino.trackdl.model.ServerDownloadProgress;
import com.github.stormino.trackdl.model.ServerSaveResult;
import com.github.stormino.trackdl.model.StorageTarget;
import com.github.stormino.trackdl.port.ClientDownloadOptions;
import com.github.stormino.trackdl.port.DownloadExecutionPort;
import com.github.stormino.trackdl.port.ServerDownloadOptions;
import com.github.stormino.trackdl.service.coordinator.DownloadCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Execution port built on the download coordinator's source and sink. Client saves go to the
 * local download directory; server saves are uploaded to the server-side library.
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultDownloadExecutionPort implements DownloadExecutionPort {

    private final DownloadCoordinator coordinator;

    @Override
    public void downloadToClient(NativeTrack track, AudioQuality quality, String filename,
                                 ClientDownloadOptions options) throws IOException {
        DownloadRequest request = DownloadRequest.builder()
                .track(track)
                .quality(quality)
                .storage(StorageTarget.CLIENT)
                .filename(filename)
                .convertAacToMp3(options.isConvertAacToMp3())
                .downloadCoversSeparately(options.isDownloadCoversSeparately())
                .conflictResolution(ConflictResolution.OVERWRITE)
                .signal(options.getSignal())
                .onProgress(options.getOnProgress())
                .build();

        DownloadResult result = coordinator.download(request);
        if (!result.isSuccess()) {
            throw new DownloadException(result.getErrorMessage() != null ? result.getErrorMessage() : "Download failed",
                    result.getCause());
        }
    }

    @Override
    public ServerSaveResult downloadToServer(NativeTrack track, AudioQuality quality,
                                             ServerDownloadOptions options) throws IOException {
        Consumer<ServerDownloadProgress> serverProgress = options.getOnProgress();
        DownloadRequest request = DownloadRequest.builder()
                .track(track)
                .quality(quality)
                .storage(StorageTarget.SERVER)
                .downloadCoversSeparately(options.isDownloadCoversSeparately())
                .conflictResolution(options.getConflictResolution())
                .signal(options.getSignal())
                .onProgress(serverProgress != null ? progress -> serverProgress.accept(toServerProgress(progress)) : null)
                .build();

        DownloadResult result = coordinator.download(request);
        if (!result.isSuccess()) {
            return ServerSaveResult.builder()
                    .success(false)
                    .error(result.getErrorMessage() != null ? result.getErrorMessage() : "Server upload failed")
                    .build();
        }

        return ServerSaveResult.builder()
                .success(true)
                .message(result.getMessage())
                .filepath(result.getMetadata(DownloadResult.FILEPATH))
                .action(result.getMetadata(DownloadResult.ACTION))
                .build();
    }

    static ServerDownloadProgress toServerProgress(DownloadProgress progress) {
        return ServerDownloadProgress.builder()
                .stage(progress.getStage().name().toLowerCase(Locale.ROOT))
                .receivedBytes(progress.getReceivedBytes())
                .uploadedBytes(progress.getUploadedBytes())
                .totalBytes(progress.getTotalBytes())
                .progress(progress.getProgress())
                .speed(progress.getSpeed())
                .eta(progress.getEta())
                .build();
    }
}
