package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.exception.DownloadCancelledException;
import com.github.stormino.trackdl.model.DownloadRequest;
import com.github.stormino.trackdl.model.DownloadResult;
import com.github.stormino.trackdl.model.ExecutionStrategyType;
import com.github.stormino.trackdl.service.coordinator.DownloadCoordinator;
import com.github.stormino.trackdl.service.strategy.DownloadExecutionRequest;
import com.github.stormino.trackdl.service.strategy.DownloadExecutionStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the in-process fetch, convert and store pipeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CoordinatorDownloadStrategy implements DownloadExecutionStrategy {

    private final DownloadCoordinator coordinator;

    @Override
    public DownloadResult execute(DownloadExecutionRequest request) {
        DownloadRequest downloadRequest = DownloadRequest.builder()
                .track(request.getTrack())
                .quality(request.getQuality())
                .storage(request.getStorage())
                .filename(request.getFilename())
                .convertAacToMp3(request.isConvertAacToMp3())
                .downloadCoversSeparately(request.isDownloadCoversSeparately())
                .conflictResolution(request.getConflictResolution())
                .signal(request.getSignal())
                .onProgress(request::reportProgress)
                .build();

        try {
            DownloadResult result = coordinator.download(downloadRequest);
            if (result == null) {
                return DownloadResult.failure("Download failed");
            }
            return result;
        } catch (DownloadCancelledException e) {
            log.debug("Coordinated download of track {} cancelled", request.getTrack().getId());
            return DownloadResult.cancelled(e.getMessage());
        } catch (Exception e) {
            log.debug("Coordinated download of track {} failed: {}", request.getTrack().getId(), e.getMessage());
            return DownloadResult.failure(e.getMessage(), e);
        }
    }

    @Override
    public ExecutionStrategyType getType() {
        return ExecutionStrategyType.COORDINATOR;
    }
}
