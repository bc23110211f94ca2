package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.exception.DownloadCancelledException;
import com.github.stormino.trackdl.model.DownloadResult;
import com.github.stormino.trackdl.model.ExecutionStrategyType;
import com.github.stormino.trackdl.port.ClientDownloadOptions;
import com.github.stormino.trackdl.port.DownloadExecutionPort;
import com.github.stormino.trackdl.service.strategy.DownloadExecutionRequest;
import com.github.stormino.trackdl.service.strategy.DownloadExecutionStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Saves tracks in the caller's environment. Progress events pass through unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClientDownloadStrategy implements DownloadExecutionStrategy {

    private final DownloadExecutionPort executionPort;

    @Override
    public DownloadResult execute(DownloadExecutionRequest request) {
        log.debug("Client download of track {} as {}", request.getTrack().getId(), request.getFilename());

        ClientDownloadOptions options = ClientDownloadOptions.builder()
                .convertAacToMp3(request.isConvertAacToMp3())
                .downloadCoversSeparately(request.isDownloadCoversSeparately())
                .signal(request.getSignal())
                .onProgress(request::reportProgress)
                .build();

        try {
            executionPort.downloadToClient(request.getTrack(), request.getQuality(), request.getFilename(), options);
            return DownloadResult.success();
        } catch (DownloadCancelledException e) {
            log.debug("Client download of track {} cancelled", request.getTrack().getId());
            return DownloadResult.cancelled(e.getMessage());
        } catch (Exception e) {
            log.debug("Client download of track {} failed: {}", request.getTrack().getId(), e.getMessage());
            return DownloadResult.failure(e.getMessage(), e);
        }
    }

    @Override
    public ExecutionStrategyType getType() {
        return ExecutionStrategyType.CLIENT;
    }
}
