package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.exception.DownloadCancelledException;
import com.github.stormino.trackdl.model.DownloadResult;
import com.github.stormino.trackdl.model.ExecutionStrategyType;
import com.github.stormino.trackdl.model.ServerSaveResult;
import com.github.stormino.trackdl.port.DownloadExecutionPort;
import com.github.stormino.trackdl.port.ServerDownloadOptions;
import com.github.stormino.trackdl.service.progress.ProgressNormalizer;
import com.github.stormino.trackdl.service.strategy.DownloadExecutionRequest;
import com.github.stormino.trackdl.service.strategy.DownloadExecutionStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Has the server fetch, tag and store tracks. Server progress is normalized into
 * phase-tagged events before reaching the tracker.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ServerDownloadStrategy implements DownloadExecutionStrategy {

    private final DownloadExecutionPort executionPort;

    @Override
    public DownloadResult execute(DownloadExecutionRequest request) {
        log.debug("Server download of track {}", request.getTrack().getId());

        ServerDownloadOptions options = ServerDownloadOptions.builder()
                .downloadCoversSeparately(request.isDownloadCoversSeparately())
                .conflictResolution(request.getConflictResolution())
                .signal(request.getSignal())
                .onProgress(progress -> request.reportProgress(ProgressNormalizer.normalizeServerProgress(progress)))
                .build();

        try {
            ServerSaveResult result = executionPort.downloadToServer(request.getTrack(), request.getQuality(), options);
            if (result == null || !result.isSuccess()) {
                String error = result != null && result.getError() != null ? result.getError() : "Server download failed";
                return DownloadResult.failure(error);
            }

            Map<String, Object> metadata = new HashMap<>();
            if (result.getFilepath() != null) {
                metadata.put(DownloadResult.FILEPATH, result.getFilepath());
            }
            if (result.getAction() != null) {
                metadata.put(DownloadResult.ACTION, result.getAction());
            }
            return DownloadResult.success(result.getMessage(), metadata);

        } catch (DownloadCancelledException e) {
            log.debug("Server download of track {} cancelled", request.getTrack().getId());
            return DownloadResult.cancelled(e.getMessage());
        } catch (Exception e) {
            log.debug("Server download of track {} failed: {}", request.getTrack().getId(), e.getMessage());
            return DownloadResult.failure(e.getMessage(), e);
        }
    }

    @Override
    public ExecutionStrategyType getType() {
        return ExecutionStrategyType.SERVER;
    }
}
