package com.github.stormino.trackdl.service.strategy;

import com.github.stormino.trackdl.model.DownloadResult;
import com.github.stormino.trackdl.model.ExecutionStrategyType;

/**
 * Strategy interface for the execution backends that actually save a track.
 * Implementations report progress through the request's consumer and never pick
 * another backend on their own.
 */
public interface DownloadExecutionStrategy {

    /**
     * Save one track.
     *
     * @param request Request object containing all download parameters
     * @return Download result with status and error information
     */
    DownloadResult execute(DownloadExecutionRequest request);

    /**
     * Get the backend this strategy implements.
     *
     * @return Strategy type identifier
     */
    ExecutionStrategyType getType();
}
