package com.github.stormino.trackdl.port;

import java.io.IOException;

/**
 * Byte transfer over HTTP. Implementations handle timeouts and retry transient failures
 * with backoff themselves.
 */
public interface TransportPort {

    /**
     * @throws IOException when the transfer fails after retries
     * @throws com.github.stormino.trackdl.exception.DownloadCancelledException when the
     *         options' signal is cancelled during the transfer
     */
    TransportResponse fetch(String url, FetchOptions options) throws IOException;
}
