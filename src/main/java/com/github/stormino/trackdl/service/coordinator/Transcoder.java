package com.github.stormino.trackdl.service.coordinator;

import com.github.stormino.trackdl.model.CancellationSignal;
import com.github.stormino.trackdl.model.TrackPayload;

import java.io.IOException;

/**
 * Converts payloads between audio formats.
 */
public interface Transcoder {

    /**
     * Convert the payload to the target format. Payloads already in that format, or lossless
     * payloads, are returned unchanged.
     *
     * @param targetFormat Target extension, e.g. "mp3"
     */
    TrackPayload convertIfNeeded(TrackPayload payload, String targetFormat, CancellationSignal signal)
            throws IOException;
}
