package com.github.stormino.trackdl.service.coordinator;

import com.github.stormino.trackdl.model.DownloadRequest;
import com.github.stormino.trackdl.model.TrackPayload;

import java.io.IOException;

/**
 * Fetches the audio bytes of a track.
 */
public interface DownloadSource {

    /**
     * @throws IOException when the transfer fails
     */
    TrackPayload fetchTrack(DownloadRequest request) throws IOException;
}
