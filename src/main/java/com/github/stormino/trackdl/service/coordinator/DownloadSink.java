package com.github.stormino.trackdl.service.coordinator;

import com.github.stormino.trackdl.model.DownloadRequest;
import com.github.stormino.trackdl.model.DownloadResult;
import com.github.stormino.trackdl.model.TrackPayload;

import java.io.IOException;

/**
 * Stores a downloaded payload, either locally or on the server-side library.
 */
public interface DownloadSink {

    DownloadResult saveLocal(TrackPayload payload, DownloadRequest request) throws IOException;

    DownloadResult saveServer(TrackPayload payload, DownloadRequest request) throws IOException;
}
