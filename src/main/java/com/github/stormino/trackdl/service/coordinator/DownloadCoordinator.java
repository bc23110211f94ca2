package com.github.stormino.trackdl.service.coordinator;

import com.github.stormino.trackdl.model.DownloadRequest;
import com.github.stormino.trackdl.model.DownloadResult;
import com.github.stormino.trackdl.model.StorageTarget;
import com.github.stormino.trackdl.model.TrackPayload;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Runs the fetch, convert and store pipeline for one track.
 */
@Slf4j
public class DownloadCoordinator {

    private final DownloadSource source;
    private final DownloadSink sink;
    private final Transcoder transcoder;

    /**
     * @param transcoder Optional; without it lossy payloads are stored unconverted
     */
    public DownloadCoordinator(@NonNull DownloadSource source, @NonNull DownloadSink sink, Transcoder transcoder) {
        this.source = source;
        this.sink = sink;
        this.transcoder = transcoder;
    }

    public DownloadResult download(@NonNull DownloadRequest request) throws IOException {
        log.debug("Fetching track {} at {} for {} storage",
                request.getTrack().getId(), request.getQuality(), request.getStorage());

        TrackPayload payload = source.fetchTrack(request);
        checkCancelled(request);

        if (request.getStorage() == StorageTarget.CLIENT && request.isConvertAacToMp3() && transcoder != null) {
            payload = transcoder.convertIfNeeded(payload, "mp3", request.getSignal());
            checkCancelled(request);
        }

        if (request.getStorage() == StorageTarget.SERVER) {
            return sink.saveServer(payload, request);
        }
        return sink.saveLocal(payload, request);
    }

    private static void checkCancelled(DownloadRequest request) {
        if (request.getSignal() != null) {
            request.getSignal().throwIfCancelled();
        }
    }
}
