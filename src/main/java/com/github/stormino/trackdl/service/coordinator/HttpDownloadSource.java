package com.github.stormino.trackdl.service.coordinator;

import com.github.stormino.trackdl.exception.TransportException;
import com.github.stormino.trackdl.model.DownloadProgress;
import com.github.stormino.trackdl.model.DownloadRequest;
import com.github.stormino.trackdl.model.NativeTrack;
import com.github.stormino.trackdl.model.TrackPayload;
import com.github.stormino.trackdl.port.FetchOptions;
import com.github.stormino.trackdl.port.TransportPort;
import com.github.stormino.trackdl.port.TransportResponse;
import com.github.stormino.trackdl.util.TrackFilenames;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Fetches track streams over HTTP. The stream URL comes from a template in which
 * {@code {id}} and {@code {quality}} are substituted.
 */
@Slf4j
public class HttpDownloadSource implements DownloadSource {

    private final TransportPort transport;
    private final String streamUrlTemplate;

    public HttpDownloadSource(@NonNull TransportPort transport, @NonNull String streamUrlTemplate) {
        this.transport = transport;
        this.streamUrlTemplate = streamUrlTemplate;
    }

    @Override
    public TrackPayload fetchTrack(DownloadRequest request) throws IOException {
        NativeTrack track = request.getTrack();
        String url = buildStreamUrl(track, request);

        FetchOptions options = FetchOptions.builder()
                .signal(request.getSignal())
                .listener((received, total) -> request.reportProgress(DownloadProgress.downloading(received, total)))
                .build();

        TransportResponse response = transport.fetch(url, options);
        if (!response.isSuccessful()) {
            throw new TransportException("Stream request failed with HTTP " + response.getStatusCode(),
                    url, response.getStatusCode());
        }

        byte[] data = response.getBody() != null ? response.getBody() : new byte[0];
        log.debug("Fetched {} bytes for track {}", data.length, track.getId());

        return new TrackPayload(track, request.getQuality(), data, sourceFilename(request), response.getContentType());
    }

    String buildStreamUrl(NativeTrack track, DownloadRequest request) {
        return streamUrlTemplate
                .replace("{id}", URLEncoder.encode(track.getId(), StandardCharsets.UTF_8))
                .replace("{quality}", request.getQuality().name());
    }

    /**
     * Name matching the fetched format; conversion renames the payload afterwards.
     */
    private static String sourceFilename(DownloadRequest request) {
        String extension = request.getQuality().getExtension(false);
        if (request.getFilename() != null && !request.getFilename().isBlank()) {
            return TrackFilenames.replaceExtension(request.getFilename(), extension);
        }
        return TrackFilenames.buildDownloadFilename(request.getTrack(), request.getQuality(), false);
    }
}
