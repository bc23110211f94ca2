package com.github.stormino.trackdl.service.coordinator;

import com.github.stormino.trackdl.exception.TransportException;
import com.github.stormino.trackdl.model.AudioQuality;
import com.github.stormino.trackdl.model.DownloadProgress;
import com.github.stormino.trackdl.model.DownloadRequest;
import com.github.stormino.trackdl.model.StorageTarget;
import com.github.stormino.trackdl.model.TrackPayload;
import com.github.stormino.trackdl.testsupport.FakeTransport;
import com.github.stormino.trackdl.testsupport.TestTracks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HttpDownloadSource")
class HttpDownloadSourceTest {

    private FakeTransport transport;
    private HttpDownloadSource source;
    private final List<DownloadProgress> progress = new ArrayList<>();

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        source = new HttpDownloadSource(transport, "http://media.local/tracks/{id}/stream?quality={quality}");
    }

    private DownloadRequest request(AudioQuality quality, String filename) {
        return DownloadRequest.builder()
                .track(TestTracks.nativeTrack("a b"))
                .quality(quality)
                .storage(StorageTarget.CLIENT)
                .filename(filename)
                .onProgress(progress::add)
                .build();
    }

    @Test
    @DisplayName("substitutes the encoded id and quality into the template")
    void buildsUrl() throws Exception {
        transport.respond(200, new byte[]{1, 2, 3});

        source.fetchTrack(request(AudioQuality.HIGH, null));

        assertEquals(List.of("http://media.local/tracks/a+b/stream?quality=HIGH"), transport.urls);
    }

    @Test
    @DisplayName("returns the body and reports download progress")
    void returnsPayload() throws Exception {
        transport.respond(200, new byte[]{1, 2, 3});

        TrackPayload payload = source.fetchTrack(request(AudioQuality.LOSSLESS, "x.flac"));

        assertEquals(3, payload.getSize());
        assertEquals("x.flac", payload.getFilename());
        assertEquals("audio/mp4", payload.getContentType());
        assertEquals(1, progress.size());
        assertEquals(DownloadProgress.Stage.DOWNLOADING, progress.get(0).getStage());
        assertEquals(3L, progress.get(0).getReceivedBytes());
    }

    @Test
    @DisplayName("names lossy payloads by the fetched format before conversion")
    void unconvertedExtension() throws Exception {
        TrackPayload payload = source.fetchTrack(request(AudioQuality.HIGH, "Artist - Album - 01 Song.mp3"));

        assertEquals("Artist - Album - 01 Song.m4a", payload.getFilename());
    }

    @Test
    @DisplayName("non-2xx responses fail with the status code")
    void httpError() {
        transport.respond(404, new byte[0]);

        TransportException e = assertThrows(TransportException.class,
                () -> source.fetchTrack(request(AudioQuality.HIGH, null)));

        assertEquals(404, e.getStatusCode());
        assertEquals("Stream request failed with HTTP 404", e.getMessage());
    }
}
