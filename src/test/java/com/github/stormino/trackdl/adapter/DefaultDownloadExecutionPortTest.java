package com.github.stormino.trackdl.adapter;

import com.github.stormino.trackdl.exception.DownloadException;
import com.github.stormino.trackdl.model.AudioQuality;
import com.github.stormino.trackdl.model.ConflictResolution;
import com.github.stormino.trackdl.model.DownloadProgress;
import com.github.stormino.trackdl.model.DownloadRequest;
import com.github.stormino.trackdl.model.DownloadResult;
import com.github.stormino.trackdl.model.ServerDownloadProgress;
import com.github.stormino.trackdl.model.ServerSaveResult;
import com.github.stormino.trackdl.model.StorageTarget;
import com.github.stormino.trackdl.model.TrackPayload;
import com.github.stormino.trackdl.port.ClientDownloadOptions;
import com.github.stormino.trackdl.port.ServerDownloadOptions;
import com.github.stormino.trackdl.service.coordinator.DownloadCoordinator;
import com.github.stormino.trackdl.service.coordinator.DownloadSink;
import com.github.stormino.trackdl.testsupport.TestTracks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultDownloadExecutionPort")
class DefaultDownloadExecutionPortTest {

    private final List<DownloadRequest> requests = new ArrayList<>();
    private DownloadResult sinkResult = DownloadResult.success("saved");

    private DefaultDownloadExecutionPort port() {
        DownloadSink sink = new DownloadSink() {
            @Override
            public DownloadResult saveLocal(TrackPayload payload, DownloadRequest request) {
                requests.add(request);
                return sinkResult;
            }

            @Override
            public DownloadResult saveServer(TrackPayload payload, DownloadRequest request) {
                requests.add(request);
                if (request.getOnProgress() != null) {
                    request.getOnProgress().accept(DownloadProgress.uploading(5, 10L));
                }
                return sinkResult;
            }
        };
        DownloadCoordinator coordinator = new DownloadCoordinator(
                request -> new TrackPayload(request.getTrack(), request.getQuality(), new byte[10], "song.flac", null),
                sink, null);
        return new DefaultDownloadExecutionPort(coordinator);
    }

    @Nested
    @DisplayName("client saves")
    class ClientTests {

        @Test
        @DisplayName("always overwrite the local file")
        void overwrites() throws IOException {
            port().downloadToClient(TestTracks.nativeTrack("1"), AudioQuality.LOSSLESS, "song.flac",
                    ClientDownloadOptions.builder().convertAacToMp3(true).build());

            DownloadRequest request = requests.get(0);
            assertEquals(StorageTarget.CLIENT, request.getStorage());
            assertEquals(ConflictResolution.OVERWRITE, request.getConflictResolution());
            assertEquals("song.flac", request.getFilename());
            assertTrue(request.isConvertAacToMp3());
        }

        @Test
        @DisplayName("failures are raised with the sink's message")
        void failureThrows() {
            sinkResult = DownloadResult.failure("Disk full");

            DownloadException ex = assertThrows(DownloadException.class, () -> port().downloadToClient(
                    TestTracks.nativeTrack("1"), AudioQuality.HIGH, "song.m4a", ClientDownloadOptions.builder().build()));
            assertEquals("Disk full", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("server saves")
    class ServerTests {

        @Test
        @DisplayName("returns the stored path and conflict action")
        void success() throws IOException {
            sinkResult = DownloadResult.success("uploaded",
                    Map.of(DownloadResult.FILEPATH, "/music/Artist/Album/song.flac", DownloadResult.ACTION, "overwritten"));

            ServerSaveResult result = port().downloadToServer(TestTracks.nativeTrack("1"), AudioQuality.LOSSLESS,
                    ServerDownloadOptions.builder().conflictResolution(ConflictResolution.OVERWRITE).build());

            assertTrue(result.isSuccess());
            assertEquals("/music/Artist/Album/song.flac", result.getFilepath());
            assertEquals("overwritten", result.getAction());
            assertEquals(ConflictResolution.OVERWRITE, requests.get(0).getConflictResolution());
        }

        @Test
        @DisplayName("failures are returned, not thrown")
        void failure() throws IOException {
            sinkResult = DownloadResult.failure("Upload rejected");

            ServerSaveResult result = port().downloadToServer(TestTracks.nativeTrack("1"), AudioQuality.LOSSLESS,
                    ServerDownloadOptions.builder().build());

            assertFalse(result.isSuccess());
            assertEquals("Upload rejected", result.getError());
        }

        @Test
        @DisplayName("progress is forwarded with a lower-case stage")
        void progress() throws IOException {
            List<ServerDownloadProgress> seen = new ArrayList<>();

            port().downloadToServer(TestTracks.nativeTrack("1"), AudioQuality.LOSSLESS,
                    ServerDownloadOptions.builder().onProgress(seen::add).build());

            assertEquals(1, seen.size());
            assertEquals("uploading", seen.get(0).getStage());
            assertEquals(5L, seen.get(0).getUploadedBytes());
            assertEquals(10L, seen.get(0).getTotalBytes());
        }
    }

    @Test
    @DisplayName("server progress keeps every reported field")
    void toServerProgress() {
        ServerDownloadProgress progress = DefaultDownloadExecutionPort.toServerProgress(DownloadProgress.embedding(0.5));

        assertEquals("embedding", progress.getStage());
        assertEquals(0.5, progress.getProgress());
        assertNull(progress.getReceivedBytes());
    }
}
