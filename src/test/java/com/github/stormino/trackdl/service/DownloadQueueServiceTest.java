package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.config.DownloadProperties;
import com.github.stormino.trackdl.model.CancellationSignal;
import com.github.stormino.trackdl.model.ConversionResult;
import com.github.stormino.trackdl.model.DownloadOptions;
import com.github.stormino.trackdl.model.DownloadPreferences;
import com.github.stormino.trackdl.model.DownloadResult;
import com.github.stormino.trackdl.model.ErrorContext;
import com.github.stormino.trackdl.model.ExecutionStrategyType;
import com.github.stormino.trackdl.model.NotificationMode;
import com.github.stormino.trackdl.model.QueueStatus;
import com.github.stormino.trackdl.testsupport.FakeExecutionStrategy;
import com.github.stormino.trackdl.testsupport.ManualExecutorService;
import com.github.stormino.trackdl.testsupport.RecordingLogPort;
import com.github.stormino.trackdl.testsupport.RecordingNotificationPort;
import com.github.stormino.trackdl.testsupport.RecordingUiTaskPort;
import com.github.stormino.trackdl.testsupport.TestTracks;
import com.github.stormino.trackdl.util.DownloadConstants;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DownloadQueueService")
class DownloadQueueServiceTest {

    private static final DownloadOptions SILENT = DownloadOptions.builder()
            .notificationMode(NotificationMode.SILENT)
            .build();

    private ManualExecutorService workers;
    private DownloadQueue queue;
    private FakeExecutionStrategy client;
    private RecordingLogPort downloadLog;
    private RecordingNotificationPort notifications;
    private DownloadQueueService service;

    @BeforeEach
    void setUp() {
        workers = new ManualExecutorService();
        DownloadProperties properties = new DownloadProperties();
        queue = new DownloadQueue(properties.getQueue(), workers);
        client = new FakeExecutionStrategy(ExecutionStrategyType.CLIENT);
        downloadLog = new RecordingLogPort();
        notifications = new RecordingNotificationPort();

        DownloadPreferences preferences = DownloadPreferences.builder().build();
        DownloadOrchestrator orchestrator = new DownloadOrchestrator(
                new DownloadOptionsResolver(() -> preferences),
                new TrackResolver(target -> ConversionResult.failure("No match found")),
                new DownloadErrorClassifier(),
                new RecordingUiTaskPort(),
                downloadLog,
                notifications,
                List.of(client),
                properties,
                Runnable::run);

        service = new DownloadQueueService(queue, orchestrator, downloadLog, notifications);
        service.init();
    }

    @AfterEach
    void tearDown() {
        queue.shutdown();
    }

    private List<ErrorContext> queueErrors() {
        return notifications.recordedContexts.stream()
                .filter(context -> DownloadConstants.QUEUE_COMPONENT.equals(context.getComponent()))
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("queued track is downloaded through the orchestrator")
    void downloadsQueuedTrack() {
        String id = service.addDownload(TestTracks.nativeTrack("1"));
        workers.runAll();

        assertEquals("1", id);
        assertEquals(1, client.requests.size());
        assertFalse(queue.contains(id));
        assertTrue(downloadLog.entries.stream().anyMatch(entry -> entry.startsWith("success:")));
    }

    @Test
    @DisplayName("retryable failure is retried, then reported once")
    void reportsTerminalFailure() {
        client.willReturn(request -> DownloadResult.failure("Failed to fetch"));

        service.addDownload(TestTracks.nativeTrack("1"), SILENT, 0);
        workers.runAll();

        assertEquals(3, client.requests.size());
        assertEquals(2, downloadLog.entries.stream().filter(entry -> entry.startsWith("warning:Retrying")).count());
        assertTrue(downloadLog.entries.contains("error:Download failed after 3 attempts: Song 1: Failed to fetch"));
        List<ErrorContext> errors = queueErrors();
        assertEquals(1, errors.size());
        assertEquals(ErrorContext.Severity.HIGH, errors.get(0).getSeverity());
    }

    @Test
    @DisplayName("cancelling a waiting download removes it")
    void cancelWaiting() {
        service.pause();
        String id = service.addDownload(TestTracks.nativeTrack("1"));

        assertTrue(service.cancel(id));
        assertFalse(queue.contains(id));
        assertFalse(service.cancel("unknown"));

        service.resume();
        workers.runAll();
        assertTrue(client.requests.isEmpty());
    }

    @Test
    @DisplayName("cancelling a running download drops it without retries")
    void cancelRunning() {
        client.willReturn(request -> {
            service.cancel("1");
            return DownloadResult.failure("aborted");
        });

        service.addDownload(TestTracks.nativeTrack("1"), SILENT, 0);
        workers.runAll();

        assertEquals(1, client.requests.size());
        assertFalse(queue.contains("1"));
        assertTrue(queueErrors().isEmpty());
        assertTrue(downloadLog.entries.stream().noneMatch(entry -> entry.startsWith("warning:Retrying")));
    }

    @Test
    @DisplayName("album downloads share a group in the status")
    void addDownloads() {
        service.pause();

        List<String> ids = service.addDownloads(
                List.of(TestTracks.nativeTrack("1"), TestTracks.nativeTrack("2")), null, 1);

        QueueStatus status = service.getStatus();
        assertEquals(List.of("1", "2"), ids);
        assertEquals(2, status.getQueued());
        assertEquals(1, status.getAlbumGroups().size());
        assertEquals("album-1", status.getAlbumGroups().get(0).getAlbumId());
        assertEquals("Album", status.getAlbumGroups().get(0).getAlbumTitle());
    }

    @Test
    @DisplayName("finished album downloads release the shared caller signal")
    void sharedSignalReleased() {
        CancellationSignal albumSignal = new CancellationSignal();
        DownloadOptions options = SILENT.toBuilder().signal(albumSignal).build();

        service.addDownloads(List.of(TestTracks.nativeTrack("1"), TestTracks.nativeTrack("2"),
                TestTracks.nativeTrack("3")), options, 0);
        workers.runAll();

        assertEquals(3, client.requests.size());
        assertEquals(0, albumSignal.getListenerCount());
    }

    @Test
    @DisplayName("stop empties the queue")
    void stop() {
        service.addDownload(TestTracks.nativeTrack("1"));
        service.addDownload(TestTracks.nativeTrack("2"));

        service.stop();
        workers.runAll();

        assertEquals(0, service.getStatus().getQueued());
        assertTrue(client.requests.isEmpty());
    }
}
