package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.exception.DownloadCancelledException;
import com.github.stormino.trackdl.exception.DownloadException;
import com.github.stormino.trackdl.model.CancellationSignal;
import com.github.stormino.trackdl.model.DownloadErrorCode;
import com.github.stormino.trackdl.model.DownloadOptions;
import com.github.stormino.trackdl.model.DownloadOrchestratorResult;
import com.github.stormino.trackdl.model.DownloadTarget;
import com.github.stormino.trackdl.model.EnqueueOptions;
import com.github.stormino.trackdl.model.ErrorContext;
import com.github.stormino.trackdl.model.QueueStatus;
import com.github.stormino.trackdl.model.QueuedDownload;
import com.github.stormino.trackdl.port.LogPort;
import com.github.stormino.trackdl.port.NotificationPort;
import com.github.stormino.trackdl.util.DownloadConstants;
import jakarta.annotation.PostConstruct;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Queues track downloads and runs them through the {@link DownloadOrchestrator}.
 * Terminal failures are always logged and recorded, whatever the notification mode.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadQueueService implements DownloadQueue.Listener {

    private final DownloadQueue queue;
    private final DownloadOrchestrator orchestrator;
    private final LogPort downloadLog;
    private final NotificationPort notifications;

    private final ConcurrentHashMap<String, QueueEntry> entries = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        queue.addListener(this);
        queue.setExecutor(this::runDownload);
    }

    /**
     * Queue a track download. Adding a track that is already waiting only raises its priority.
     *
     * @return Queue id of the download
     */
    public String addDownload(@NonNull DownloadTarget target, DownloadOptions options, int priority) {
        String id = target.getId();
        entries.putIfAbsent(id, new QueueEntry(target,
                options != null ? options : DownloadOptions.defaults(),
                new CancellationSignal()));

        queue.enqueue(id, target.getId(), EnqueueOptions.forTarget(target, priority));
        log.info("Added download: {} [{}] priority {}", target.getTitle(), id, priority);
        return id;
    }

    public String addDownload(@NonNull DownloadTarget target) {
        return addDownload(target, null, 0);
    }

    /**
     * Queue several tracks, e.g. a whole album, with the same options and priority.
     */
    public List<String> addDownloads(@NonNull List<? extends DownloadTarget> targets, DownloadOptions options,
                                     int priority) {
        List<String> ids = new ArrayList<>(targets.size());
        for (DownloadTarget target : targets) {
            ids.add(addDownload(target, options, priority));
        }
        return ids;
    }

    /**
     * Cancel a queued or running download.
     *
     * @return false if the id is unknown
     */
    public boolean cancel(@NonNull String id) {
        QueueEntry entry = entries.get(id);
        if (entry == null) {
            return false;
        }
        entry.getSignal().cancel();
        if (queue.remove(id)) {
            entries.remove(id);
        }
        log.info("Cancelled queued download {}", id);
        return true;
    }

    public QueueStatus getStatus() {
        return queue.getStatus();
    }

    public void pause() {
        queue.pause();
    }

    public void resume() {
        queue.resume();
    }

    public void restart() {
        queue.restart();
    }

    /**
     * Cancel everything and empty the queue.
     */
    public void stop() {
        entries.values().forEach(entry -> entry.getSignal().cancel());
        queue.stop();
        entries.clear();
    }

    public void clear() {
        entries.values().forEach(entry -> entry.getSignal().cancel());
        queue.clear();
        entries.clear();
    }

    void runDownload(String id) {
        QueueEntry entry = entries.get(id);
        if (entry == null) {
            throw new DownloadCancelledException("Download " + id + " is no longer queued");
        }

        CancellationSignal signal = CancellationSignal.linkedTo(entry.getSignal(), entry.getOptions().getSignal());
        DownloadOrchestratorResult result;
        try {
            result = orchestrator.downloadTrack(entry.getTarget(), entry.getOptions().toBuilder()
                    .signal(signal)
                    .build());
        } finally {
            signal.unlink();
        }

        if (result.isSuccess()) {
            return;
        }
        if (result.getErrorCode() == DownloadErrorCode.DOWNLOAD_CANCELLED) {
            entries.remove(id);
            throw new DownloadCancelledException(result.getError().getMessage());
        }
        throw new DownloadException(result.getError().getMessage(), result.getError().getCause());
    }

    @Override
    public void onStarted(QueuedDownload item) {
        log.info("Starting queued download: {} [{}]", item.getTrackTitle(), item.getId());
    }

    @Override
    public void onCompleted(QueuedDownload item) {
        entries.remove(item.getId());
        log.info("Queued download completed: {} [{}]", item.getTrackTitle(), item.getId());
    }

    @Override
    public void onRetry(QueuedDownload item, int attempt) {
        downloadLog.warning("Retrying " + describe(item) + " (attempt " + attempt + " of " + item.getMaxRetries() + ")");
    }

    @Override
    public void onFailed(QueuedDownload item, DownloadException error) {
        entries.remove(item.getId());
        log.error("Queued download failed permanently: {} [{}]: {}", describe(item), item.getId(), error.getMessage());
        downloadLog.error("Download failed after " + item.getRetryCount() + " attempts: " + describe(item)
                + ": " + error.getMessage());
        notifications.recordError(error, ErrorContext.builder()
                .component(DownloadConstants.QUEUE_COMPONENT)
                .source("queue")
                .severity(ErrorContext.Severity.HIGH)
                .build());
    }

    private static String describe(QueuedDownload item) {
        return item.getTrackTitle() != null ? item.getTrackTitle() : "track " + item.getTrackId();
    }

    @Value
    private static class QueueEntry {
        DownloadTarget target;
        DownloadOptions options;
        CancellationSignal signal;
    }
}
