package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.config.DownloadProperties;
import com.github.stormino.trackdl.exception.DownloadCancelledException;
import com.github.stormino.trackdl.exception.DownloadException;
import com.github.stormino.trackdl.model.AlbumGroup;
import com.github.stormino.trackdl.model.EnqueueOptions;
import com.github.stormino.trackdl.model.QueueStatus;
import com.github.stormino.trackdl.model.QueuedDownload;
import com.github.stormino.trackdl.util.DownloadConstants;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Priority queue of pending downloads with bounded concurrency and retries.
 * <p>
 * Items move {@code queued -> running -> completed | queued (retry) | failed}. Dispatch picks the
 * highest priority first, then the earliest enqueue time, which retried items keep. Work runs on
 * the given worker pool through the executor hook set with {@link #setExecutor}.
 * <p>
 * All state is guarded by this instance's monitor. Listeners are called while it is held and
 * must not block.
 */
@Slf4j
public class DownloadQueue {

    private static final Comparator<QueuedDownload> DISPATCH_ORDER =
            Comparator.comparingInt(QueuedDownload::getPriority).reversed()
                    .thenComparing(QueuedDownload::getEnqueuedAt)
                    .thenComparingLong(QueuedDownload::getSequence);

    private final int maxConcurrent;
    private final int maxRetries;
    private final boolean autoRetryFailures;
    private final ExecutorService workers;
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    private final Map<String, QueuedDownload> queue = new LinkedHashMap<>();
    private final Set<String> running = new HashSet<>();
    private final Set<String> pausedItems = new HashSet<>();
    private final Map<String, InFlight> processing = new HashMap<>();

    private QueueExecutor executor;
    private boolean paused = false;
    private boolean shutdown = false;
    private long sequence = 0;
    private long runCounter = 0;

    public DownloadQueue(@NonNull DownloadProperties.Queue config, @NonNull ExecutorService workers) {
        this.maxConcurrent = config.getMaxConcurrent();
        this.maxRetries = config.getMaxRetries();
        this.autoRetryFailures = config.isAutoRetryFailures();
        this.workers = workers;
    }

    /**
     * Work performed for one queued item. Returning normally completes the item; throwing
     * a cancellation drops it; any other exception counts as a failed attempt.
     */
    @FunctionalInterface
    public interface QueueExecutor {
        void execute(String downloadId) throws Exception;
    }

    /**
     * Lifecycle callbacks. Items passed in are copies.
     */
    public interface Listener {
        default void onStarted(QueuedDownload item) {
        }

        default void onCompleted(QueuedDownload item) {
        }

        default void onFailed(QueuedDownload item, DownloadException error) {
        }

        default void onRetry(QueuedDownload item, int attempt) {
        }
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    /**
     * Set the hook that processes items and start dispatching.
     */
    public synchronized void setExecutor(QueueExecutor executor) {
        this.executor = executor;
        processQueue();
    }

    /**
     * Queue a download. Re-enqueueing a waiting id raises its priority to the maximum of both;
     * a running id is left untouched.
     */
    public synchronized void enqueue(@NonNull String id, @NonNull String trackId, EnqueueOptions options) {
        EnqueueOptions opts = options != null ? options : EnqueueOptions.defaults();

        QueuedDownload existing = queue.get(id);
        if (existing != null) {
            if (!running.contains(id)) {
                existing.setPriority(Math.max(existing.getPriority(), opts.getPriority()));
                log.debug("Download {} already queued, priority now {}", id, existing.getPriority());
            }
            return;
        }

        QueuedDownload item = QueuedDownload.builder()
                .id(id)
                .trackId(trackId)
                .trackTitle(opts.getTrackTitle())
                .artistName(opts.getArtistName())
                .albumId(opts.getAlbumId())
                .albumTitle(opts.getAlbumTitle())
                .priority(opts.getPriority())
                .retryCount(0)
                .maxRetries(opts.getMaxRetries() != null ? opts.getMaxRetries() : maxRetries)
                .enqueuedAt(Instant.now())
                .sequence(++sequence)
                .build();
        queue.put(id, item);
        log.debug("Queued download {} (track {}, priority {})", id, trackId, item.getPriority());

        processQueue();
    }

    public void enqueue(String id, String trackId) {
        enqueue(id, trackId, null);
    }

    /**
     * Record a failed attempt. The item is retried while its retry count stays below its
     * maximum; otherwise listeners get exactly one failure callback and the item is removed.
     */
    public synchronized void requeueFailed(@NonNull String id, String error) {
        QueuedDownload item = queue.get(id);
        if (item == null) {
            return;
        }

        item.setError(error);
        item.setLastAttemptAt(Instant.now());
        item.setRetryCount(item.getRetryCount() + 1);
        running.remove(id);
        processing.remove(id);

        if (item.getRetryCount() < item.getMaxRetries()) {
            log.warn("Download {} failed (attempt {}/{}), retrying: {}",
                    id, item.getRetryCount(), item.getMaxRetries(), error);
            QueuedDownload snapshot = item.copy();
            fire(listener -> listener.onRetry(snapshot, snapshot.getRetryCount()));
        } else {
            log.error("Download {} failed after {} attempts: {}", id, item.getRetryCount(), error);
            queue.remove(id);
            pausedItems.remove(id);
            QueuedDownload snapshot = item.copy();
            DownloadException failure = new DownloadException(error != null ? error : "Download failed");
            fire(listener -> listener.onFailed(snapshot, failure));
            notifyAll();
        }

        processQueue();
    }

    public synchronized void markCompleted(@NonNull String id) {
        QueuedDownload item = queue.remove(id);
        if (item == null) {
            return;
        }
        running.remove(id);
        processing.remove(id);
        pausedItems.remove(id);

        log.debug("Download {} completed", id);
        QueuedDownload snapshot = item.copy();
        fire(listener -> listener.onCompleted(snapshot));
        notifyAll();

        processQueue();
    }

    /**
     * Start waiting items until the concurrency limit is reached.
     */
    public synchronized void processQueue() {
        if (executor == null || paused || shutdown) {
            return;
        }

        while (running.size() < maxConcurrent) {
            Optional<QueuedDownload> next = queue.values().stream()
                    .filter(item -> !running.contains(item.getId()) && !pausedItems.contains(item.getId()))
                    .min(DISPATCH_ORDER);
            if (next.isEmpty()) {
                break;
            }

            QueuedDownload item = next.get();
            running.add(item.getId());
            QueuedDownload snapshot = item.copy();
            fire(listener -> listener.onStarted(snapshot));

            if (!dispatch(item.getId())) {
                break;
            }
        }
    }

    private boolean dispatch(String id) {
        long runId = ++runCounter;
        QueueExecutor hook = executor;
        try {
            Future<?> future = workers.submit(() -> run(id, runId, hook));
            processing.put(id, new InFlight(runId, future));
            return true;
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected download {}: {}", id, e.getMessage());
            running.remove(id);
            return false;
        }
    }

    private void run(String id, long runId, QueueExecutor hook) {
        Exception failure = null;
        try {
            hook.execute(id);
        } catch (Exception e) {
            failure = e;
        }
        onExecutionFinished(id, runId, failure);
    }

    private synchronized void onExecutionFinished(String id, long runId, Exception failure) {
        InFlight current = processing.get(id);
        if (current == null || current.getRunId() != runId) {
            // Stopped, cleared or already settled by the caller
            log.debug("Ignoring result of stale run {} for download {}", runId, id);
            return;
        }
        processing.remove(id);

        if (failure == null) {
            markCompleted(id);
            return;
        }

        if (isCancellation(failure)) {
            log.info("Download {} was cancelled, removing it from the queue", id);
            queue.remove(id);
            running.remove(id);
            pausedItems.remove(id);
            notifyAll();
            processQueue();
            return;
        }

        if (autoRetryFailures) {
            requeueFailed(id, failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName());
        } else {
            log.warn("Download {} failed, waiting for the caller to requeue it: {}", id, failure.getMessage());
        }
    }

    /**
     * Stop dispatching new items. Running items continue.
     */
    public synchronized void pause() {
        paused = true;
        log.info("Download queue paused");
    }

    public synchronized void resume() {
        if (!paused) {
            return;
        }
        paused = false;
        log.info("Download queue resumed");
        processQueue();
    }

    /**
     * Pause the queue, cancel in-flight work and drop every item. Results of the cancelled
     * work are ignored.
     */
    public synchronized void stop() {
        paused = true;
        cancelInFlight();
        queue.clear();
        running.clear();
        pausedItems.clear();
        notifyAll();
        log.info("Download queue stopped");
    }

    /**
     * Clear item-level pauses and resume dispatching.
     */
    public synchronized void restart() {
        pausedItems.clear();
        paused = false;
        log.info("Download queue restarted");
        processQueue();
    }

    /**
     * Drop every item and cancel in-flight work without changing the paused state.
     */
    public synchronized void clear() {
        cancelInFlight();
        queue.clear();
        running.clear();
        notifyAll();
    }

    /**
     * Remove a waiting item. Running items are left alone.
     *
     * @return true if the item was removed
     */
    public synchronized boolean remove(String id) {
        if (running.contains(id) || queue.remove(id) == null) {
            return false;
        }
        pausedItems.remove(id);
        notifyAll();
        return true;
    }

    public synchronized boolean pauseItem(String id) {
        if (!queue.containsKey(id)) {
            return false;
        }
        return pausedItems.add(id);
    }

    public synchronized boolean resumeItem(String id) {
        if (!pausedItems.remove(id)) {
            return false;
        }
        processQueue();
        return true;
    }

    /**
     * Block until the item has left the queue.
     *
     * @throws TimeoutException if it is still queued or running after {@code timeoutMs}
     */
    public synchronized void waitFor(String id, long timeoutMs) throws InterruptedException, TimeoutException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (queue.containsKey(id) || running.contains(id)) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                throw new TimeoutException("Download timeout: " + id);
            }
            wait(Math.min(remaining, DownloadConstants.WAIT_POLL_INTERVAL_MS));
        }
    }

    public void waitFor(String id) throws InterruptedException, TimeoutException {
        waitFor(id, DownloadConstants.DEFAULT_WAIT_TIMEOUT_MS);
    }

    public synchronized boolean contains(String id) {
        return queue.containsKey(id);
    }

    public synchronized boolean isRunning(String id) {
        return running.contains(id);
    }

    public synchronized QueueStatus getStatus() {
        List<QueuedDownload> items = queue.values().stream()
                .map(QueuedDownload::copy)
                .collect(Collectors.toList());

        Map<String, List<QueuedDownload>> byAlbum = new LinkedHashMap<>();
        for (QueuedDownload item : items) {
            String key = item.getAlbumId() != null && !item.getAlbumId().isBlank()
                    ? item.getAlbumId()
                    : DownloadConstants.UNGROUPED_ALBUM_KEY;
            byAlbum.computeIfAbsent(key, k -> new ArrayList<>()).add(item);
        }

        List<AlbumGroup> groups = byAlbum.entrySet().stream()
                .map(entry -> {
                    QueuedDownload first = entry.getValue().get(0);
                    return new AlbumGroup(
                            entry.getKey(),
                            orDefault(first.getAlbumTitle(), DownloadConstants.UNKNOWN_ALBUM),
                            orDefault(first.getArtistName(), DownloadConstants.UNKNOWN_ARTIST),
                            List.copyOf(entry.getValue()));
                })
                .collect(Collectors.toList());

        return QueueStatus.builder()
                .queued(queue.size())
                .running(running.size())
                .processing(processing.size())
                .pausedItems(pausedItems.size())
                .queuePaused(paused)
                .queuedItems(items)
                .albumGroups(groups)
                .build();
    }

    /**
     * Stop the queue and terminate the worker pool.
     */
    public void shutdown() {
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
        }
        stop();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Download queue workers did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void cancelInFlight() {
        processing.values().forEach(inFlight -> inFlight.getFuture().cancel(true));
        processing.clear();
    }

    private void fire(Consumer<Listener> callback) {
        for (Listener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (Exception e) {
                log.error("Queue listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private static boolean isCancellation(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof DownloadCancelledException
                    || current instanceof CancellationException
                    || current instanceof InterruptedException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    @Value
    private static class InFlight {
        long runId;
        Future<?> future;
    }
}
