package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.config.DownloadProperties;
import com.github.stormino.trackdl.exception.DownloadException;
import com.github.stormino.trackdl.model.CancellationSignal;
import com.github.stormino.trackdl.model.DownloadAttempt;
import com.github.stormino.trackdl.model.DownloadError;
import com.github.stormino.trackdl.model.DownloadErrorCode;
import com.github.stormino.trackdl.model.DownloadOptions;
import com.github.stormino.trackdl.model.DownloadOrchestratorResult;
import com.github.stormino.trackdl.model.DownloadResult;
import com.github.stormino.trackdl.model.DownloadTarget;
import com.github.stormino.trackdl.model.ErrorContext;
import com.github.stormino.trackdl.model.ExecutionStrategyType;
import com.github.stormino.trackdl.model.NativeTrack;
import com.github.stormino.trackdl.model.NotificationMode;
import com.github.stormino.trackdl.model.ResolvedDownloadOptions;
import com.github.stormino.trackdl.model.StorageTarget;
import com.github.stormino.trackdl.model.TaskHandle;
import com.github.stormino.trackdl.model.TaskMeta;
import com.github.stormino.trackdl.port.LogPort;
import com.github.stormino.trackdl.port.NotificationPort;
import com.github.stormino.trackdl.port.UiTaskPort;
import com.github.stormino.trackdl.service.progress.ProgressTracker;
import com.github.stormino.trackdl.service.strategy.DownloadExecutionRequest;
import com.github.stormino.trackdl.service.strategy.DownloadExecutionStrategy;
import com.github.stormino.trackdl.util.DownloadConstants;
import com.github.stormino.trackdl.util.TrackFilenames;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Entry point for single-track downloads: resolves the target, creates the UI task,
 * runs the selected execution strategy and reports the classified outcome.
 */
@Slf4j
@Service
public class DownloadOrchestrator {

    static final String ATTEMPT_NOT_FOUND_MESSAGE =
            "Cannot retry: original download attempt not found. This may happen if too much time has passed.";

    private final DownloadOptionsResolver optionsResolver;
    private final TrackResolver trackResolver;
    private final DownloadErrorClassifier errorClassifier;
    private final UiTaskPort ui;
    private final LogPort downloadLog;
    private final NotificationPort notifications;
    private final Map<ExecutionStrategyType, DownloadExecutionStrategy> strategies = new EnumMap<>(ExecutionStrategyType.class);
    private final DownloadAttemptStore attempts;
    private final Executor trackExecutor;
    private final double downloadWeight;

    // Cancellation signals of attempts currently executing
    private final Map<String, CancellationSignal> activeControllers = new ConcurrentHashMap<>();

    public DownloadOrchestrator(DownloadOptionsResolver optionsResolver,
                                TrackResolver trackResolver,
                                DownloadErrorClassifier errorClassifier,
                                UiTaskPort ui,
                                LogPort downloadLog,
                                NotificationPort notifications,
                                List<DownloadExecutionStrategy> strategies,
                                DownloadProperties properties,
                                @Qualifier("trackExecutor") Executor trackExecutor) {
        this.optionsResolver = optionsResolver;
        this.trackResolver = trackResolver;
        this.errorClassifier = errorClassifier;
        this.ui = ui;
        this.downloadLog = downloadLog;
        this.notifications = notifications;
        this.attempts = new DownloadAttemptStore(properties.getOrchestrator().getMaxStoredAttempts());
        this.trackExecutor = trackExecutor;
        this.downloadWeight = properties.getOrchestrator().getDownloadWeight();

        for (DownloadExecutionStrategy strategy : strategies) {
            this.strategies.put(strategy.getType(), strategy);
        }
        log.debug("Registered execution strategies: {}", this.strategies.keySet());
    }

    /**
     * Download one track.
     *
     * @param target Native track or foreign reference
     * @param options Caller options, null for preference defaults
     * @return Outcome; failures after the UI task was created carry its task id
     */
    public DownloadOrchestratorResult downloadTrack(@NonNull DownloadTarget target, DownloadOptions options) {
        ResolvedDownloadOptions resolved = optionsResolver.resolve(
                options != null ? options : DownloadOptions.defaults());
        NotificationMode mode = resolved.getNotificationMode();

        // 1. Resolve the target, no UI task exists yet
        TrackResolution resolution = trackResolver.resolve(target, resolved.isAutoResolveForeign());
        if (!resolution.isSuccess()) {
            DownloadError error = resolution.getError();
            log.warn("Could not resolve target {}: {}", target.getId(), error.getMessage());
            downloadLog.error("Could not resolve \"" + describe(target) + "\": " + error.getMessage());
            showNotification(NotificationPort.Kind.ERROR, error.getMessage(), mode, error.getCause(), null);
            return DownloadOrchestratorResult.failure(error);
        }

        NativeTrack track = resolution.getTrack();
        if (resolution.isConverted()) {
            showNotification(NotificationPort.Kind.SUCCESS,
                    "Converted \"" + describe(target) + "\" to the catalog", mode, null, null);
        }

        // 2. Filename and UI task
        String filename = TrackFilenames.buildDownloadFilename(
                track, resolved.getQuality(), resolved.isEffectiveConvertAacToMp3());
        TaskHandle handle = ui.beginTask(track, filename, TaskMeta.builder()
                .subtitle(resolved.getSubtitle())
                .storage(resolved.getStorage())
                .build());
        String taskId = handle.getTaskId();

        // 3. Store the attempt before anything can fail
        attempts.put(taskId, new DownloadAttempt(target, resolved.toOptions(), Instant.now()));

        CancellationSignal linked = resolved.getSignal() != null
                ? CancellationSignal.linkedTo(handle.getController(), resolved.getSignal())
                : null;
        CancellationSignal signal = linked != null ? linked : handle.getController();
        activeControllers.put(taskId, signal);

        log.info("Starting download of {} as {} (task {}, {} via {})",
                track.getId(), filename, taskId, resolved.getStorage(), resolved.getStrategy());

        try {
            DownloadResult result = execute(track, filename, resolved, taskId, signal);

            if (signal.isCancelled() || result.isCancelled() || errorClassifier.isCancellation(result.getCause())) {
                return handleCancelled(taskId, filename);
            }
            if (result.isSuccess()) {
                return handleSuccess(taskId, filename, resolved, result);
            }
            return handleFailure(taskId, filename, mode, result);

        } finally {
            activeControllers.remove(taskId);
            if (linked != null) {
                linked.unlink();
            }
        }
    }

    public DownloadOrchestratorResult downloadTrack(@NonNull DownloadTarget target) {
        return downloadTrack(target, null);
    }

    /**
     * Run {@link #downloadTrack(DownloadTarget, DownloadOptions)} on the track executor.
     */
    public CompletableFuture<DownloadOrchestratorResult> downloadTrackAsync(@NonNull DownloadTarget target,
                                                                           DownloadOptions options) {
        return CompletableFuture.supplyAsync(() -> downloadTrack(target, options), trackExecutor);
    }

    /**
     * Replay a stored attempt with its original target and the options as they were resolved
     * then. Preference changes made since do not apply.
     *
     * @param taskId Task id of the original attempt
     * @return Outcome of the new attempt, which has its own task id
     */
    public DownloadOrchestratorResult retryDownload(@NonNull String taskId) {
        return attempts.get(taskId)
                .map(attempt -> {
                    log.info("Retrying download of task {}", taskId);
                    return downloadTrack(attempt.getTarget(), attempt.getOptions());
                })
                .orElseGet(() -> {
                    log.warn("No stored attempt for task {}", taskId);
                    return DownloadOrchestratorResult.failure(
                            DownloadError.of(DownloadErrorCode.UNKNOWN_ERROR, ATTEMPT_NOT_FOUND_MESSAGE));
                });
    }

    /**
     * Signal cancellation of a running attempt. Unknown or finished tasks are ignored.
     */
    public void cancelDownload(@NonNull String taskId) {
        CancellationSignal signal = activeControllers.get(taskId);
        if (signal != null && signal.cancel()) {
            log.info("Cancellation requested for task {}", taskId);
        }
        ui.cancelTask(taskId);
    }

    public void clearAttempts() {
        attempts.clear();
    }

    public int getStoredAttemptCount() {
        return attempts.size();
    }

    private DownloadResult execute(NativeTrack track, String filename, ResolvedDownloadOptions resolved,
                                   String taskId, CancellationSignal signal) {
        DownloadExecutionStrategy strategy = strategies.get(resolved.getStrategy());
        if (strategy == null) {
            return DownloadResult.failure("No execution strategy registered for " + resolved.getStrategy());
        }

        ProgressTracker tracker = new ProgressTracker(taskId, resolved.getStorage(), ui, downloadWeight, signal);
        DownloadExecutionRequest request = DownloadExecutionRequest.builder()
                .track(track)
                .quality(resolved.getQuality())
                .filename(filename)
                .storage(resolved.getStorage())
                .convertAacToMp3(resolved.isEffectiveConvertAacToMp3())
                .downloadCoversSeparately(resolved.isDownloadCoversSeparately())
                .conflictResolution(resolved.getConflictResolution())
                .signal(signal)
                .onProgress(tracker)
                .build();

        try {
            DownloadResult result = strategy.execute(request);
            return result != null ? result : DownloadResult.failure("Download failed");
        } catch (RuntimeException e) {
            return DownloadResult.failure(e.getMessage(), e);
        }
    }

    private DownloadOrchestratorResult handleSuccess(String taskId, String filename,
                                                     ResolvedDownloadOptions resolved, DownloadResult result) {
        ui.completeTask(taskId);

        String savedAs = result.hasMetadata(DownloadResult.FILENAME)
                ? result.<String>getMetadata(DownloadResult.FILENAME)
                : filename;
        String message = resolved.getStorage() == StorageTarget.SERVER
                ? "Saved to server: " + savedAs
                : "Downloaded: " + savedAs;
        if (result.getMessage() != null && !result.getMessage().isBlank()) {
            message = message + " (" + result.getMessage() + ")";
        }

        log.info("Task {} completed: {}", taskId, message);
        downloadLog.success(message);
        showNotification(NotificationPort.Kind.SUCCESS, message, resolved.getNotificationMode(), null, taskId);
        return DownloadOrchestratorResult.success(savedAs, taskId);
    }

    private DownloadOrchestratorResult handleCancelled(String taskId, String filename) {
        log.info("Task {} cancelled ({})", taskId, filename);
        ui.completeTask(taskId);
        downloadLog.log("Download cancelled: " + filename);
        return DownloadOrchestratorResult.failure(
                DownloadError.of(DownloadErrorCode.DOWNLOAD_CANCELLED, CancellationSignal.DEFAULT_REASON),
                taskId);
    }

    private DownloadOrchestratorResult handleFailure(String taskId, String filename, NotificationMode mode,
                                                     DownloadResult result) {
        Object rawError = result.getCause() != null ? result.getCause() : result.getErrorMessage();
        DownloadError error = errorClassifier.classify(rawError);
        if (error.getCause() == null && result.getCause() != null) {
            error = error.toBuilder().cause(result.getCause()).build();
        }

        log.error("Task {} failed with {}: {}", taskId, error.getCode(), error.getMessage(), result.getCause());
        ui.errorTask(taskId, error.getMessage());
        downloadLog.error("Download failed: " + filename + ": " + error.getMessage());
        showNotification(NotificationPort.Kind.ERROR, error.getMessage(), mode, error.getCause(), taskId);
        return DownloadOrchestratorResult.failure(error, taskId);
    }

    /**
     * ALERT surfaces errors only, TOAST surfaces everything, SILENT surfaces nothing.
     * Errors are recorded in every mode.
     */
    private void showNotification(NotificationPort.Kind kind, String message, NotificationMode mode,
                                  Throwable cause, String taskId) {
        try {
            boolean error = kind == NotificationPort.Kind.ERROR;
            if (mode == NotificationMode.TOAST || (mode == NotificationMode.ALERT && error)) {
                notifications.notify(kind, message);
            }
            if (error) {
                notifications.recordError(cause != null ? cause : new DownloadException(message),
                        ErrorContext.builder()
                                .component(DownloadConstants.ORCHESTRATOR_COMPONENT)
                                .source("notification")
                                .severity(ErrorContext.Severity.MEDIUM)
                                .taskId(taskId)
                                .build());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to deliver {} notification: {}", kind, e.getMessage(), e);
        }
    }

    private static String describe(DownloadTarget target) {
        return target.getTitle() != null ? target.getTitle() : target.getId();
    }
}
