package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.model.DownloadProgress;
import com.github.stormino.trackdl.model.DownloadStatus;
import com.github.stormino.trackdl.model.DownloadTarget;
import com.github.stormino.trackdl.model.DownloadTask;
import com.github.stormino.trackdl.model.ProgressUpdate;
import com.github.stormino.trackdl.model.TaskHandle;
import com.github.stormino.trackdl.model.TaskMeta;
import com.github.stormino.trackdl.port.UiTaskPort;
import com.github.stormino.trackdl.service.state.DownloadStateMachine;
import com.github.stormino.trackdl.util.DownloadConstants;
import com.github.stormino.trackdl.util.ProgressCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * In-memory task store backing the download UI. Every change is broadcast to registered
 * listeners as a {@link ProgressUpdate}. Finished tasks beyond the configured limit are
 * dropped oldest first; active tasks are never dropped.
 */
@Slf4j
@Service
public class DownloadTaskRegistry implements UiTaskPort {

    private final DownloadStateMachine stateMachine;
    private final int maxFinishedTasks;

    private final ConcurrentHashMap<String, DownloadTask> tasks = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> finishedOrder = new ConcurrentLinkedQueue<>();
    private final CopyOnWriteArrayList<Consumer<ProgressUpdate>> listeners = new CopyOnWriteArrayList<>();

    @Autowired
    public DownloadTaskRegistry(DownloadStateMachine stateMachine) {
        this(stateMachine, DownloadConstants.MAX_FINISHED_TASKS);
    }

    DownloadTaskRegistry(DownloadStateMachine stateMachine, int maxFinishedTasks) {
        if (maxFinishedTasks < 1) {
            throw new IllegalArgumentException("maxFinishedTasks must be positive: " + maxFinishedTasks);
        }
        this.stateMachine = stateMachine;
        this.maxFinishedTasks = maxFinishedTasks;
    }

    @Override
    public TaskHandle beginTask(DownloadTarget target, String filename, TaskMeta meta) {
        DownloadTask task = DownloadTask.builder()
                .targetId(target.getId())
                .title(target.getTitle())
                .artistName(target.getArtistName())
                .filename(filename)
                .subtitle(meta != null ? meta.getSubtitle() : null)
                .storage(meta != null ? meta.getStorage() : null)
                .build();
        tasks.put(task.getId(), task);

        log.info("Added download task: {} [{}]", task.getDisplayName(), task.getId());
        broadcast(task, "Queued");
        return new TaskHandle(task.getId(), task.getController());
    }

    @Override
    public void updateProgress(String taskId, long receivedBytes, Long totalBytes) {
        withActiveTask(taskId, task -> {
            task.setReceivedBytes(receivedBytes);
            task.setTotalBytes(totalBytes);
            if (totalBytes != null && totalBytes > 0) {
                task.setProgress(Math.max(task.getProgress(),
                        ProgressCalculator.clampFraction((double) receivedBytes / totalBytes)));
            }
            broadcast(task, null);
        });
    }

    @Override
    public void updatePhase(String taskId, DownloadProgress.Stage phase) {
        withActiveTask(taskId, task -> {
            DownloadStatus next = stateMachine.transition(taskId, task.getStatus(), DownloadStatus.forStage(phase));
            if (next != task.getStatus()) {
                task.setStatus(next);
                broadcast(task, next.getDisplayName());
            }
        });
    }

    @Override
    public void updateStage(String taskId, double progress) {
        withActiveTask(taskId, task -> {
            task.setProgress(ProgressCalculator.clampFraction(progress));
            broadcast(task, null);
        });
    }

    @Override
    public void completeTask(String taskId) {
        finish(taskId, DownloadStatus.COMPLETED, null);
    }

    @Override
    public void errorTask(String taskId, String message) {
        finish(taskId, DownloadStatus.FAILED, message);
    }

    @Override
    public void cancelTask(String taskId) {
        DownloadTask task = tasks.get(taskId);
        if (task != null && finish(taskId, DownloadStatus.CANCELLED, null)) {
            task.getController().cancel();
        }
    }

    public Optional<DownloadTask> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public List<DownloadTask> getAllTasks() {
        return tasks.values().stream()
                .sorted(Comparator.comparing(DownloadTask::getCreatedAt))
                .collect(Collectors.toList());
    }

    /**
     * Remove completed, failed and cancelled tasks.
     *
     * @return Number of removed tasks
     */
    public int clearFinished() {
        List<String> finished = new ArrayList<>();
        tasks.forEach((id, task) -> {
            if (stateMachine.isTerminalState(task.getStatus())) {
                finished.add(id);
            }
        });
        finished.forEach(tasks::remove);
        finishedOrder.removeAll(finished);
        return finished.size();
    }

    public void registerListener(Consumer<ProgressUpdate> listener) {
        listeners.add(listener);
        log.debug("Task listener registered. Total: {}", listeners.size());
    }

    public void unregisterListener(Consumer<ProgressUpdate> listener) {
        listeners.remove(listener);
    }

    private boolean finish(String taskId, DownloadStatus status, String errorMessage) {
        DownloadTask task = tasks.get(taskId);
        if (task == null) {
            return false;
        }
        synchronized (task) {
            DownloadStatus next = stateMachine.transition(taskId, task.getStatus(), status);
            if (next != status || task.getStatus() == status) {
                return false;
            }
            task.setStatus(next);
            task.setCompletedAt(LocalDateTime.now());
            if (status == DownloadStatus.COMPLETED) {
                task.setProgress(1.0);
            }
            if (errorMessage != null) {
                task.setErrorMessage(errorMessage);
            }
        }

        log.info("Task {} {}: {}", taskId, status.getDisplayName().toLowerCase(), task.getDisplayName());
        broadcast(task, errorMessage != null ? errorMessage : status.getDisplayName());
        finishedOrder.add(taskId);
        evictFinished();
        return true;
    }

    private void evictFinished() {
        while (finishedOrder.size() > maxFinishedTasks) {
            String oldest = finishedOrder.poll();
            if (oldest == null) {
                return;
            }
            tasks.remove(oldest);
            log.debug("Dropped finished task {}", oldest);
        }
    }

    private void withActiveTask(String taskId, Consumer<DownloadTask> update) {
        DownloadTask task = tasks.get(taskId);
        if (task == null) {
            return;
        }
        synchronized (task) {
            if (stateMachine.isTerminalState(task.getStatus())) {
                return;
            }
            update.accept(task);
        }
    }

    private void broadcast(DownloadTask task, String message) {
        ProgressUpdate update = ProgressUpdate.forTask(task, message);
        for (Consumer<ProgressUpdate> listener : listeners) {
            try {
                listener.accept(update);
            } catch (Exception e) {
                log.error("Error in task listener: {}", e.getMessage(), e);
            }
        }
    }
}
