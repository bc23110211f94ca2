package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.model.DownloadProgress;
import com.github.stormino.trackdl.model.DownloadStatus;
import com.github.stormino.trackdl.model.DownloadTask;
import com.github.stormino.trackdl.model.ProgressUpdate;
import com.github.stormino.trackdl.model.StorageTarget;
import com.github.stormino.trackdl.model.TaskHandle;
import com.github.stormino.trackdl.model.TaskMeta;
import com.github.stormino.trackdl.service.state.DownloadStateMachine;
import com.github.stormino.trackdl.testsupport.TestTracks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DownloadTaskRegistry")
class DownloadTaskRegistryTest {

    private DownloadTaskRegistry registry;
    private List<ProgressUpdate> updates;
    private String taskId;

    @BeforeEach
    void setUp() {
        registry = new DownloadTaskRegistry(new DownloadStateMachine());
        updates = new ArrayList<>();
        registry.registerListener(updates::add);
        TaskHandle handle = registry.beginTask(TestTracks.nativeTrack("1"), "song.flac",
                TaskMeta.builder().subtitle("Album").storage(StorageTarget.CLIENT).build());
        taskId = handle.getTaskId();
    }

    private DownloadTask task() {
        return registry.getTask(taskId).orElseThrow();
    }

    @Nested
    @DisplayName("progress")
    class ProgressTests {

        @Test
        @DisplayName("new tasks are queued and announced")
        void beginTask() {
            assertEquals(DownloadStatus.QUEUED, task().getStatus());
            assertEquals("Artist - Song 1", task().getDisplayName());
            assertEquals("Album", task().getSubtitle());
            assertEquals("Queued", updates.get(0).getMessage());
            assertEquals(task().getFilename(), updates.get(0).getFilename());
        }

        @Test
        @DisplayName("byte progress never moves backwards")
        void byteProgress() {
            registry.updateProgress(taskId, 500, 1000L);
            registry.updateProgress(taskId, 200, 1000L);

            assertEquals(0.5, task().getProgress(), 1e-9);
            assertEquals(200L, task().getReceivedBytes());
        }

        @Test
        @DisplayName("phases move the status")
        void phases() {
            registry.updatePhase(taskId, DownloadProgress.Stage.DOWNLOADING);
            registry.updatePhase(taskId, DownloadProgress.Stage.EMBEDDING);

            assertEquals(DownloadStatus.EMBEDDING, task().getStatus());
            assertEquals("Embedding metadata", updates.get(updates.size() - 1).getMessage());
        }

        @Test
        @DisplayName("stage fraction is clamped")
        void stage() {
            registry.updateStage(taskId, 1.5);

            assertEquals(1.0, task().getProgress(), 1e-9);
        }
    }

    @Nested
    @DisplayName("finishing")
    class FinishTests {

        @Test
        @DisplayName("completion sets full progress and completion time")
        void complete() {
            registry.completeTask(taskId);

            assertEquals(DownloadStatus.COMPLETED, task().getStatus());
            assertEquals(1.0, task().getProgress(), 1e-9);
            assertNotNull(task().getCompletedAt());
        }

        @Test
        @DisplayName("error keeps the message")
        void error() {
            registry.errorTask(taskId, "Failed to fetch");

            assertTrue(task().isFailed());
            assertEquals("Failed to fetch", task().getErrorMessage());
            assertEquals("Failed to fetch", updates.get(updates.size() - 1).getMessage());
        }

        @Test
        @DisplayName("cancel signals the task controller")
        void cancel() {
            registry.cancelTask(taskId);

            assertEquals(DownloadStatus.CANCELLED, task().getStatus());
            assertTrue(task().getController().isCancelled());
        }

        @Test
        @DisplayName("finished tasks ignore further updates")
        void terminalIsFinal() {
            registry.cancelTask(taskId);
            int before = updates.size();

            registry.completeTask(taskId);
            registry.updateStage(taskId, 0.7);
            registry.updatePhase(taskId, DownloadProgress.Stage.UPLOADING);

            assertEquals(DownloadStatus.CANCELLED, task().getStatus());
            assertEquals(before, updates.size());
        }

        @Test
        @DisplayName("clearFinished removes only terminal tasks")
        void clearFinished() {
            String other = registry.beginTask(TestTracks.nativeTrack("2"), "other.flac", null).getTaskId();
            registry.completeTask(taskId);

            assertEquals(1, registry.clearFinished());
            assertTrue(registry.getTask(taskId).isEmpty());
            assertEquals(1, registry.getAllTasks().size());
            assertEquals(other, registry.getAllTasks().get(0).getId());
        }
    }

    @Test
    @DisplayName("oldest finished tasks are dropped past the limit, active tasks stay")
    void boundedFinishedTasks() {
        DownloadTaskRegistry bounded = new DownloadTaskRegistry(new DownloadStateMachine(), 2);
        String active = bounded.beginTask(TestTracks.nativeTrack("0"), "active.flac", null).getTaskId();
        List<String> finished = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            String id = bounded.beginTask(TestTracks.nativeTrack(String.valueOf(i)), "song.flac", null).getTaskId();
            if (i % 2 == 0) {
                bounded.errorTask(id, "Failed to fetch");
            } else {
                bounded.completeTask(id);
            }
            finished.add(id);
        }

        assertEquals(3, bounded.getAllTasks().size());
        assertTrue(bounded.getTask(active).isPresent());
        assertTrue(bounded.getTask(finished.get(0)).isEmpty());
        assertTrue(bounded.getTask(finished.get(1)).isEmpty());
        assertTrue(bounded.getTask(finished.get(2)).isPresent());
        assertTrue(bounded.getTask(finished.get(3)).isPresent());
    }

    @Test
    @DisplayName("a cleared registry starts counting finished tasks again")
    void clearResetsFinishedCount() {
        DownloadTaskRegistry bounded = new DownloadTaskRegistry(new DownloadStateMachine(), 1);
        bounded.completeTask(bounded.beginTask(TestTracks.nativeTrack("1"), "a.flac", null).getTaskId());
        assertEquals(1, bounded.clearFinished());

        String kept = bounded.beginTask(TestTracks.nativeTrack("2"), "b.flac", null).getTaskId();
        bounded.completeTask(kept);

        assertTrue(bounded.getTask(kept).isPresent());
    }

    @Test
    @DisplayName("unknown task ids are ignored")
    void unknownTask() {
        assertDoesNotThrow(() -> {
            registry.updateProgress("nope", 1, 2L);
            registry.completeTask("nope");
            registry.cancelTask("nope");
        });
    }

    @Test
    @DisplayName("a failing listener does not stop others")
    void listenerIsolation() {
        registry.registerListener(update -> {
            throw new IllegalStateException("listener broke");
        });
        List<ProgressUpdate> late = new ArrayList<>();
        registry.registerListener(late::add);

        registry.updateStage(taskId, 0.2);

        assertEquals(1, late.size());
    }
}
