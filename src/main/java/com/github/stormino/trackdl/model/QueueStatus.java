package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Point-in-time snapshot of the download queue.
 */
@Value
@Builder
public class QueueStatus {
    int queued;
    int running;

    /**
     * Executions still in flight on the worker pool.
     */
    int processing;

    /**
     * Items individually paused.
     */
    int pausedItems;

    /**
     * Whether dispatching is paused for the whole queue.
     */
    boolean queuePaused;
    List<QueuedDownload> queuedItems;
    List<AlbumGroup> albumGroups;
}
