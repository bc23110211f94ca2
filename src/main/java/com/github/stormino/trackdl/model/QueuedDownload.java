package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Entry of the download queue. Instances are owned by the queue and only mutated under its lock;
 * callers receive copies.
 */
@Data
@Builder(toBuilder = true)
public class QueuedDownload {

    private final String id;
    private final String trackId;

    private final String trackTitle;
    private final String artistName;
    private final String albumId;
    private final String albumTitle;

    private int priority;
    private int retryCount;
    private final int maxRetries;

    private String error;

    private final Instant enqueuedAt;

    /**
     * Tie-breaker for items enqueued within the same clock tick.
     */
    private final long sequence;

    private Instant lastAttemptAt;

    public QueuedDownload copy() {
        return toBuilder().build();
    }
}
