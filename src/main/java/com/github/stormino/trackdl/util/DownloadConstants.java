package com.github.stormino.trackdl.util;

/**
 * Constants used throughout the download system.
 */
public final class DownloadConstants {

    private DownloadConstants() {
        // Utility class, no instantiation
    }

    // ========== Attempts ==========

    /**
     * Default number of stored download attempts kept for retry.
     */
    public static final int MAX_STORED_ATTEMPTS = 50;

    /**
     * Share of stored attempts evicted when the limit is exceeded.
     */
    public static final double ATTEMPT_EVICTION_RATIO = 0.25;

    // ========== Tasks ==========

    /**
     * Finished tasks kept in the task registry before the oldest are dropped.
     */
    public static final int MAX_FINISHED_TASKS = 200;

    // ========== Progress ==========

    /**
     * Weight of the download phase in server-side progress.
     */
    public static final double DEFAULT_DOWNLOAD_WEIGHT = 0.55;

    // ========== Queue ==========

    public static final int DEFAULT_MAX_CONCURRENT = 4;

    public static final int DEFAULT_MAX_RETRIES = 3;

    /**
     * Grouping key for queued items without an album.
     */
    public static final String UNGROUPED_ALBUM_KEY = "ungrouped";

    public static final String UNKNOWN_ALBUM = "Unknown Album";

    public static final String UNKNOWN_ARTIST = "Unknown Artist";

    /**
     * Default timeout of {@code waitFor} in milliseconds.
     */
    public static final long DEFAULT_WAIT_TIMEOUT_MS = 300_000;

    /**
     * Polling interval of {@code waitFor} in milliseconds.
     */
    public static final long WAIT_POLL_INTERVAL_MS = 100;

    // ========== Transfer ==========

    /**
     * Buffer size used when streaming response bodies.
     */
    public static final int TRANSFER_BUFFER_SIZE = 64 * 1024;

    public static final long BYTES_PER_KB = 1_000L;

    public static final long BYTES_PER_MB = 1_000_000L;

    public static final long BYTES_PER_GB = 1_000_000_000L;

    // ========== HTTP ==========

    /**
     * HTTP status codes that trigger a transport-level retry.
     */
    public static final int[] RETRYABLE_HTTP_STATUS_CODES = {500, 502, 503, 504, 429};

    public static final String CONFLICT_RESOLUTION_HEADER = "X-Conflict-Resolution";

    public static final String FILENAME_HEADER = "X-Filename";

    public static final String DOWNLOAD_COVER_HEADER = "X-Download-Cover";

    // ========== FFmpeg ==========

    /**
     * FFmpeg log level used for conversions.
     */
    public static final String FFMPEG_LOG_LEVEL = "error";

    public static final String MP3_CODEC = "libmp3lame";

    public static final String MP3_CONTENT_TYPE = "audio/mpeg";

    // ========== Notifications ==========

    public static final String ORCHESTRATOR_COMPONENT = "download-orchestrator";

    public static final String QUEUE_COMPONENT = "download-queue";

    /**
     * Maximum number of recorded errors kept in memory.
     */
    public static final int MAX_RECORDED_ERRORS = 200;
}
