package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Result of one execution backend run, providing status and error information.
 */
@Data
@Builder
public class DownloadResult {

    /**
     * Whether the save operation succeeded.
     */
    private final boolean success;

    @Builder.Default
    private final ResultStatus status = ResultStatus.SUCCESS;

    /**
     * Optional informational message on success (e.g. "skipped, identical file exists").
     */
    private final String message;

    /**
     * Error message if the operation failed.
     */
    private final String errorMessage;

    /**
     * Optional exception that caused the failure.
     */
    private final Throwable cause;

    /**
     * Additional details such as the stored file path or the conflict action taken.
     */
    @Builder.Default
    private final Map<String, Object> metadata = new HashMap<>();

    public static final String FILENAME = "filename";
    public static final String FILEPATH = "filepath";
    public static final String ACTION = "action";

    public enum ResultStatus {
        SUCCESS,
        FAILED,
        CANCELLED,
        /**
         * Nothing was written because the conflict policy kept the existing file.
         */
        SKIPPED
    }

    public static DownloadResult success() {
        return DownloadResult.builder()
                .success(true)
                .status(ResultStatus.SUCCESS)
                .build();
    }

    public static DownloadResult success(String message) {
        return DownloadResult.builder()
                .success(true)
                .status(ResultStatus.SUCCESS)
                .message(message)
                .build();
    }

    public static DownloadResult success(String message, Map<String, Object> metadata) {
        return DownloadResult.builder()
                .success(true)
                .status(ResultStatus.SUCCESS)
                .message(message)
                .metadata(new HashMap<>(metadata))
                .build();
    }

    public static DownloadResult skipped(String message) {
        return DownloadResult.builder()
                .success(true)
                .status(ResultStatus.SKIPPED)
                .message(message)
                .build();
    }

    public static DownloadResult failure(String errorMessage) {
        return DownloadResult.builder()
                .success(false)
                .status(ResultStatus.FAILED)
                .errorMessage(errorMessage)
                .build();
    }

    public static DownloadResult failure(String errorMessage, Throwable cause) {
        return DownloadResult.builder()
                .success(false)
                .status(ResultStatus.FAILED)
                .errorMessage(errorMessage)
                .cause(cause)
                .build();
    }

    public static DownloadResult cancelled(String message) {
        return DownloadResult.builder()
                .success(false)
                .status(ResultStatus.CANCELLED)
                .errorMessage(message)
                .build();
    }

    public boolean isCancelled() {
        return status == ResultStatus.CANCELLED;
    }

    public void addMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    @SuppressWarnings("unchecked")
    public <T> T getMetadata(String key) {
        return (T) metadata.get(key);
    }

    public boolean hasMetadata(String key) {
        return metadata.containsKey(key);
    }
}
