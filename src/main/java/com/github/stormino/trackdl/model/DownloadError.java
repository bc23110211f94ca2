package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Classified download failure.
 */
@Value
@Builder(toBuilder = true)
public class DownloadError {

    @NonNull DownloadErrorCode code;

    /**
     * Whether offering a retry to the user makes sense.
     */
    boolean retry;

    /**
     * Technical message, suitable for logs.
     */
    String message;

    /**
     * Message suitable for display.
     */
    String userMessage;

    /**
     * Set when the target can be converted manually (foreign references).
     */
    boolean canConvert;

    Throwable cause;

    public static DownloadError of(DownloadErrorCode code, String message) {
        return of(code, message, null);
    }

    public static DownloadError of(DownloadErrorCode code, String message, Throwable cause) {
        return DownloadError.builder()
                .code(code)
                .retry(code.isRetryable())
                .message(message)
                .userMessage(code.getUserMessage())
                .cause(cause)
                .build();
    }
}
