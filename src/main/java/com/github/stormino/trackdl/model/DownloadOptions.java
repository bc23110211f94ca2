package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.Value;

/**
 * Caller-supplied download options. Every field is optional; unset fields fall back to
 * the user's {@link DownloadPreferences} when the options are resolved.
 */
@Value
@Builder(toBuilder = true)
public class DownloadOptions {

    AudioQuality quality;
    Boolean convertAacToMp3;
    Boolean downloadCoversSeparately;

    /**
     * Whether foreign references are converted to native tracks automatically.
     */
    Boolean autoResolveForeign;

    NotificationMode notificationMode;
    ExecutionStrategyType strategy;
    StorageTarget storage;
    ConflictResolution conflictResolution;

    /**
     * Optional subtitle shown next to the task in the UI.
     */
    String subtitle;

    CancellationSignal signal;

    public static DownloadOptions defaults() {
        return DownloadOptions.builder().build();
    }
}
