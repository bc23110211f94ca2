package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Download options with every default applied. Only {@code signal} may be null.
 */
@Value
@Builder(toBuilder = true)
public class ResolvedDownloadOptions {

    @NonNull AudioQuality quality;
    boolean convertAacToMp3;
    boolean downloadCoversSeparately;
    boolean autoResolveForeign;
    @NonNull NotificationMode notificationMode;
    @NonNull ExecutionStrategyType strategy;
    @NonNull StorageTarget storage;
    @NonNull ConflictResolution conflictResolution;
    @NonNull String subtitle;
    CancellationSignal signal;

    /**
     * AAC to MP3 conversion only happens when the file is saved on the client.
     */
    public boolean isEffectiveConvertAacToMp3() {
        return storage == StorageTarget.CLIENT && convertAacToMp3;
    }

    /**
     * Options with every field set to the resolved value, so resolving them again gives the
     * same result whatever the preferences are by then. The signal is not carried over.
     */
    public DownloadOptions toOptions() {
        return DownloadOptions.builder()
                .quality(quality)
                .convertAacToMp3(convertAacToMp3)
                .downloadCoversSeparately(downloadCoversSeparately)
                .autoResolveForeign(autoResolveForeign)
                .notificationMode(notificationMode)
                .strategy(strategy)
                .storage(storage)
                .conflictResolution(conflictResolution)
                .subtitle(subtitle)
                .build();
    }
}
