package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of the user's download preferences, used as defaults for {@link DownloadOptions}.
 */
@Value
@Builder
public class DownloadPreferences {

    @Builder.Default
    AudioQuality defaultQuality = AudioQuality.LOSSLESS;

    boolean convertAacToMp3;
    boolean downloadCoversSeparately;

    @Builder.Default
    boolean autoResolveForeign = true;

    @Builder.Default
    NotificationMode notificationMode = NotificationMode.ALERT;

    @Builder.Default
    StorageTarget storage = StorageTarget.CLIENT;

    @Builder.Default
    ConflictResolution conflictResolution = ConflictResolution.OVERWRITE_IF_DIFFERENT;
}
