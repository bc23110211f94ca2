package com.github.stormino.trackdl.model;

import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Everything needed to replay a download: the original target and its resolved options.
 */
@Value
public class DownloadAttempt {
    @NonNull DownloadTarget target;
    @NonNull DownloadOptions options;
    @NonNull Instant timestamp;
}
