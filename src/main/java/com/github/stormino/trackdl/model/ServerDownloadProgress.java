package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.Value;

/**
 * Progress as reported by the server-side save operation. The stage is a free-form
 * string ("downloading", "embedding", "uploading") and has to be normalized before use.
 */
@Value
@Builder
public class ServerDownloadProgress {
    String stage;
    Long receivedBytes;
    Long uploadedBytes;
    Long totalBytes;
    Double progress;
    Double speed;
    Long eta;
}
