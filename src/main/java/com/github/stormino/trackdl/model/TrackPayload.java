package com.github.stormino.trackdl.model;

import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * Downloaded audio bytes ready to be stored.
 */
@Value
public class TrackPayload {
    @NonNull NativeTrack track;
    @NonNull AudioQuality quality;
    @With byte[] data;
    @With @NonNull String filename;
    String contentType;

    public long getSize() {
        return data != null ? data.length : 0;
    }
}
