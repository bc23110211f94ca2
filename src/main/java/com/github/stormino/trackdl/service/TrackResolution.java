package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.model.DownloadError;
import com.github.stormino.trackdl.model.NativeTrack;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of resolving a download target into a native track.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TrackResolution {
    boolean success;
    NativeTrack track;

    /**
     * True when the track was obtained through conversion of a foreign reference.
     */
    boolean converted;

    DownloadError error;

    static TrackResolution resolved(NativeTrack track, boolean converted) {
        return new TrackResolution(true, track, converted, null);
    }

    static TrackResolution failed(DownloadError error) {
        return new TrackResolution(false, null, false, error);
    }
}
