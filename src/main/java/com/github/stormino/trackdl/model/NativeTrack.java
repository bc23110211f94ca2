package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Track bound to the native catalog and directly downloadable.
 */
@Value
@Builder(toBuilder = true)
public class NativeTrack implements DownloadTarget {

    @NonNull
    String id;

    String title;
    String version;
    String artistName;

    String albumId;
    String albumTitle;
    String coverId;

    Integer trackNumber;
    Integer volumeNumber;
    Integer numberOfVolumes;

    @Override
    public boolean isForeign() {
        return false;
    }

    /**
     * Title including the version suffix, e.g. "Song (Live)".
     */
    public String getDisplayTitle() {
        if (title == null) {
            return null;
        }
        return version != null && !version.isBlank() ? title + " (" + version + ")" : title;
    }
}
