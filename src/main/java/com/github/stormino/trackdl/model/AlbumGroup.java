package com.github.stormino.trackdl.model;

import lombok.Value;

import java.util.List;

/**
 * Queued items sharing the same parent album.
 */
@Value
public class AlbumGroup {
    String albumId;
    String albumTitle;
    String artistName;
    List<QueuedDownload> tracks;

    public int getTrackCount() {
        return tracks.size();
    }
}
