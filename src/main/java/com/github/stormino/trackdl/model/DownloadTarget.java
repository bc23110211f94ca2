package com.github.stormino.trackdl.model;

/**
 * Something the user asked to download: either a {@link NativeTrack} that the catalog
 * can serve directly, or a {@link ForeignTrackReference} that must be resolved first.
 */
public interface DownloadTarget {

    /**
     * Opaque identifier, unique within the target's namespace.
     */
    String getId();

    String getTitle();

    String getArtistName();

    String getAlbumTitle();

    boolean isForeign();
}
