package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Track identified by a third-party source and not yet bound to the native catalog.
 */
@Value
@Builder
public class ForeignTrackReference implements DownloadTarget {

    @NonNull
    String id;

    String sourceUrl;
    String title;
    String artistName;
    String albumTitle;

    @Override
    public boolean isForeign() {
        return true;
    }
}
