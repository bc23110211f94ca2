package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EnqueueOptions {

    @Builder.Default
    int priority = 0;

    /**
     * Per-item retry ceiling; the queue default applies when null.
     */
    Integer maxRetries;

    String trackTitle;
    String artistName;
    String albumId;
    String albumTitle;

    public static EnqueueOptions defaults() {
        return EnqueueOptions.builder().build();
    }

    public static EnqueueOptions forTarget(DownloadTarget target, int priority) {
        EnqueueOptionsBuilder builder = EnqueueOptions.builder()
                .priority(priority)
                .trackTitle(target.getTitle())
                .artistName(target.getArtistName())
                .albumTitle(target.getAlbumTitle());
        if (target instanceof NativeTrack) {
            builder.albumId(((NativeTrack) target).getAlbumId());
        }
        return builder.build();
    }
}
