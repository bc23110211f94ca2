package com.github.stormino.trackdl.util;

import com.github.stormino.trackdl.model.AudioQuality;
import com.github.stormino.trackdl.model.NativeTrack;
import lombok.experimental.UtilityClass;

/**
 * Deterministic file naming for downloaded tracks.
 */
@UtilityClass
public class TrackFilenames {

    /**
     * Sanitize a filename component by replacing invalid characters and collapsing whitespace.
     *
     * @param value Original value
     * @return Sanitized value, or "Unknown" for blank input
     */
    public static String sanitizeForFilename(String value) {
        if (value == null || value.isBlank()) {
            return "Unknown";
        }

        return value
                .replaceAll("[\\\\/:*?\"<>|]", "_")
                .replaceAll("\\s+", " ")
                .trim();
    }

    /**
     * Build the filename for a track, e.g. {@code "Artist - Album - 01-03 Title (Live).flac"}.
     *
     * @param track Resolved track
     * @param quality Requested quality; LOSSLESS when null
     * @param convertAacToMp3 Whether lossy output is converted to MP3
     * @return Filename with extension
     */
    public static String buildDownloadFilename(NativeTrack track, AudioQuality quality, boolean convertAacToMp3) {
        AudioQuality effectiveQuality = quality != null ? quality : AudioQuality.LOSSLESS;
        String extension = effectiveQuality.getExtension(convertAacToMp3);

        String title = track.getDisplayTitle();
        String album = track.getAlbumTitle() != null ? track.getAlbumTitle() : DownloadConstants.UNKNOWN_ALBUM;

        return String.join(" - ",
                sanitizeForFilename(track.getArtistName()),
                sanitizeForFilename(album),
                buildTrackPart(track) + " " + sanitizeForFilename(title))
                + "." + extension;
    }

    /**
     * Replace the extension of a filename, or append one when it has none.
     */
    public static String replaceExtension(String filename, String extension) {
        int dot = filename.lastIndexOf('.');
        String base = dot > 0 ? filename.substring(0, dot) : filename;
        return base + "." + extension;
    }

    private static String buildTrackPart(NativeTrack track) {
        Integer volume = track.getVolumeNumber();
        boolean multiVolume = (track.getNumberOfVolumes() != null && track.getNumberOfVolumes() > 1)
                || volume != null;

        String trackPadded = pad(track.getTrackNumber(), "00");
        if (!multiVolume) {
            return trackPadded;
        }
        return pad(volume, "01") + "-" + trackPadded;
    }

    private static String pad(Integer number, String fallback) {
        if (number == null || number <= 0) {
            return fallback;
        }
        return String.format("%02d", number);
    }
}
