package com.github.stormino.trackdl.model;

/**
 * Audio quality tiers offered by the catalog.
 */
public enum AudioQuality {
    HI_RES_LOSSLESS,
    LOSSLESS,
    HIGH,
    LOW;

    /**
     * File extension (without dot) produced for this quality.
     *
     * @param convertAacToMp3 whether lossy AAC output is converted to MP3
     * @return extension such as "flac", "m4a" or "mp3"
     */
    public String getExtension(boolean convertAacToMp3) {
        switch (this) {
            case HIGH:
            case LOW:
                return convertAacToMp3 ? "mp3" : "m4a";
            default:
                return "flac";
        }
    }

    public boolean isLossy() {
        return this == HIGH || this == LOW;
    }
}
