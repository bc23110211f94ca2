package com.github.stormino.trackdl.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of converting a foreign reference into a native track.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConversionResult {
    boolean success;
    NativeTrack track;
    String errorMessage;
    Throwable cause;

    public static ConversionResult success(NativeTrack track) {
        return new ConversionResult(true, track, null, null);
    }

    public static ConversionResult failure(String errorMessage) {
        return new ConversionResult(false, null, errorMessage, null);
    }

    public static ConversionResult failure(String errorMessage, Throwable cause) {
        return new ConversionResult(false, null, errorMessage, cause);
    }
}
