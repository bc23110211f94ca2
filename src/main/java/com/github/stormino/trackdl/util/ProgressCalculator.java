package com.github.stormino.trackdl.util;

import lombok.experimental.UtilityClass;

/**
 * Fraction arithmetic for multi-phase download progress. All results are in [0, 1].
 */
@UtilityClass
public class ProgressCalculator {

    /**
     * Increment applied per event when the total size is unknown.
     */
    public static final double UNKNOWN_TOTAL_STEP = 0.05;

    /**
     * Ceiling for estimated fractions until the phase reports completion.
     */
    public static final double UNKNOWN_TOTAL_CEILING = 0.9;

    /**
     * Share of the download fraction reserved for metadata embedding.
     */
    public static final double EMBEDDING_START = 0.85;

    public static double clampFraction(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Weighted combination of the download and upload phases.
     *
     * @param downloadFraction Download phase fraction
     * @param uploadFraction Upload phase fraction
     * @param downloadWeight Weight of the download phase, the upload phase gets the rest
     * @return Overall fraction
     */
    public static double calculateWeightedProgress(double downloadFraction, double uploadFraction,
                                                   double downloadWeight) {
        return clampFraction(downloadFraction * downloadWeight + uploadFraction * (1 - downloadWeight));
    }

    /**
     * Download phase fraction from byte counts. Without a known total the previous value is
     * nudged forward by {@link #UNKNOWN_TOTAL_STEP}, never beyond {@link #UNKNOWN_TOTAL_CEILING}.
     */
    public static double calculateDownloadFraction(long receivedBytes, Long totalBytes, double previous) {
        if (totalBytes != null && totalBytes > 0) {
            return clampFraction((double) receivedBytes / totalBytes);
        }
        return Math.min(previous + UNKNOWN_TOTAL_STEP, UNKNOWN_TOTAL_CEILING);
    }

    /**
     * Maps embedding progress onto the tail of the download phase.
     */
    public static double calculateEmbeddingFraction(double progress) {
        return clampFraction(EMBEDDING_START + progress * (1 - EMBEDDING_START));
    }

    /**
     * Upload phase fraction from byte counts; keeps the previous value when the total is unknown.
     */
    public static double calculateUploadFraction(long uploadedBytes, Long totalBytes, double previous) {
        if (totalBytes != null && totalBytes > 0) {
            return clampFraction((double) uploadedBytes / totalBytes);
        }
        return clampFraction(previous);
    }
}
