package com.github.stormino.trackdl.service.progress;

import lombok.Getter;

/**
 * Monotonic phase fractions of one download attempt. Values only ever move forward.
 */
@Getter
public class ProgressState {

    private double downloadFraction;
    private double uploadFraction;
    private double embeddingFraction;

    public double advanceDownload(double fraction) {
        downloadFraction = Math.max(downloadFraction, fraction);
        return downloadFraction;
    }

    public double advanceUpload(double fraction) {
        uploadFraction = Math.max(uploadFraction, fraction);
        return uploadFraction;
    }

    public double advanceEmbedding(double fraction) {
        embeddingFraction = Math.max(embeddingFraction, fraction);
        return embeddingFraction;
    }
}
