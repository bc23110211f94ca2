package com.github.stormino.trackdl.port;

import com.github.stormino.trackdl.model.CancellationSignal;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class FetchOptions {

    @Builder.Default
    String method = "GET";

    byte[] body;
    String contentType;

    @Singular
    Map<String, String> headers;

    CancellationSignal signal;

    /**
     * Receives transferred byte counts: response bytes for GET, request bytes for uploads.
     */
    TransferListener listener;

    public static FetchOptions get() {
        return FetchOptions.builder().build();
    }

    @FunctionalInterface
    public interface TransferListener {
        void onTransfer(long transferredBytes, Long totalBytes);
    }
}
