package com.github.stormino.trackdl.port;

import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;

@Value
@Builder
public class TransportResponse {
    int statusCode;
    byte[] body;
    String contentType;

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String bodyAsString() {
        return body != null ? new String(body, StandardCharsets.UTF_8) : "";
    }
}
