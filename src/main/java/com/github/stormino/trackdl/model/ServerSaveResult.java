package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.Value;

/**
 * Response of the server-side save operation.
 */
@Value
@Builder
public class ServerSaveResult {
    boolean success;
    String message;
    String error;
    String filepath;

    /**
     * Conflict action taken by the server, e.g. "overwritten" or "skipped".
     */
    String action;
}
