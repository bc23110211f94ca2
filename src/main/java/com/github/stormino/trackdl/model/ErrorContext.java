package com.github.stormino.trackdl.model;

import lombok.Builder;
import lombok.Value;

/**
 * Where an error was observed, attached to recorded errors.
 */
@Value
@Builder
public class ErrorContext {
    String component;

    @Builder.Default
    String domain = "download";

    String source;

    @Builder.Default
    Severity severity = Severity.MEDIUM;

    String taskId;

    public enum Severity {
        LOW,
        MEDIUM,
        HIGH
    }
}
