package com.github.stormino.trackdl.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Handle returned when a UI-visible task is started.
 */
@Value
public class TaskHandle {
    @NonNull String taskId;
    @NonNull CancellationSignal controller;
}
