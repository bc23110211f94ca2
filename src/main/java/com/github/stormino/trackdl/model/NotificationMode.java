package com.github.stormino.trackdl.model;

public enum NotificationMode {
    /** Only errors are surfaced. */
    ALERT,
    /** Successes and errors are surfaced. */
    TOAST,
    /** Nothing is surfaced; logging and error recording still happen. */
    SILENT
}
