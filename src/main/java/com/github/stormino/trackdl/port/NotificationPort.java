package com.github.stormino.trackdl.port;

import com.github.stormino.trackdl.model.ErrorContext;

/**
 * Toast/alert presentation and error telemetry.
 */
public interface NotificationPort {

    void notify(Kind kind, String message);

    void recordError(Throwable error, ErrorContext context);

    enum Kind {
        SUCCESS,
        ERROR
    }
}
