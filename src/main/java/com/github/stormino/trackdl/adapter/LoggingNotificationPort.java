package com.github.stormino.trackdl.adapter;

import com.github.stormino.trackdl.model.ErrorContext;
import com.github.stormino.trackdl.port.NotificationPort;
import com.github.stormino.trackdl.util.DownloadConstants;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Notification port without a UI: notifications are logged and recorded errors are kept
 * in a bounded in-memory list.
 */
@Slf4j
@Component
public class LoggingNotificationPort implements NotificationPort {

    private final int maxRecordedErrors;
    private final Deque<RecordedError> recordedErrors = new ArrayDeque<>();

    public LoggingNotificationPort() {
        this(DownloadConstants.MAX_RECORDED_ERRORS);
    }

    public LoggingNotificationPort(int maxRecordedErrors) {
        this.maxRecordedErrors = maxRecordedErrors;
    }

    @Override
    public void notify(Kind kind, String message) {
        if (kind == Kind.ERROR) {
            log.warn("Notification: {}", message);
        } else {
            log.info("Notification: {}", message);
        }
    }

    @Override
    public void recordError(Throwable error, ErrorContext context) {
        log.debug("Recorded {} error from {}: {}", context.getSeverity(), context.getComponent(), error.getMessage());
        synchronized (recordedErrors) {
            recordedErrors.addLast(new RecordedError(error, context, LocalDateTime.now()));
            while (recordedErrors.size() > maxRecordedErrors) {
                recordedErrors.removeFirst();
            }
        }
    }

    /**
     * Recorded errors, oldest first.
     */
    public List<RecordedError> getRecordedErrors() {
        synchronized (recordedErrors) {
            return new ArrayList<>(recordedErrors);
        }
    }

    public void clearRecordedErrors() {
        synchronized (recordedErrors) {
            recordedErrors.clear();
        }
    }

    @Value
    public static class RecordedError {
        Throwable error;
        ErrorContext context;
        LocalDateTime timestamp;
    }
}
