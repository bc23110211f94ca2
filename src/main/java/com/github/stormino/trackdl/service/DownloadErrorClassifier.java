package com.github.stormino.trackdl.service;

import com.github.stormino.trackdl.exception.DownloadCancelledException;
import com.github.stormino.trackdl.exception.StorageException;
import com.github.stormino.trackdl.exception.TransportException;
import com.github.stormino.trackdl.model.DownloadError;
import com.github.stormino.trackdl.model.DownloadErrorCode;
import org.springframework.stereotype.Component;

import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Maps arbitrary failures to a {@link DownloadError}. Total: never throws.
 * <p>
 * Order of checks, first match wins: cancellation, then keywords in the lower-cased
 * message (network, storage, conversion, server). Typed transport and storage
 * exceptions only decide when no keyword matched.
 */
@Component
public class DownloadErrorClassifier {

    static final String UNKNOWN_MESSAGE = "Unknown download error";

    private static final List<String> NETWORK_KEYWORDS = List.of("network", "fetch", "connection", "timeout", "timed out");
    private static final List<String> STORAGE_KEYWORDS = List.of("storage", "disk", "quota", "no space");
    private static final List<String> CONVERSION_KEYWORDS = List.of("conversion", "ffmpeg", "codec");
    private static final List<String> SERVER_KEYWORDS = List.of("server", "http", "upload");

    private static final int MAX_CAUSE_DEPTH = 10;

    public DownloadError classify(Object rawError) {
        Throwable cause = rawError instanceof Throwable ? (Throwable) rawError : null;

        if (isCancellation(rawError)) {
            return DownloadError.of(DownloadErrorCode.DOWNLOAD_CANCELLED, "Download was cancelled", cause);
        }

        String message = extractMessage(rawError);
        String normalized = message.toLowerCase(Locale.ROOT);

        if (containsAny(normalized, NETWORK_KEYWORDS)) {
            return DownloadError.of(DownloadErrorCode.NETWORK_ERROR, message, cause);
        }
        if (containsAny(normalized, STORAGE_KEYWORDS)) {
            return DownloadError.of(DownloadErrorCode.STORAGE_ERROR, message, cause);
        }
        if (containsAny(normalized, CONVERSION_KEYWORDS)) {
            return DownloadError.of(DownloadErrorCode.CONVERSION_ERROR, message, cause);
        }
        if (containsAny(normalized, SERVER_KEYWORDS)) {
            return DownloadError.of(DownloadErrorCode.SERVER_ERROR, message, cause);
        }

        DownloadErrorCode typed = classifyByType(cause);
        return DownloadError.of(typed != null ? typed : DownloadErrorCode.UNKNOWN_ERROR, message, cause);
    }

    /**
     * Whether the failure represents a deliberate cancellation rather than an error.
     */
    public boolean isCancellation(Object rawError) {
        if (!(rawError instanceof Throwable)) {
            return false;
        }
        Throwable current = (Throwable) rawError;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof DownloadCancelledException
                    || current instanceof CancellationException
                    || current instanceof InterruptedException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Extracts a message from strings, exceptions, HTTP status codes and
     * {@code {message}} / {@code {error}} / {@code {error: {message}}} maps.
     */
    public String extractMessage(Object rawError) {
        if (rawError instanceof String) {
            String text = (String) rawError;
            return text.isBlank() ? UNKNOWN_MESSAGE : text;
        }
        if (rawError instanceof Throwable) {
            return extractThrowableMessage((Throwable) rawError);
        }
        if (rawError instanceof Number) {
            return "HTTP " + ((Number) rawError).intValue();
        }
        if (rawError instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) rawError;
            Object direct = map.get("message");
            if (direct instanceof String) {
                return (String) direct;
            }
            Object nested = map.get("error");
            if (nested instanceof String) {
                return (String) nested;
            }
            if (nested instanceof Map && ((Map<?, ?>) nested).get("message") instanceof String) {
                return (String) ((Map<?, ?>) nested).get("message");
            }
        }
        return UNKNOWN_MESSAGE;
    }

    private String extractThrowableMessage(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current.getMessage() != null && !current.getMessage().isBlank()) {
                return current.getMessage();
            }
            current = current.getCause();
        }
        return error.getClass().getSimpleName();
    }

    private DownloadErrorCode classifyByType(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof StorageException) {
                return DownloadErrorCode.STORAGE_ERROR;
            }
            if (current instanceof TransportException) {
                return ((TransportException) current).getStatusCode() != null
                        ? DownloadErrorCode.SERVER_ERROR
                        : DownloadErrorCode.NETWORK_ERROR;
            }
            if (current instanceof SocketTimeoutException
                    || current instanceof ConnectException
                    || current instanceof UnknownHostException
                    || current instanceof SocketException) {
                return DownloadErrorCode.NETWORK_ERROR;
            }
            current = current.getCause();
        }
        return null;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
