package com.github.stormino.trackdl.exception;

/**
 * Exception thrown when the remote service answers with an unsuccessful HTTP status.
 */
public class TransportException extends DownloadException {

    private final String url;
    private final Integer statusCode;

    public TransportException(String message, String url) {
        super(message);
        this.url = url;
        this.statusCode = null;
    }

    public TransportException(String message, String url, Integer statusCode) {
        super(message);
        this.url = url;
        this.statusCode = statusCode;
    }

    public TransportException(String message, Throwable cause, String url) {
        super(message, cause);
        this.url = url;
        this.statusCode = null;
    }

    public String getUrl() {
        return url;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
