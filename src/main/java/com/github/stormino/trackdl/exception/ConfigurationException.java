package com.github.stormino.trackdl.exception;

/**
 * A required {@code trackdl.*} setting is missing or unusable.
 */
public class ConfigurationException extends DownloadException {

    private final String propertyName;

    public ConfigurationException(String message, String propertyName) {
        super(message + " (" + propertyName + ")");
        this.propertyName = propertyName;
    }

    /**
     * @return Relaxed property name, e.g. {@code trackdl.storage.server-upload-url}
     */
    public String getPropertyName() {
        return propertyName;
    }
}
