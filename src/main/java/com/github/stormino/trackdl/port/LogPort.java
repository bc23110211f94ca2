package com.github.stormino.trackdl.port;

/**
 * User-visible download log.
 */
public interface LogPort {

    void log(String message);

    void success(String message);

    void warning(String message);

    void error(String message);
}
