package com.github.stormino.trackdl.adapter;

import com.github.stormino.trackdl.port.LogPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes the user-visible download log to a dedicated logger.
 */
@Slf4j(topic = "trackdl.download-log")
@Component
public class Slf4jDownloadLogPort implements LogPort {

    @Override
    public void log(String message) {
        log.info(message);
    }

    @Override
    public void success(String message) {
        log.info("[OK] {}", message);
    }

    @Override
    public void warning(String message) {
        log.warn(message);
    }

    @Override
    public void error(String message) {
        log.error(message);
    }
}
