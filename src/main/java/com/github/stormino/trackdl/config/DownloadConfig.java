package com.github.stormino.trackdl.config;

import com.github.stormino.trackdl.adapter.DefaultDownloadExecutionPort;
import com.github.stormino.trackdl.adapter.UnavailableConversionPort;
import com.github.stormino.trackdl.model.DownloadPreferences;
import com.github.stormino.trackdl.port.ConversionPort;
import com.github.stormino.trackdl.port.DownloadExecutionPort;
import com.github.stormino.trackdl.port.TransportPort;
import com.github.stormino.trackdl.service.DownloadQueue;
import com.github.stormino.trackdl.service.command.FfmpegCommandBuilder;
import com.github.stormino.trackdl.service.coordinator.DefaultDownloadSink;
import com.github.stormino.trackdl.service.coordinator.DownloadCoordinator;
import com.github.stormino.trackdl.service.coordinator.DownloadSink;
import com.github.stormino.trackdl.service.coordinator.DownloadSource;
import com.github.stormino.trackdl.service.coordinator.FfmpegTranscoder;
import com.github.stormino.trackdl.service.coordinator.HttpDownloadSource;
import com.github.stormino.trackdl.service.coordinator.Transcoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Paths;
import java.util.function.Supplier;

/**
 * Wires the download pipeline: preferences, queue, coordinator and default ports.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class DownloadConfig {

    private final DownloadProperties properties;

    /**
     * Preferences are read on every call so runtime property changes apply to new downloads.
     */
    @Bean
    public Supplier<DownloadPreferences> downloadPreferences() {
        return () -> properties.getPreferences().toSnapshot();
    }

    @Bean(destroyMethod = "shutdown")
    public DownloadQueue downloadQueue(@Qualifier("queueExecutor") ThreadPoolTaskExecutor queueExecutor) {
        DownloadProperties.Queue config = properties.getQueue();
        log.info("Download queue: maxConcurrent={}, maxRetries={}, autoRetryFailures={}",
                config.getMaxConcurrent(), config.getMaxRetries(), config.isAutoRetryFailures());
        return new DownloadQueue(config, queueExecutor.getThreadPoolExecutor());
    }

    @Bean
    public DownloadSource downloadSource(TransportPort transport) {
        return new HttpDownloadSource(transport, properties.getStorage().getStreamUrlTemplate());
    }

    @Bean
    public DownloadSink downloadSink(TransportPort transport) {
        DownloadProperties.Storage storage = properties.getStorage();
        return new DefaultDownloadSink(Paths.get(storage.getClientPath()), storage.getServerUploadUrl(), transport);
    }

    @Bean
    @ConditionalOnProperty(prefix = "trackdl.transcoder", name = "enabled", havingValue = "true", matchIfMissing = true)
    public Transcoder transcoder() {
        DownloadProperties.Transcoder transcoder = properties.getTranscoder();
        return new FfmpegTranscoder(new FfmpegCommandBuilder(transcoder.getFfmpegPath()),
                transcoder.getMp3Bitrate(), transcoder.getTimeoutSeconds());
    }

    @Bean
    public DownloadCoordinator downloadCoordinator(DownloadSource source, DownloadSink sink,
                                                   ObjectProvider<Transcoder> transcoder) {
        return new DownloadCoordinator(source, sink, transcoder.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean(DownloadExecutionPort.class)
    public DownloadExecutionPort downloadExecutionPort(DownloadCoordinator coordinator) {
        return new DefaultDownloadExecutionPort(coordinator);
    }

    @Bean
    @ConditionalOnMissingBean(ConversionPort.class)
    public ConversionPort conversionPort() {
        log.info("No catalog converter configured, foreign tracks cannot be auto-converted");
        return new UnavailableConversionPort();
    }
}
