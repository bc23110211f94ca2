package com.github.stormino.trackdl.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final DownloadProperties properties;

    /**
     * Worker pool of the download queue, one thread per concurrent download.
     */
    @Bean(name = "queueExecutor")
    public ThreadPoolTaskExecutor queueExecutor() {
        int workers = properties.getQueue().getMaxConcurrent();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("download-queue-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Pool for downloads started directly through the orchestrator.
     */
    @Bean(name = "trackExecutor")
    public Executor trackExecutor() {
        int threads = properties.getOrchestrator().getTrackThreads();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("track-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
