package com.github.stormino.trackdl.config;

import com.github.stormino.trackdl.model.AudioQuality;
import com.github.stormino.trackdl.model.ConflictResolution;
import com.github.stormino.trackdl.model.DownloadPreferences;
import com.github.stormino.trackdl.model.NotificationMode;
import com.github.stormino.trackdl.model.StorageTarget;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "trackdl")
public class DownloadProperties {

    private Queue queue = new Queue();
    private Orchestrator orchestrator = new Orchestrator();
    private Preferences preferences = new Preferences();
    private Storage storage = new Storage();
    private Transport transport = new Transport();
    private Transcoder transcoder = new Transcoder();

    @Data
    public static class Queue {
        @Min(1)
        private int maxConcurrent = 4;

        @Min(0)
        private int maxRetries = 3;

        private boolean autoRetryFailures = true;
    }

    @Data
    public static class Orchestrator {
        @Min(4)
        private int maxStoredAttempts = 50;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double downloadWeight = 0.55;

        @Min(1)
        private int trackThreads = 4;
    }

    @Data
    public static class Preferences {
        @NotNull
        private AudioQuality defaultQuality = AudioQuality.LOSSLESS;

        private boolean convertAacToMp3 = false;

        private boolean downloadCoversSeparately = false;

        private boolean autoResolveForeign = true;

        @NotNull
        private NotificationMode notificationMode = NotificationMode.ALERT;

        @NotNull
        private StorageTarget storage = StorageTarget.CLIENT;

        @NotNull
        private ConflictResolution conflictResolution = ConflictResolution.OVERWRITE_IF_DIFFERENT;

        public DownloadPreferences toSnapshot() {
            return DownloadPreferences.builder()
                    .defaultQuality(defaultQuality)
                    .convertAacToMp3(convertAacToMp3)
                    .downloadCoversSeparately(downloadCoversSeparately)
                    .autoResolveForeign(autoResolveForeign)
                    .notificationMode(notificationMode)
                    .storage(storage)
                    .conflictResolution(conflictResolution)
                    .build();
        }
    }

    @Data
    public static class Storage {
        @NotBlank
        private String clientPath = "/downloads/tracks";

        /**
         * Upload endpoint of the server-side library. Server saves fail when unset.
         */
        private String serverUploadUrl;

        /**
         * Stream URL template; {id} and {quality} are substituted.
         */
        @NotBlank
        private String streamUrlTemplate = "http://localhost:8080/api/tracks/{id}/stream?quality={quality}";
    }

    @Data
    public static class Transport {
        @Min(1)
        private int timeoutSeconds = 30;

        @NotBlank
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

        @Min(100)
        private long retryDelayMs = 1000;

        @Min(1)
        private int maxRetries = 3;

        @Min(1000)
        private long maxRetryDelayMs = 30000;
    }

    @Data
    public static class Transcoder {
        /**
         * Whether AAC to MP3 conversion is available. When disabled, lossy tracks are saved as-is.
         */
        private boolean enabled = true;

        @NotBlank
        private String ffmpegPath = "ffmpeg";

        @NotBlank
        private String mp3Bitrate = "320k";

        @Min(1)
        private int timeoutSeconds = 600;
    }
}
