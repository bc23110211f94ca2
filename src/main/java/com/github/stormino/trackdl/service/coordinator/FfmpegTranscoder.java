package com.github.stormino.trackdl.service.coordinator;

import com.github.stormino.trackdl.exception.DownloadCancelledException;
import com.github.stormino.trackdl.exception.DownloadException;
import com.github.stormino.trackdl.model.CancellationSignal;
import com.github.stormino.trackdl.model.TrackPayload;
import com.github.stormino.trackdl.service.command.FfmpegCommandBuilder;
import com.github.stormino.trackdl.util.DownloadConstants;
import com.github.stormino.trackdl.util.TempFileManager;
import com.github.stormino.trackdl.util.TrackFilenames;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Converts lossy AAC payloads to MP3 with an external ffmpeg process.
 */
@Slf4j
public class FfmpegTranscoder implements Transcoder {

    private final FfmpegCommandBuilder commandBuilder;
    private final String bitrate;
    private final long timeoutSeconds;

    public FfmpegTranscoder(@NonNull FfmpegCommandBuilder commandBuilder, @NonNull String bitrate, long timeoutSeconds) {
        this.commandBuilder = commandBuilder;
        this.bitrate = bitrate;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public TrackPayload convertIfNeeded(TrackPayload payload, String targetFormat, CancellationSignal signal)
            throws IOException {
        String format = targetFormat.toLowerCase(Locale.ROOT);
        if (!payload.getQuality().isLossy() || payload.getFilename().toLowerCase(Locale.ROOT).endsWith("." + format)) {
            return payload;
        }

        try (TempFileManager tempFiles = new TempFileManager()) {
            Path input = tempFiles.createTempFile(".m4a");
            Path output = tempFiles.createTempFile("." + format);
            Files.write(input, payload.getData());

            runConversion(commandBuilder.buildMp3ConversionCommand(input, output, bitrate), signal);

            byte[] converted = Files.readAllBytes(output);
            log.debug("Converted {} to {} ({} -> {} bytes)",
                    payload.getFilename(), format, payload.getSize(), converted.length);

            return new TrackPayload(payload.getTrack(), payload.getQuality(), converted,
                    TrackFilenames.replaceExtension(payload.getFilename(), format),
                    DownloadConstants.MP3_CONTENT_TYPE);
        }
    }

    private void runConversion(List<String> command, CancellationSignal signal) throws IOException {
        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectErrorStream(true);
        Process process = processBuilder.start();

        if (signal != null) {
            signal.onCancel(() -> {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            });
        }

        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream()))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
            }
        }

        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new DownloadException("Conversion timeout exceeded");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new DownloadCancelledException("Conversion interrupted");
        }

        if (signal != null) {
            signal.throwIfCancelled();
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            log.error("ffmpeg exited with code {}:\n{}", exitCode, output);
            throw new DownloadException("Conversion failed with ffmpeg exit code " + exitCode);
        }
    }
}
