package com.github.stormino.trackdl.service.command;

import com.github.stormino.trackdl.util.DownloadConstants;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds ffmpeg command lines for audio conversion.
 */
@Slf4j
public class FfmpegCommandBuilder {

    private final String ffmpegPath;

    public FfmpegCommandBuilder(@NonNull String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }

    /**
     * Build ffmpeg command for converting an AAC/M4A file to MP3, keeping tags.
     *
     * @param inputFile Input audio file
     * @param outputFile Output MP3 file
     * @param bitrate Target bitrate, e.g. "320k"
     * @return ffmpeg command arguments
     */
    public List<String> buildMp3ConversionCommand(@NonNull Path inputFile, @NonNull Path outputFile,
                                                  @NonNull String bitrate) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-hide_banner");
        command.add("-loglevel");
        command.add(DownloadConstants.FFMPEG_LOG_LEVEL);
        command.add("-i");
        command.add(inputFile.toString());
        command.add("-vn");  // Drop embedded artwork streams
        command.add("-map_metadata");
        command.add("0");
        command.add("-codec:a");
        command.add(DownloadConstants.MP3_CODEC);
        command.add("-b:a");
        command.add(bitrate);
        command.add("-id3v2_version");
        command.add("3");
        command.add("-y");
        command.add(outputFile.toString());

        log.debug("Built MP3 conversion command: {}", String.join(" ", command));
        return command;
    }
}
