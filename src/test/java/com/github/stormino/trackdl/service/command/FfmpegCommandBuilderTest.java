package com.github.stormino.trackdl.service.command;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FfmpegCommandBuilder")
class FfmpegCommandBuilderTest {

    @Test
    @DisplayName("should build mp3 conversion keeping tags and dropping artwork")
    void shouldBuildMp3Command() {
        FfmpegCommandBuilder builder = new FfmpegCommandBuilder("/usr/bin/ffmpeg");
        Path input = Path.of("in.m4a");
        Path output = Path.of("out.mp3");

        List<String> command = builder.buildMp3ConversionCommand(input, output, "256k");

        assertEquals(List.of(
                "/usr/bin/ffmpeg", "-hide_banner", "-loglevel", "error",
                "-i", "in.m4a", "-vn", "-map_metadata", "0",
                "-codec:a", "libmp3lame", "-b:a", "256k", "-id3v2_version", "3",
                "-y", "out.mp3"), command);
    }

    @Test
    @DisplayName("should reject null paths")
    void shouldRejectNulls() {
        FfmpegCommandBuilder builder = new FfmpegCommandBuilder("ffmpeg");

        assertThrows(NullPointerException.class,
                () -> builder.buildMp3ConversionCommand(null, Path.of("out.mp3"), "320k"));
    }
}
