package com.phillippitts.livescribe.service.audio.source;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FfmpegCommandsTest {

    @Test
    void realtimeDecodingThrottlesInput() {
        List<String> cmd = FfmpegCommands.decodeToStdout("/usr/bin/ffmpeg", "clip.mp4", 16_000, true);
        assertThat(cmd.get(0)).isEqualTo("/usr/bin/ffmpeg");
        assertThat(cmd.indexOf("-re")).isLessThan(cmd.indexOf("-i"));
        assertThat(cmd).containsSequence("-f", "s16le").containsSequence("-acodec", "pcm_s16le");
    }

    @Test
    void conversionWritesCanonicalWav() {
        List<String> cmd = FfmpegCommands.convertToWav("ffmpeg", Path.of("in.m4a"), Path.of("out.wav"), 16_000);
        assertThat(cmd).containsSequence("-i", "in.m4a")
                .contains("-y")
                .containsSequence("-ar", "16000", "-ac", "1", "out.wav");
    }
}
