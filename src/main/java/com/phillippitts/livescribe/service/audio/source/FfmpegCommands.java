package com.phillippitts.livescribe.service.audio.source;

import com.phillippitts.livescribe.service.audio.AudioFormat;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds ffmpeg command lines for decoding to the canonical PCM format.
 */
public final class FfmpegCommands {

    private FfmpegCommands() {}

    /**
     * Decode {@code locator} to raw mono PCM16LE on stdout.
     *
     * @param realtime add {@code -re} to read input at its native rate
     */
    public static List<String> decodeToStdout(String ffmpegPath, String locator, int sampleRate, boolean realtime) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegPath);
        cmd.add("-hide_banner");
        cmd.add("-loglevel");
        cmd.add("error");
        if (realtime) {
            cmd.add("-re");
        }
        cmd.add("-i");
        cmd.add(locator);
        cmd.add("-f");
        cmd.add(AudioFormat.FFMPEG_RAW_FORMAT);
        cmd.add("-acodec");
        cmd.add(AudioFormat.FFMPEG_PCM_CODEC);
        cmd.add("-ar");
        cmd.add(String.valueOf(sampleRate));
        cmd.add("-ac");
        cmd.add(String.valueOf(AudioFormat.CHANNELS));
        cmd.add("pipe:1");
        return cmd;
    }

    /**
     * Convert {@code input} to a mono 16-bit WAV file at {@code sampleRate}, overwriting {@code output}.
     */
    public static List<String> convertToWav(String ffmpegPath, Path input, Path output, int sampleRate) {
        return List.of(ffmpegPath, "-hide_banner", "-loglevel", "error", "-y",
                "-i", input.toString(),
                "-acodec", AudioFormat.FFMPEG_PCM_CODEC,
                "-ar", String.valueOf(sampleRate),
                "-ac", String.valueOf(AudioFormat.CHANNELS),
                output.toString());
    }
}
