package com.phillippitts.livescribe.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Properties for file-based transcription.
 *
 * @param chunkSeconds chunk duration when a local file is streamed through the live worker
 * @param outputDir directory that receives one sub-directory of transcript files per session
 * @param convertTimeout bound on the ffmpeg conversion to canonical WAV
 */
@Validated
@ConfigurationProperties(prefix = "file")
public record FileTranscriptionProperties(
        @DefaultValue("5.0") @DecimalMin("0.1") double chunkSeconds,
        @DefaultValue("transcripts") @NotBlank String outputDir,
        @DefaultValue("10m") @NotNull Duration convertTimeout
) {
    public static FileTranscriptionProperties defaults() {
        return new FileTranscriptionProperties(5.0, "transcripts", Duration.ofMinutes(10));
    }
}
