package com.phillippitts.livescribe.config.stt;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the whisper.cpp recognizer.
 * Binds to properties prefixed with "stt.whisper".
 *
 * <p>Example application.properties:
 * <pre>
 * stt.whisper.binary-path=tools/whisper.cpp/build/bin/whisper-cli
 * stt.whisper.model-path=models/ggml-base.en.bin
 * stt.whisper.timeout-seconds=30
 * stt.whisper.language=en
 * stt.whisper.threads=4
 * stt.whisper.max-stdout-bytes=4194304
 * stt.whisper.file-timeout-seconds=600
 * stt.whisper.file-max-stdout-bytes=67108864
 * </pre>
 *
 * <p>Live chunks and whole files use separate limits: a chunk is a few seconds of audio, a file
 * can be hours.
 *
 * @param binaryPath Path to the whisper.cpp CLI executable
 * @param modelPath Path to the GGML model file (.bin)
 * @param timeoutSeconds Maximum time per live chunk recognition (in seconds)
 * @param language Language code for recognition (e.g., "en", "es", "fr")
 * @param threads Number of CPU threads to use
 * @param maxStdoutBytes Maximum stdout accumulation in bytes for a live chunk
 * @param fileTimeoutSeconds Maximum time for one whole-file recognition (in seconds)
 * @param fileMaxStdoutBytes Maximum stdout accumulation for a whole file (JSON with token data is large)
 */
@ConfigurationProperties(prefix = "stt.whisper")
@Validated
public record WhisperConfig(
        @DefaultValue("tools/whisper.cpp/build/bin/whisper-cli")
        @NotBlank(message = "Whisper binary path must not be blank")
        String binaryPath,

        @DefaultValue("models/ggml-base.en.bin")
        @NotBlank(message = "Whisper model path must not be blank")
        String modelPath,

        @DefaultValue("30")
        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @DefaultValue("en")
        @NotBlank(message = "Language code must not be blank")
        String language,

        @DefaultValue("4")
        @Positive(message = "Thread count must be positive")
        int threads,

        @DefaultValue("4194304")
        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes,

        @DefaultValue("600")
        @Positive(message = "File timeout must be positive")
        int fileTimeoutSeconds,

        @DefaultValue("67108864")
        @Positive(message = "File max stdout bytes must be positive")
        int fileMaxStdoutBytes
) {
    /**
     * Standard values: 30s and 4MB per chunk, 10 minutes and 64MB per whole file.
     */
    public static WhisperConfig defaults() {
        return new WhisperConfig("tools/whisper.cpp/build/bin/whisper-cli", "models/ggml-base.en.bin",
                30, "en", 4, 4 * 1024 * 1024, 600, 64 * 1024 * 1024);
    }
}
