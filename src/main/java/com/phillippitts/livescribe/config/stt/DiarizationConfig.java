package com.phillippitts.livescribe.config.stt;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Configuration for the external diarizer command ({@code stt.diarization.*}).
 *
 * <p>The command is invoked as {@code <binary-path> <extra-args...> <wav>} and must print RTTM on
 * stdout. A blank binary path disables diarization.
 *
 * @param binaryPath diarizer executable, or blank when none is installed
 * @param extraArgs arguments placed before the WAV path
 * @param timeoutSeconds maximum time per diarization call
 * @param maxStdoutBytes stdout accumulation cap
 */
@ConfigurationProperties(prefix = "stt.diarization")
@Validated
public record DiarizationConfig(
        @DefaultValue("") String binaryPath,
        @DefaultValue({}) List<String> extraArgs,
        @DefaultValue("600") @Positive int timeoutSeconds,
        @DefaultValue("1048576") @Positive int maxStdoutBytes
) {
    public DiarizationConfig {
        binaryPath = binaryPath == null ? "" : binaryPath.trim();
        extraArgs = extraArgs == null ? List.of() : List.copyOf(extraArgs);
    }

    public boolean isConfigured() {
        return !binaryPath.isEmpty();
    }
}
