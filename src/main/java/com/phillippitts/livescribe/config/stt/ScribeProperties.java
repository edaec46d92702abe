package com.phillippitts.livescribe.config.stt;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for the hosted speech-to-text service with integrated diarization ({@code scribe.*}).
 *
 * <p>The API key is usually supplied through the {@code SCRIBE_API_KEY} environment variable.
 * A blank key makes the integrated tier unavailable.
 *
 * @param baseUrl service base URL
 * @param apiKey API key sent as {@code xi-api-key}
 * @param modelId recognition model
 * @param diarize request speaker diarization
 * @param useMultiChannel transcribe each channel separately
 * @param numSpeakers expected speaker count, or null to let the service decide
 * @param diarizationThreshold speaker separation threshold; only sent when diarizing without a speaker count
 * @param maxRetries total attempts for transient failures
 * @param requestTimeout per-attempt HTTP timeout
 * @param connectTimeout connection timeout
 */
@ConfigurationProperties(prefix = "scribe")
@Validated
public record ScribeProperties(
        @DefaultValue("https://api.elevenlabs.io") @NotBlank String baseUrl,
        @DefaultValue("") String apiKey,
        @DefaultValue("scribe_v1") @NotBlank String modelId,
        @DefaultValue("true") boolean diarize,
        @DefaultValue("false") boolean useMultiChannel,
        @Min(1) @Max(32) Integer numSpeakers,
        @DecimalMin("0.1") @DecimalMax("0.4") Double diarizationThreshold,
        @DefaultValue("3") @Positive int maxRetries,
        @DefaultValue("5m") @NotNull Duration requestTimeout,
        @DefaultValue("30s") @NotNull Duration connectTimeout
) {
    public ScribeProperties {
        apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public boolean hasApiKey() {
        return !apiKey.isEmpty();
    }

    public static ScribeProperties withKey(String baseUrl, String apiKey) {
        return new ScribeProperties(baseUrl, apiKey, "scribe_v1", true, false, null, null, 3,
                Duration.ofMinutes(5), Duration.ofSeconds(30));
    }
}
