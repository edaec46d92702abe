package com.phillippitts.livescribe.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Tuning for the live recognition worker: queue bounds, filters and RTF tracking.
 *
 * @param chunkQueueCapacity pending chunk bound; submissions past it are dropped
 * @param resultQueueCapacity emitted segment bound; overflow evicts the oldest
 * @param offerTimeout max time {@code submit} waits for queue space
 * @param pollTimeout worker poll interval, also the stop-check cadence
 * @param minChunkSeconds shorter chunks are skipped
 * @param silenceEnergyThreshold chunks with lower mean-square energy are skipped
 * @param minTextLength shorter recognized texts are discarded
 * @param fillers tokens that alone do not make a segment
 * @param dedupHistory number of recent accepted texts compared for duplicates
 * @param defaultConfidence reported when the recognizer provides none
 * @param rtfWindow consecutive chunks with average RTF below 1.0 before degradation is reported
 * @param joinTimeout how long stop waits for an in-flight recognition; must exceed the recognizer's
 *        per-chunk timeout or that chunk's segment is missing from the final transcript
 */
@Validated
@ConfigurationProperties(prefix = "worker")
public record WorkerProperties(
        @DefaultValue("20") @Positive int chunkQueueCapacity,
        @DefaultValue("50") @Positive int resultQueueCapacity,
        @DefaultValue("100ms") @NotNull Duration offerTimeout,
        @DefaultValue("500ms") @NotNull Duration pollTimeout,
        @DefaultValue("0.5") @DecimalMin("0.0") double minChunkSeconds,
        @DefaultValue("1e-6") @DecimalMin("0.0") double silenceEnergyThreshold,
        @DefaultValue("3") @Min(0) int minTextLength,
        @DefaultValue({"um", "uh", "ah", "hmm", "er"}) List<String> fillers,
        @DefaultValue("3") @Min(0) int dedupHistory,
        @DefaultValue("0.8") @DecimalMin("0.0") @DecimalMax("1.0") double defaultConfidence,
        @DefaultValue("5") @Positive int rtfWindow,
        @DefaultValue("35s") @NotNull Duration joinTimeout
) {
    public WorkerProperties {
        fillers = fillers == null ? List.of() : List.copyOf(fillers);
    }

    public static WorkerProperties defaults() {
        return new WorkerProperties(20, 50, Duration.ofMillis(100), Duration.ofMillis(500), 0.5, 1e-6, 3,
                List.of("um", "uh", "ah", "hmm", "er"), 3, 0.8, 5, Duration.ofSeconds(35));
    }
}
