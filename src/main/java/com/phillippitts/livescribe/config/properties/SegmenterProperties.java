package com.phillippitts.livescribe.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Word-to-turn grouping thresholds.
 *
 * @param maxGapSeconds a silence longer than this between words closes the turn
 * @param minMergeMs turns shorter than this merge into a same-speaker predecessor
 * @param defaultSpeaker label used when a word has neither speaker nor channel
 */
@Validated
@ConfigurationProperties(prefix = "segmenter")
public record SegmenterProperties(
        @DefaultValue("0.75") @DecimalMin("0.0") double maxGapSeconds,
        @DefaultValue("300") @Min(0) int minMergeMs,
        @DefaultValue("speaker_1") @NotBlank String defaultSpeaker
) {
    public static SegmenterProperties defaults() {
        return new SegmenterProperties(0.75, 300, "speaker_1");
    }
}
