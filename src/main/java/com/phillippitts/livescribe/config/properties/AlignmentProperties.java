package com.phillippitts.livescribe.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds for fuzzy timestamp alignment.
 *
 * @param maxCueChars cue prefix length searched in the corpus
 * @param minMatchRatio required match length as a fraction of the cue
 * @param minMatchChars upper cap on the required match length
 * @param partialThreshold aligned fraction below which a report is flagged partial
 * @param monotonicStepSeconds step added when a timestamp would move backwards
 */
@Validated
@ConfigurationProperties(prefix = "alignment")
public record AlignmentProperties(
        @DefaultValue("180") @Positive int maxCueChars,
        @DefaultValue("0.6") @DecimalMin("0.0") @DecimalMax("1.0") double minMatchRatio,
        @DefaultValue("30") @Positive int minMatchChars,
        @DefaultValue("0.8") @DecimalMin("0.0") @DecimalMax("1.0") double partialThreshold,
        @DefaultValue("1.0") @DecimalMin("0.0") double monotonicStepSeconds
) {
    public static AlignmentProperties defaults() {
        return new AlignmentProperties(180, 0.6, 30, 0.8, 1.0);
    }
}
