package com.phillippitts.livescribe.config.properties;

import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Rolling transcript window and rendering.
 *
 * @param maxWindowSeconds live window span measured between segment end times
 * @param paragraphGapSeconds silence longer than this starts a new paragraph
 * @param recentSeconds default span for "recent" views
 */
@Validated
@ConfigurationProperties(prefix = "transcript")
public record TranscriptProperties(
        @DefaultValue("300") @DecimalMin("1.0") double maxWindowSeconds,
        @DefaultValue("2.0") @DecimalMin("0.0") double paragraphGapSeconds,
        @DefaultValue("30") @DecimalMin("0.0") double recentSeconds
) {
    public static TranscriptProperties defaults() {
        return new TranscriptProperties(300.0, 2.0, 30.0);
    }
}
