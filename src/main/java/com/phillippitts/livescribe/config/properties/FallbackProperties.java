package com.phillippitts.livescribe.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Provider fallback chain wiring.
 *
 * <p>{@code fallback.tiers} lists tier names in preference order. Unknown names are ignored with a
 * warning; tiers that report themselves unavailable at startup are skipped.
 *
 * @param tiers tier names in preference order
 * @param parallelTimeout bound on the parallel recognition + diarization tier
 */
@Validated
@ConfigurationProperties(prefix = "fallback")
public record FallbackProperties(
        @DefaultValue({"integrated-diarization", "recognition-with-diarization", "recognition-only"})
        List<String> tiers,
        @DefaultValue("10m") @NotNull Duration parallelTimeout
) {
    public FallbackProperties {
        tiers = tiers == null ? List.of() : List.copyOf(tiers);
    }
}
