package com.phillippitts.livescribe.service.fallback;

import com.phillippitts.livescribe.exception.AllProvidersExhaustedException;
import com.phillippitts.livescribe.exception.AllProvidersExhaustedException.Attempt;
import com.phillippitts.livescribe.service.fallback.event.AllProvidersFailedEvent;
import com.phillippitts.livescribe.service.fallback.event.ProviderFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tries provider tiers in preference order until one yields a transcript.
 *
 * <p>Each tier gets exactly one attempt per request, on the same input. Tiers that are unavailable
 * when the chain is built are left out for its whole lifetime. A failing tier publishes a
 * {@link ProviderFallbackEvent}; when every tier fails the chain publishes
 * {@link AllProvidersFailedEvent} and returns a failure outcome instead of throwing.
 */
public class ProviderFallbackChain {

    private static final Logger LOG = LogManager.getLogger(ProviderFallbackChain.class);

    private final List<ProviderTier> chain;
    private final ApplicationEventPublisher publisher;

    public ProviderFallbackChain(List<ProviderTier> tiers, ApplicationEventPublisher publisher) {
        Objects.requireNonNull(tiers, "tiers");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        List<ProviderTier> available = new ArrayList<>();
        for (ProviderTier tier : tiers) {
            if (tier.isAvailable()) {
                available.add(tier);
            } else {
                LOG.warn("Provider tier {} unavailable; excluded from fallback chain", tier.name());
            }
        }
        this.chain = List.copyOf(available);
        LOG.info("Fallback chain: {}", tierNames());
    }

    public FallbackOutcome transcribe(Path wav) {
        Objects.requireNonNull(wav, "wav");
        List<Attempt> failures = new ArrayList<>();
        for (ProviderTier tier : chain) {
            ProviderResult result = attempt(tier, wav);
            if (result.isOk()) {
                LOG.info("Transcribed via {} (entries={}, fallbacks={})",
                        tier.name(), result.entries().size(), failures.size());
                return FallbackOutcome.success(tier.name(), result.entries(), failures);
            }
            String reason = reasonFor(tier.name(), result);
            LOG.warn("Provider tier {} failed: kind={}, reason={}", tier.name(), result.failure(), reason);
            failures.add(new Attempt(tier.name(), result.failure().name(), reason));
            publisher.publishEvent(new ProviderFallbackEvent(
                    tier.name(), result.failure().tag(), reason, Instant.now()));
        }
        AllProvidersExhaustedException error = new AllProvidersExhaustedException(failures);
        publisher.publishEvent(new AllProvidersFailedEvent(
                chain.isEmpty() ? "no provider available" : "all providers failed",
                failures.size(), Instant.now()));
        return FallbackOutcome.failure(error);
    }

    /**
     * Picks tiers by configured name, in the configured order. Unknown or repeated names are
     * skipped with a warning; tiers not named are left out.
     */
    public static List<ProviderTier> inPreferenceOrder(Collection<? extends ProviderTier> tiers, List<String> names) {
        Map<String, ProviderTier> byName = new LinkedHashMap<>();
        for (ProviderTier tier : tiers) {
            byName.put(tier.name(), tier);
        }
        List<ProviderTier> ordered = new ArrayList<>();
        for (String name : names) {
            ProviderTier tier = byName.remove(name.trim());
            if (tier == null) {
                LOG.warn("Unknown or repeated provider tier '{}' in fallback.tiers; ignored", name);
            } else {
                ordered.add(tier);
            }
        }
        return ordered;
    }

    public List<String> tierNames() {
        return chain.stream().map(ProviderTier::name).toList();
    }

    private static ProviderResult attempt(ProviderTier tier, Path wav) {
        try {
            ProviderResult result = tier.transcribe(wav);
            if (result == null) {
                return ProviderResult.err(tier.name(), FailureKind.ERROR, "tier returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            LOG.error("Provider tier {} threw unexpectedly", tier.name(), e);
            return ProviderResult.err(tier.name(), FailureKind.ERROR, e.getClass().getSimpleName());
        }
    }

    static String reasonFor(String tier, ProviderResult result) {
        if (result.failure() == FailureKind.TRANSIENT_EXHAUSTED) {
            return tier + " exhausted retries";
        }
        String message = result.message();
        return message == null || message.isBlank()
                ? tier + " " + result.failure().tag()
                : tier + " " + result.failure().tag() + ": " + message;
    }
}
