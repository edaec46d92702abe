package com.phillippitts.livescribe.service.fallback;

import com.phillippitts.livescribe.service.fallback.event.AllProvidersFailedEvent;
import com.phillippitts.livescribe.service.fallback.event.ProviderFallbackEvent;
import com.phillippitts.livescribe.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Logs provider fallback events succinctly (no transcript text) and counts them. */
@Component
class FallbackEventsListener {
    private static final Logger LOG = LogManager.getLogger(FallbackEventsListener.class);

    private final PipelineMetrics metrics;

    FallbackEventsListener(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onFallback(ProviderFallbackEvent e) {
        LOG.warn("Provider fallback: tier={}, kind={}, reason={}", e.tier(), e.kind(), e.reason());
        metrics.incrementFallback(e.tier(), e.kind());
    }

    @EventListener
    void onAllFailed(AllProvidersFailedEvent e) {
        LOG.error("All provider tiers failed: reason={}, attempts={}", e.reason(), e.attempts());
        metrics.incrementExhausted();
    }
}
