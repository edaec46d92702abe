package com.phillippitts.livescribe.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the transcription pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Chunk flow through the live worker (submitted, dropped, failed, filtered by reason)</li>
 *   <li>Recognition latency per engine and real-time factor</li>
 *   <li>Provider fallbacks per tier and fully exhausted chains</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
public class PipelineMetrics {

    static final String METRIC_PREFIX = "livescribe.pipeline";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementChunksSubmitted() {
        Counter.builder(METRIC_PREFIX + ".chunks.submitted")
                .description("Chunks accepted into the recognition queue")
                .register(registry)
                .increment();
    }

    /**
     * Counts a chunk dropped because the recognition queue was full.
     */
    public void incrementChunksDropped() {
        Counter.builder(METRIC_PREFIX + ".chunks.dropped")
                .description("Chunks dropped on a full recognition queue")
                .register(registry)
                .increment();
    }

    public void incrementChunksFailed(String engineName) {
        Counter.builder(METRIC_PREFIX + ".chunks.failed")
                .description("Chunks whose recognition threw")
                .tag("engine", engineName)
                .register(registry)
                .increment();
    }

    /**
     * @param reason short, fixed reason (too_short, silence, empty, filler, duplicate)
     */
    public void incrementFiltered(String reason) {
        Counter.builder(METRIC_PREFIX + ".chunks.filtered")
                .description("Chunks or results discarded by the worker filters")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordRecognitionLatency(String engineName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".recognition.latency")
                .description("Time taken to recognize one chunk or file")
                .tag("engine", engineName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Records audio seconds processed per wall-clock second; values below 1.0 mean falling behind.
     */
    public void recordRealTimeFactor(double rtf) {
        DistributionSummary.builder(METRIC_PREFIX + ".rtf")
                .description("Real-time factor per recognized chunk")
                .register(registry)
                .record(rtf);
    }

    public void incrementFallback(String tier, String kind) {
        Counter.builder(METRIC_PREFIX + ".fallback")
                .description("Provider tiers that failed and handed over to the next")
                .tag("tier", tier)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void incrementExhausted() {
        Counter.builder(METRIC_PREFIX + ".fallback.exhausted")
                .description("Requests for which every provider tier failed")
                .register(registry)
                .increment();
    }
}
