package com.phillippitts.livescribe.service.events;

import com.phillippitts.livescribe.service.audio.source.SourceErrorEvent;
import com.phillippitts.livescribe.service.stt.RecognitionFailureEvent;
import com.phillippitts.livescribe.service.worker.RecognitionDegradedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for pipeline error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class PipelineEventsListener {
    private static final Logger LOG = LogManager.getLogger(PipelineEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onSourceError(SourceErrorEvent e) {
        if (shouldLog("source-" + e.reason())) {
            LOG.warn("Audio source error: reason={}, locator={}. Check ffmpeg and the input.",
                    e.reason(), e.locator());
        }
    }

    @EventListener
    void onRecognitionFailure(RecognitionFailureEvent e) {
        if (shouldLog("engine-" + e.engine())) {
            LOG.warn("Engine failure: engine={}, message={}, context={}", e.engine(), e.message(), e.context());
        }
    }

    @EventListener
    void onDegraded(RecognitionDegradedEvent e) {
        if (shouldLog("degraded-" + e.engine())) {
            LOG.warn("Recognition falling behind real time: engine={}, avgRtf={}, chunks={}. "
                            + "Consider a smaller model or more threads.",
                    e.engine(), String.format("%.2f", e.averageRtf()), e.consecutiveChunks());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
