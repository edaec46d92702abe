package com.phillippitts.livescribe.service.stt;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a recognizer or diarizer call fails (timeout, non-zero exit, bad response).
 *
 * <p>Context carries technical diagnostics only, never transcript text.
 */
public record RecognitionFailureEvent(
        String engine,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public RecognitionFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
