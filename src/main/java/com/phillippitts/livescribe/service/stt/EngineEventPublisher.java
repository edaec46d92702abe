package com.phillippitts.livescribe.service.stt;

import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Null-safe publishing of {@link RecognitionFailureEvent}s, so engines work without a publisher in tests.
 */
public final class EngineEventPublisher {

    private EngineEventPublisher() {
        // Utility class - prevent instantiation
    }

    /**
     * Publishes a failure event if a publisher is available.
     *
     * @param publisher the Spring event publisher (may be null)
     * @param engineName engine that failed
     * @param message short description
     * @param cause failure cause (may be null)
     * @param context technical key/values (may be null)
     */
    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String engineName,
                                      String message,
                                      Throwable cause,
                                      Map<String, String> context) {
        if (publisher != null) {
            publisher.publishEvent(new RecognitionFailureEvent(engineName, Instant.now(), message, cause, context));
        }
    }

    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String engineName,
                                      String message,
                                      Throwable cause) {
        publishFailure(publisher, engineName, message, cause, null);
    }
}
