package com.phillippitts.livescribe.service.stt.whisper;

/**
 * Constants for whisper.cpp invocation and output parsing.
 *
 * @see WhisperRecognitionEngine
 * @see WhisperJsonParser
 */
final class WhisperConstants {

    /** Tool name used in logs and exceptions. */
    static final String TOOL = "whisper";

    /** Confidence assigned to file segments when whisper.cpp emits no token probabilities. */
    static final double DEFAULT_SEGMENT_CONFIDENCE = 0.8;

    /** whisper.cpp reports {@code offsets} in milliseconds. */
    static final double MILLIS_PER_SECOND = 1000.0;

    private WhisperConstants() {
        // Utility class - prevent instantiation
    }
}
