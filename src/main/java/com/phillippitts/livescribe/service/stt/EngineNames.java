package com.phillippitts.livescribe.service.stt;

/**
 * Identifiers for recognition and diarization providers, used in results, events and metrics tags.
 */
public final class EngineNames {

    /** Local whisper.cpp recognizer. */
    public static final String WHISPER = "whisper";

    /** Hosted speech-to-text service with integrated diarization. */
    public static final String SCRIBE = "scribe";

    /** External RTTM-producing diarizer command. */
    public static final String DIARIZER = "diarizer";

    private EngineNames() {
        // Utility class - prevent instantiation
    }
}
