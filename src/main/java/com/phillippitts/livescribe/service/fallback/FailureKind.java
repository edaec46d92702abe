package com.phillippitts.livescribe.service.fallback;

import java.util.Locale;

/**
 * Why a provider tier produced no transcript.
 */
public enum FailureKind {
    /** Transient errors (429, 5xx, I/O) persisted through every retry. */
    TRANSIENT_EXHAUSTED,
    /** The provider answered with a body that could not be parsed. */
    INVALID_RESPONSE,
    /** The provider succeeded but returned nothing usable. */
    EMPTY_RESULT,
    /** The provider refused the request or the audio (validation, size limits). */
    REJECTED,
    /** Recognition worked but the separate diarization pass did not. */
    DIARIZATION_UNAVAILABLE,
    /** The provider is not configured or not installed. */
    UNAVAILABLE,
    ERROR;

    /** Lower-case tag value for metrics and logs. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
