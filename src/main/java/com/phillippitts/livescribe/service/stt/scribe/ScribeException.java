package com.phillippitts.livescribe.service.stt.scribe;

import com.phillippitts.livescribe.exception.RecognitionException;
import com.phillippitts.livescribe.service.stt.EngineNames;

/**
 * Classified failure of a hosted speech-to-text call.
 */
public class ScribeException extends RecognitionException {

    /** What went wrong, used to pick the fallback failure kind. */
    public enum Reason {
        /** Every attempt hit 429, 5xx or a network error. */
        TRANSIENT_EXHAUSTED,
        /** 422 validation error, or the upload exceeds the size limit. */
        REJECTED,
        /** Any other non-success status. */
        HTTP_ERROR,
        /** Success status but the body has an unexpected shape. */
        INVALID_RESPONSE
    }

    private final Reason reason;
    private final int statusCode;

    public ScribeException(Reason reason, int statusCode, String message) {
        super(message, EngineNames.SCRIBE);
        this.reason = reason;
        this.statusCode = statusCode;
    }

    public ScribeException(Reason reason, int statusCode, String message, Throwable cause) {
        super(message, EngineNames.SCRIBE, cause);
        this.reason = reason;
        this.statusCode = statusCode;
    }

    public Reason getReason() {
        return reason;
    }

    /** Last HTTP status, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
