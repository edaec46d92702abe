package com.phillippitts.livescribe.exception;

/**
 * Base exception for all liveScribe pipeline errors.
 * All domain exceptions extend this class so callers can handle them in one place.
 */
public class LiveScribeException extends RuntimeException {

    public LiveScribeException(String message) {
        super(message);
    }

    public LiveScribeException(String message, Throwable cause) {
        super(message, cause);
    }

    public LiveScribeException(Throwable cause) {
        super(cause);
    }
}
