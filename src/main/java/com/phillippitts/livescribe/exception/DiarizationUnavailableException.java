package com.phillippitts.livescribe.exception;

/**
 * Thrown when a diarization pass is requested but no diarizer is configured or it failed.
 * The pipeline degrades to recognition-only output.
 */
public class DiarizationUnavailableException extends LiveScribeException {

    public DiarizationUnavailableException(String message) {
        super(message);
    }

    public DiarizationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
