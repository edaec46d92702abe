package com.phillippitts.livescribe.exception;

/**
 * Thrown when a single recognition call fails.
 * This may occur due to engine errors, timeout, or an unparseable provider response.
 */
public class RecognitionException extends LiveScribeException {

    private final String engineName;

    public RecognitionException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public RecognitionException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public RecognitionException(String message, Throwable cause) {
        super(message, cause);
        this.engineName = "unknown";
    }

    public RecognitionException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
