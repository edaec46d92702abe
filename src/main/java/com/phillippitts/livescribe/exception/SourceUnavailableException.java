package com.phillippitts.livescribe.exception;

/**
 * Thrown when the decode process cannot be started or exits before producing audio.
 * Terminal at session start.
 */
public class SourceUnavailableException extends LiveScribeException {

    private final String locator;

    public SourceUnavailableException(String message, String locator) {
        super(message + " (source: " + locator + ")");
        this.locator = locator;
    }

    public SourceUnavailableException(String message, String locator, Throwable cause) {
        super(message + " (source: " + locator + ")", cause);
        this.locator = locator;
    }

    public String getLocator() {
        return locator;
    }
}
