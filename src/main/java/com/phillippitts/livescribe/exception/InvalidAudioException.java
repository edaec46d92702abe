package com.phillippitts.livescribe.exception;

/**
 * Thrown when audio input is unusable: missing file, wrong format, or over a provider size limit.
 */
public class InvalidAudioException extends LiveScribeException {

    private final long audioSize;
    private final String reason;

    public InvalidAudioException(String reason) {
        super("Invalid audio data: " + reason);
        this.audioSize = 0;
        this.reason = reason;
    }

    public InvalidAudioException(long audioSize, String reason) {
        super("Invalid audio data (" + audioSize + " bytes): " + reason);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public long getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }
}
