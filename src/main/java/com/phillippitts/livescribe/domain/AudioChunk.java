package com.phillippitts.livescribe.domain;

import java.util.Arrays;

/**
 * Immutable slice of PCM audio handed from the decode source to the recognition worker.
 *
 * <p>Samples are 16-bit signed mono values. The start time is stream-relative, in seconds,
 * computed as {@code chunkIndex * chunkDuration} by the chunker.
 *
 * @param samples    mono 16-bit samples (copied on construction and on access)
 * @param sampleRate sample rate in Hz (must be positive)
 * @param startTime  stream-relative start time in seconds (must not be negative)
 */
public record AudioChunk(short[] samples, int sampleRate, double startTime) {

    public AudioChunk {
        if (samples == null) {
            throw new NullPointerException("samples must not be null");
        }
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        if (startTime < 0.0) {
            throw new IllegalArgumentException("startTime must not be negative, got: " + startTime);
        }
        samples = samples.clone();
    }

    @Override
    public short[] samples() {
        return samples.clone();
    }

    public int sampleCount() {
        return samples.length;
    }

    public double durationSeconds() {
        return (double) samples.length / sampleRate;
    }

    public double endTime() {
        return startTime + durationSeconds();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioChunk other)) {
            return false;
        }
        return sampleRate == other.sampleRate
                && Double.compare(startTime, other.startTime) == 0
                && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(samples);
        result = 31 * result + sampleRate;
        result = 31 * result + Double.hashCode(startTime);
        return result;
    }

    @Override
    public String toString() {
        return "AudioChunk[samples=" + samples.length + ", sampleRate=" + sampleRate
                + ", startTime=" + startTime + "]";
    }
}
