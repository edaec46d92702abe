package com.phillippitts.livescribe.service.audio;

import com.phillippitts.livescribe.domain.AudioChunk;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a continuous PCM16LE mono byte stream into fixed-duration {@link AudioChunk}s.
 *
 * <p>Each chunk is stamped {@code chunkIndex * chunkSeconds}. Chunks do not overlap; callers that
 * want overlap read {@link #lastSeconds(double)}, backed by a drop-oldest ring of recent audio.
 *
 * <p><b>Threading:</b> {@link #accept} and {@link #flush} are called by a single feeding thread
 * (the decode loop). {@link #lastSeconds(double)} may be called from any thread.
 */
public final class AudioChunker {

    private static final Logger LOG = LogManager.getLogger(AudioChunker.class);

    private final int sampleRate;
    private final double chunkSeconds;
    private final int samplesPerChunk;
    private final int minTailSamples;
    private final OverlapBuffer recent;

    private short[] pending;
    private int pendingCount;
    private int carryByte = -1;
    private long chunkIndex;

    /**
     * @param sampleRate sample rate of the incoming stream
     * @param chunkSeconds chunk duration (e.g. 3.0 live, 5.0 file)
     * @param overlapBufferSeconds capacity of the "last N seconds" ring
     * @param minTailSeconds final partial chunks at or below this length are dropped
     */
    public AudioChunker(int sampleRate, double chunkSeconds, double overlapBufferSeconds, double minTailSeconds) {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive");
        }
        if (chunkSeconds <= 0) {
            throw new IllegalArgumentException("chunkSeconds must be positive");
        }
        if (minTailSeconds < 0) {
            throw new IllegalArgumentException("minTailSeconds must not be negative");
        }
        this.sampleRate = sampleRate;
        this.chunkSeconds = chunkSeconds;
        this.samplesPerChunk = Math.max(1, AudioFormat.samplesFor(chunkSeconds, sampleRate));
        this.minTailSamples = AudioFormat.samplesFor(minTailSeconds, sampleRate);
        this.recent = new OverlapBuffer(Math.max(1, AudioFormat.samplesFor(overlapBufferSeconds, sampleRate)));
        this.pending = new short[samplesPerChunk];
    }

    /**
     * Feeds raw little-endian bytes. An odd trailing byte is carried into the next call.
     *
     * @return chunks completed by this call, in stream order (often empty)
     */
    public List<AudioChunk> accept(byte[] pcm, int off, int len) {
        if (len <= 0) {
            return List.of();
        }
        List<AudioChunk> completed = new ArrayList<>(1);
        int i = off;
        int end = off + len;
        if (carryByte >= 0) {
            appendSample((short) ((carryByte & 0xFF) | (pcm[i] << 8)), completed);
            carryByte = -1;
            i++;
        }
        for (; i + 1 < end; i += 2) {
            appendSample((short) ((pcm[i] & 0xFF) | (pcm[i + 1] << 8)), completed);
        }
        if (i < end) {
            carryByte = pcm[i] & 0xFF;
        }
        return completed;
    }

    /**
     * Emits the remaining partial chunk if it is longer than the minimum tail; otherwise drops it.
     */
    public Optional<AudioChunk> flush() {
        carryByte = -1;
        if (pendingCount == 0) {
            return Optional.empty();
        }
        if (pendingCount <= minTailSamples) {
            LOG.debug("Dropping {} ms tail chunk (below minimum)", pendingCount * 1000L / sampleRate);
            pendingCount = 0;
            return Optional.empty();
        }
        short[] tail = new short[pendingCount];
        System.arraycopy(pending, 0, tail, 0, pendingCount);
        pendingCount = 0;
        return Optional.of(emit(tail));
    }

    /**
     * Most recent {@code seconds} of audio seen by this chunker, oldest sample first.
     * Capped by the configured overlap buffer capacity.
     */
    public short[] lastSeconds(double seconds) {
        return recent.tail(AudioFormat.samplesFor(seconds, sampleRate));
    }

    public long chunksEmitted() {
        return chunkIndex;
    }

    public int sampleRate() {
        return sampleRate;
    }

    public double chunkSeconds() {
        return chunkSeconds;
    }

    private void appendSample(short sample, List<AudioChunk> completed) {
        pending[pendingCount++] = sample;
        if (pendingCount == samplesPerChunk) {
            completed.add(emit(pending));
            pending = new short[samplesPerChunk];
            pendingCount = 0;
        }
    }

    private AudioChunk emit(short[] samples) {
        recent.write(samples, 0, samples.length);
        double startTime = chunkIndex * chunkSeconds;
        chunkIndex++;
        return new AudioChunk(samples, sampleRate, startTime);
    }
}
