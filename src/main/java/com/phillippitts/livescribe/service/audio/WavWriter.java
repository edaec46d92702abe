package com.phillippitts.livescribe.service.audio;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes mono 16-bit PCM WAV files for tools that only accept files (whisper.cpp, diarizers).
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Writes {@code samples} as a mono 16-bit little-endian WAV at {@code sampleRate}.
     *
     * @param samples mono samples
     * @param sampleRate sample rate in Hz
     * @param wavPath output path (created or overwritten)
     * @throws IllegalStateException if the file cannot be written
     */
    public static void writeMono16(short[] samples, int sampleRate, Path wavPath) {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive");
        }
        int dataSize = samples.length * AudioFormat.BLOCK_ALIGN;
        ByteBuffer buf = ByteBuffer.allocate(AudioFormat.WAV_HEADER_SIZE + dataSize)
                .order(ByteOrder.LITTLE_ENDIAN);
        buf.put(new byte[] {'R', 'I', 'F', 'F'});
        buf.putInt(36 + dataSize);
        buf.put(new byte[] {'W', 'A', 'V', 'E'});
        buf.put(new byte[] {'f', 'm', 't', ' '});
        buf.putInt(16);                                        // PCM fmt chunk size
        buf.putShort((short) 1);                               // PCM
        buf.putShort((short) AudioFormat.CHANNELS);
        buf.putInt(sampleRate);
        buf.putInt(sampleRate * AudioFormat.BLOCK_ALIGN);      // byte rate
        buf.putShort((short) AudioFormat.BLOCK_ALIGN);
        buf.putShort((short) AudioFormat.BITS_PER_SAMPLE);
        buf.put(new byte[] {'d', 'a', 't', 'a'});
        buf.putInt(dataSize);
        for (short s : samples) {
            buf.putShort(s);
        }
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            os.write(buf.array());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write WAV file to " + wavPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes the samples to a new temp file. The caller owns deletion.
     */
    public static Path writeTemp(short[] samples, int sampleRate, String prefix) throws IOException {
        Path wav = Files.createTempFile(prefix, ".wav");
        writeMono16(samples, sampleRate, wav);
        return wav;
    }
}
