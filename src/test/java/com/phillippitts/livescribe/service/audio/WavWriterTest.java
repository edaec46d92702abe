package com.phillippitts.livescribe.service.audio;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class WavWriterTest {

    @TempDir
    Path tmp;

    @Test
    void writesCanonicalPcmHeader() throws IOException {
        Path wav = tmp.resolve("out.wav");
        WavWriter.writeMono16(new short[] {1, -1, 300}, 16_000, wav);

        byte[] bytes = Files.readAllBytes(wav);
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        assertThat(new String(bytes, 0, 4)).isEqualTo("RIFF");
        assertThat(new String(bytes, 8, 4)).isEqualTo("WAVE");
        assertThat(buf.getShort(AudioFormat.WAV_CHANNELS_OFFSET)).isEqualTo((short) 1);
        assertThat(buf.getInt(AudioFormat.WAV_SAMPLE_RATE_OFFSET)).isEqualTo(16_000);
        assertThat(buf.getInt(AudioFormat.WAV_BYTE_RATE_OFFSET)).isEqualTo(32_000);
        assertThat(buf.getShort(AudioFormat.WAV_BITS_PER_SAMPLE_OFFSET)).isEqualTo((short) 16);
        assertThat(buf.getInt(AudioFormat.WAV_DATA_SIZE_OFFSET)).isEqualTo(6);
        assertThat(buf.getShort(AudioFormat.WAV_HEADER_SIZE + 4)).isEqualTo((short) 300);
        assertThat(bytes).hasSize(AudioFormat.WAV_HEADER_SIZE + 6);
    }

    @Test
    void canonicalDurationIsDerivedFromFileSize() throws IOException {
        Path wav = WavWriter.writeTemp(new short[16_000], 16_000, "wavtest-");
        try {
            assertThat(AudioFormat.canonicalWavSeconds(Files.size(wav))).isEqualTo(1.0);
        } finally {
            Files.deleteIfExists(wav);
        }
        assertThat(AudioFormat.canonicalWavSeconds(10)).isZero();
    }

    @Test
    void energyDistinguishesToneFromSilence() {
        short[] silence = new short[1600];
        short[] loud = new short[1600];
        Arrays.fill(loud, (short) 16384);

        assertThat(AudioEnergy.isNearSilent(silence, 1e-6)).isTrue();
        assertThat(AudioEnergy.isNearSilent(loud, 1e-6)).isFalse();
        assertThat(AudioEnergy.rms(loud)).isEqualTo(0.5);
        assertThat(AudioEnergy.meanSquare(new short[0])).isZero();
    }
}
