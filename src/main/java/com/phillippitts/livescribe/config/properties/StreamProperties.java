package com.phillippitts.livescribe.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the live decode source and chunker.
 *
 * <p>Example application.properties:
 * <pre>
 * stream.ffmpeg-path=ffmpeg
 * stream.chunk-seconds=3.0
 * stream.realtime=false
 * stream.terminate-timeout=3s
 * </pre>
 *
 * @param ffmpegPath ffmpeg executable (resolved on PATH when not absolute)
 * @param sampleRate decode output sample rate in Hz
 * @param chunkSeconds chunk duration for live sources
 * @param realtime pace input at native rate ({@code -re}); useful when replaying files as live
 * @param terminateTimeout graceful window after asking ffmpeg to stop
 * @param threadJoinTimeout bound on joining the decode thread
 * @param minTailSeconds final partial chunks at or below this length are dropped
 * @param overlapBufferSeconds capacity of the "last N seconds" ring
 * @param readBufferBytes bytes per read from the decode pipe
 */
@Validated
@ConfigurationProperties(prefix = "stream")
public record StreamProperties(
        @DefaultValue("ffmpeg") @NotBlank String ffmpegPath,
        @DefaultValue("16000") @Positive int sampleRate,
        @DefaultValue("3.0") @DecimalMin("0.1") double chunkSeconds,
        @DefaultValue("false") boolean realtime,
        @DefaultValue("3s") @NotNull Duration terminateTimeout,
        @DefaultValue("1s") @NotNull Duration threadJoinTimeout,
        @DefaultValue("0.5") @DecimalMin("0.0") double minTailSeconds,
        @DefaultValue("10") @DecimalMin("0.0") double overlapBufferSeconds,
        @DefaultValue("4096") @Positive int readBufferBytes
) {

    /** Defaults matching application.properties; used by tests and manual wiring. */
    public static StreamProperties defaults() {
        return new StreamProperties("ffmpeg", 16_000, 3.0, false, Duration.ofSeconds(3),
                Duration.ofSeconds(1), 0.5, 10.0, 4096);
    }

    public StreamProperties withChunkSeconds(double seconds) {
        return new StreamProperties(ffmpegPath, sampleRate, seconds, realtime, terminateTimeout,
                threadJoinTimeout, minTailSeconds, overlapBufferSeconds, readBufferBytes);
    }
}
