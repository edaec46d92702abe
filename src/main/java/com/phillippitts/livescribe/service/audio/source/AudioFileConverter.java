package com.phillippitts.livescribe.service.audio.source;

import com.phillippitts.livescribe.config.properties.FileTranscriptionProperties;
import com.phillippitts.livescribe.config.properties.StreamProperties;
import com.phillippitts.livescribe.exception.InvalidAudioException;
import com.phillippitts.livescribe.service.process.ProcessRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Converts an arbitrary local audio or video file to a canonical mono 16-bit WAV with ffmpeg.
 *
 * <p>Provider tiers take this WAV as input. The returned file is a temp file owned by the caller.
 */
public class AudioFileConverter {

    private static final Logger LOG = LogManager.getLogger(AudioFileConverter.class);
    private static final int STDOUT_CAP_BYTES = 16 * 1024;

    private final StreamProperties streamProperties;
    private final FileTranscriptionProperties fileProperties;
    private final ProcessRunner runner;

    public AudioFileConverter(StreamProperties streamProperties,
                              FileTranscriptionProperties fileProperties,
                              ProcessRunner runner) {
        this.streamProperties = Objects.requireNonNull(streamProperties);
        this.fileProperties = Objects.requireNonNull(fileProperties);
        this.runner = Objects.requireNonNull(runner);
    }

    /**
     * @param input existing media file
     * @return path of a new temp WAV
     * @throws InvalidAudioException if the input is missing or empty
     * @throws com.phillippitts.livescribe.exception.RecognitionException if ffmpeg fails
     */
    public Path toCanonicalWav(Path input) {
        Objects.requireNonNull(input, "input");
        if (!Files.isRegularFile(input)) {
            throw new InvalidAudioException("input file not found: " + input.getFileName());
        }
        Path wav;
        try {
            if (Files.size(input) == 0) {
                throw new InvalidAudioException(0, "input file is empty");
            }
            wav = Files.createTempFile("livescribe-", ".wav");
        } catch (IOException e) {
            throw new InvalidAudioException("cannot prepare conversion: " + e.getMessage());
        }
        try {
            runner.run(FfmpegCommands.convertToWav(streamProperties.ffmpegPath(), input, wav,
                            streamProperties.sampleRate()),
                    null, fileProperties.convertTimeout(), STDOUT_CAP_BYTES, "ffmpeg");
        } catch (RuntimeException e) {
            deleteQuietly(wav);
            throw e;
        }
        LOG.debug("Converted {} to canonical WAV {}", input.getFileName(), wav.getFileName());
        return wav;
    }

    /** Deletes a temp file, logging instead of failing. */
    public static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debug("Could not delete temp file {}: {}", path, e.toString());
        }
    }
}
