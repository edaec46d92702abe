package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.domain.Transcript;
import com.phillippitts.livescribe.exception.RecognitionException;
import com.phillippitts.livescribe.exception.SourceUnavailableException;
import com.phillippitts.livescribe.service.audio.source.AudioFileConverter;
import com.phillippitts.livescribe.service.fallback.FallbackOutcome;
import com.phillippitts.livescribe.service.fallback.ProviderFallbackChain;
import com.phillippitts.livescribe.service.transcript.TranscriptFiles;
import com.phillippitts.livescribe.service.transcript.TranscriptWriter;
import com.phillippitts.livescribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Transcribes a whole media file: convert to canonical WAV, run the provider fallback chain, persist.
 *
 * <p>Whatever the chain returns is persisted; when every provider fails nothing is written and the
 * failure outcome is returned to the caller rather than thrown.
 */
public class FileTranscriptionService {

    private static final Logger LOG = LogManager.getLogger(FileTranscriptionService.class);

    static final String SESSION_PREFIX = "file";

    private final AudioFileConverter converter;
    private final ProviderFallbackChain chain;
    private final TranscriptWriter writer;
    private final Clock clock;

    public FileTranscriptionService(AudioFileConverter converter,
                                    ProviderFallbackChain chain,
                                    TranscriptWriter writer,
                                    Clock clock) {
        this.converter = Objects.requireNonNull(converter, "converter");
        this.chain = Objects.requireNonNull(chain, "chain");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    /**
     * @throws com.phillippitts.livescribe.exception.InvalidAudioException if the input is missing or empty
     * @throws SourceUnavailableException if the input cannot be decoded
     */
    public FileTranscriptionResult transcribe(Path input) {
        Objects.requireNonNull(input, "input");
        String sessionId = SessionIds.next(SESSION_PREFIX, clock);
        ThreadContext.put(LiveTranscriptionSession.MDC_SESSION_ID, sessionId);
        long t0 = System.nanoTime();
        Path wav = null;
        try {
            try {
                wav = converter.toCanonicalWav(input);
            } catch (RecognitionException e) {
                throw new SourceUnavailableException("Cannot decode " + input.getFileName() + ": " + e.getMessage(),
                        input.toString(), e);
            }
            FallbackOutcome outcome = chain.transcribe(wav);
            if (!outcome.isSuccess()) {
                LOG.error("File transcription failed after {} ms: {}",
                        TimeUtils.elapsedMillis(t0), outcome.error().getMessage());
                return new FileTranscriptionResult(sessionId, outcome, null, null);
            }
            Transcript transcript = Transcript.start(sessionId);
            transcript.setProvider(outcome.provider());
            transcript.appendAll(outcome.entries());
            TranscriptFiles files = persist(transcript);
            LOG.info("File transcribed via {} in {} ms: entries={}, chars={}", outcome.provider(),
                    TimeUtils.elapsedMillis(t0), transcript.size(), transcript.fullText().length());
            return new FileTranscriptionResult(sessionId, outcome, transcript, files);
        } finally {
            if (wav != null) {
                AudioFileConverter.deleteQuietly(wav);
            }
            ThreadContext.remove(LiveTranscriptionSession.MDC_SESSION_ID);
        }
    }

    private TranscriptFiles persist(Transcript transcript) {
        try {
            return writer.write(transcript);
        } catch (IOException e) {
            LOG.error("Failed to persist transcript {}", transcript.sessionId(), e);
            return null;
        }
    }
}
