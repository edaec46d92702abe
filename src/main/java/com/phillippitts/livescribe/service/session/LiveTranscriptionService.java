package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.config.properties.FileTranscriptionProperties;
import com.phillippitts.livescribe.config.properties.StreamProperties;
import com.phillippitts.livescribe.config.properties.TranscriptProperties;
import com.phillippitts.livescribe.config.properties.WorkerProperties;
import com.phillippitts.livescribe.service.audio.source.StreamAudioSource;
import com.phillippitts.livescribe.service.metrics.PipelineMetrics;
import com.phillippitts.livescribe.service.process.ProcessFactory;
import com.phillippitts.livescribe.service.stt.RecognitionEngine;
import com.phillippitts.livescribe.service.transcript.TranscriptAssembler;
import com.phillippitts.livescribe.service.transcript.TranscriptWriter;
import com.phillippitts.livescribe.service.worker.RecognitionWorker;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Objects;

/**
 * Opens live transcription sessions over a shared, once-initialized recognition engine.
 *
 * <p>Every session gets its own decode source, worker and assembler. A locator naming a local
 * regular file is chunked with {@code file.chunk-seconds}; anything else uses
 * {@code stream.chunk-seconds}.
 */
public class LiveTranscriptionService {

    static final String SESSION_PREFIX = "live";

    private final RecognitionEngine engine;
    private final ProcessFactory processFactory;
    private final StreamProperties streamProperties;
    private final FileTranscriptionProperties fileProperties;
    private final WorkerProperties workerProperties;
    private final TranscriptProperties transcriptProperties;
    private final PipelineMetrics metrics;
    private final TranscriptWriter writer;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public LiveTranscriptionService(RecognitionEngine engine,
                                    ProcessFactory processFactory,
                                    StreamProperties streamProperties,
                                    FileTranscriptionProperties fileProperties,
                                    WorkerProperties workerProperties,
                                    TranscriptProperties transcriptProperties,
                                    PipelineMetrics metrics,
                                    TranscriptWriter writer,
                                    ApplicationEventPublisher publisher,
                                    Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.streamProperties = Objects.requireNonNull(streamProperties, "streamProperties");
        this.fileProperties = Objects.requireNonNull(fileProperties, "fileProperties");
        this.workerProperties = Objects.requireNonNull(workerProperties, "workerProperties");
        this.transcriptProperties = Objects.requireNonNull(transcriptProperties, "transcriptProperties");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.writer = writer;
        this.publisher = publisher;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    /**
     * Creates an unstarted session for {@code locator} (URL, device or file path understood by ffmpeg).
     */
    public LiveTranscriptionSession open(String locator) {
        Objects.requireNonNull(locator, "locator");
        StreamProperties props = isLocalFile(locator)
                ? streamProperties.withChunkSeconds(fileProperties.chunkSeconds())
                : streamProperties;
        StreamAudioSource source = new StreamAudioSource(locator, props, processFactory, publisher);
        RecognitionWorker worker = new RecognitionWorker(engine, workerProperties, metrics, publisher);
        TranscriptAssembler assembler = new TranscriptAssembler(transcriptProperties);
        return new LiveTranscriptionSession(SessionIds.next(SESSION_PREFIX, clock), source, worker, assembler,
                writer, engine.getEngineName());
    }

    /**
     * Opens and starts a session.
     *
     * @throws com.phillippitts.livescribe.exception.SourceUnavailableException if decoding cannot start
     */
    public LiveTranscriptionSession start(String locator) {
        LiveTranscriptionSession session = open(locator);
        session.start();
        return session;
    }

    static boolean isLocalFile(String locator) {
        if (locator.contains("://")) {
            return false;
        }
        try {
            Path p = Paths.get(locator);
            return Files.isRegularFile(p);
        } catch (RuntimeException e) {
            return false;
        }
    }
}
