package com.phillippitts.livescribe.service.stt.whisper;

import com.phillippitts.livescribe.config.stt.WhisperConfig;
import com.phillippitts.livescribe.domain.AudioChunk;
import com.phillippitts.livescribe.domain.RecognitionResult;
import com.phillippitts.livescribe.exception.RecognitionException;
import com.phillippitts.livescribe.service.audio.WavWriter;
import com.phillippitts.livescribe.service.process.ProcessOutput;
import com.phillippitts.livescribe.service.process.ProcessRunner;
import com.phillippitts.livescribe.service.stt.AbstractRecognitionEngine;
import com.phillippitts.livescribe.service.stt.EngineNames;
import com.phillippitts.livescribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recognizer backed by the whisper.cpp command-line binary.
 *
 * <p><b>Architecture:</b>
 * <ul>
 *   <li>Live chunks are written to a temporary WAV with {@link WavWriter}</li>
 *   <li>whisper.cpp runs via {@link ProcessRunner}, JSON on stdout. Chunks use the per-chunk
 *       timeout and stdout cap, whole files the file limits</li>
 *   <li>stdout is parsed by {@link WhisperJsonParser}; temp files are always deleted</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> each call owns its temp file and subprocess; concurrency is bounded by
 * the callers (one live worker thread, the bounded provider executor).
 *
 * <p><b>Privacy:</b> never logs recognized text at INFO level.
 */
public final class WhisperRecognitionEngine extends AbstractRecognitionEngine {

    private static final Logger LOG = LogManager.getLogger(WhisperRecognitionEngine.class);

    private final WhisperConfig cfg;
    private final ProcessRunner runner;
    private final ApplicationEventPublisher publisher;

    public WhisperRecognitionEngine(WhisperConfig cfg, ProcessRunner runner, ApplicationEventPublisher publisher) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.publisher = publisher;
    }

    @Override
    protected void doInitialize() {
        if (!Files.isRegularFile(Paths.get(cfg.modelPath()))) {
            RecognitionException e = new RecognitionException("Whisper model not found: " + cfg.modelPath(),
                    getEngineName());
            throw handleRecognitionError(e, publisher, context());
        }
        LOG.info("Whisper engine initialized: bin={}, model={}, timeout={}s (file {}s), lang={}, threads={}",
                cfg.binaryPath(), cfg.modelPath(), cfg.timeoutSeconds(), cfg.fileTimeoutSeconds(),
                cfg.language(), cfg.threads());
    }

    @Override
    public boolean isAvailable() {
        if (!Files.isRegularFile(Paths.get(cfg.modelPath()))) {
            return false;
        }
        Path binary = Paths.get(cfg.binaryPath());
        // bare command names resolve on PATH at launch time
        if (binary.getParent() == null) {
            return true;
        }
        return Files.isExecutable(binary);
    }

    @Override
    public RecognitionResult recognize(AudioChunk chunk) {
        if (chunk == null || chunk.sampleCount() == 0) {
            throw new IllegalArgumentException("chunk must not be null or empty");
        }
        ensureInitialized();
        Path wav = null;
        try {
            wav = WavWriter.writeTemp(chunk.samples(), chunk.sampleRate(), "whisper-");
            return recognizeWav(wav, Duration.ofSeconds(cfg.timeoutSeconds()), cfg.maxStdoutBytes());
        } catch (IOException e) {
            throw handleRecognitionError(e, publisher, context());
        } finally {
            deleteQuietly(wav);
        }
    }

    @Override
    public RecognitionResult recognizeFile(Path wav) {
        Objects.requireNonNull(wav, "wav");
        ensureInitialized();
        return recognizeWav(wav, Duration.ofSeconds(cfg.fileTimeoutSeconds()), cfg.fileMaxStdoutBytes());
    }

    private RecognitionResult recognizeWav(Path wav, Duration timeout, int maxStdoutBytes) {
        try {
            ProcessOutput out = runner.run(buildCommand(wav), null, timeout, maxStdoutBytes, WhisperConstants.TOOL);
            RecognitionResult result = WhisperJsonParser.parse(out.stdout(), getEngineName());
            LOG.debug("Whisper recognized {} in {} ms (chars={}, preview='{}')",
                    wav.getFileName(), out.durationMs(), result.text().length(),
                    LogSanitizer.preview(result.text()));
            return result;
        } catch (RuntimeException e) {
            throw handleRecognitionError(e, publisher, context());
        }
    }

    List<String> buildCommand(Path wav) {
        List<String> cmd = new ArrayList<>();
        cmd.add(cfg.binaryPath());
        cmd.add("-m");
        cmd.add(cfg.modelPath());
        cmd.add("-f");
        cmd.add(wav.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(cfg.language());
        cmd.add("-oj");
        cmd.add("-of");
        cmd.add("stdout");
        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));
        return cmd;
    }

    private Map<String, String> context() {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put("binaryPath", cfg.binaryPath());
        ctx.put("modelPath", cfg.modelPath());
        return ctx;
    }

    private static void deleteQuietly(Path wav) {
        if (wav == null) {
            return;
        }
        try {
            Files.deleteIfExists(wav);
        } catch (IOException e) {
            LOG.debug("Temp WAV cleanup failed for {}: {}", wav, e.toString());
        }
    }

    @Override
    public String getEngineName() {
        return EngineNames.WHISPER;
    }

    @Override
    protected void doClose() {
        LOG.info("Whisper engine closed");
    }
}
