package com.phillippitts.livescribe.service.stt.diarization;

import com.phillippitts.livescribe.config.stt.DiarizationConfig;
import com.phillippitts.livescribe.domain.DiarizationInterval;
import com.phillippitts.livescribe.exception.DiarizationUnavailableException;
import com.phillippitts.livescribe.service.process.ProcessOutput;
import com.phillippitts.livescribe.service.process.ProcessRunner;
import com.phillippitts.livescribe.service.stt.EngineEventPublisher;
import com.phillippitts.livescribe.service.stt.EngineNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a configured external diarizer ({@code <binary> <extra-args...> <wav>}) and parses its
 * RTTM stdout.
 */
public final class CommandDiarizationEngine implements DiarizationEngine {

    private static final Logger LOG = LogManager.getLogger(CommandDiarizationEngine.class);

    private final DiarizationConfig cfg;
    private final ProcessRunner runner;
    private final ApplicationEventPublisher publisher;

    public CommandDiarizationEngine(DiarizationConfig cfg, ProcessRunner runner, ApplicationEventPublisher publisher) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.publisher = publisher;
    }

    @Override
    public boolean isAvailable() {
        if (!cfg.isConfigured()) {
            return false;
        }
        Path binary = Paths.get(cfg.binaryPath());
        return binary.getParent() == null || Files.isExecutable(binary);
    }

    @Override
    public List<DiarizationInterval> diarize(Path wav) {
        Objects.requireNonNull(wav, "wav");
        if (!cfg.isConfigured()) {
            throw new DiarizationUnavailableException("No diarizer configured (stt.diarization.binary-path)");
        }
        List<String> cmd = new ArrayList<>();
        cmd.add(cfg.binaryPath());
        cmd.addAll(cfg.extraArgs());
        cmd.add(wav.toAbsolutePath().toString());
        try {
            ProcessOutput out = runner.run(cmd, null, Duration.ofSeconds(cfg.timeoutSeconds()),
                    cfg.maxStdoutBytes(), EngineNames.DIARIZER);
            List<DiarizationInterval> intervals = RttmParser.parse(out.stdout());
            LOG.debug("Diarizer produced {} intervals in {} ms", intervals.size(), out.durationMs());
            return intervals;
        } catch (RuntimeException e) {
            EngineEventPublisher.publishFailure(publisher, EngineNames.DIARIZER, "diarization failure", e,
                    Map.of("binaryPath", cfg.binaryPath()));
            throw new DiarizationUnavailableException("Diarization failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getEngineName() {
        return EngineNames.DIARIZER;
    }
}
