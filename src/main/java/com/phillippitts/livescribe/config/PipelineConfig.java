package com.phillippitts.livescribe.config;

import com.phillippitts.livescribe.config.properties.AlignmentProperties;
import com.phillippitts.livescribe.config.properties.FallbackProperties;
import com.phillippitts.livescribe.config.properties.FileTranscriptionProperties;
import com.phillippitts.livescribe.config.properties.SegmenterProperties;
import com.phillippitts.livescribe.config.properties.StreamProperties;
import com.phillippitts.livescribe.config.properties.TranscriptProperties;
import com.phillippitts.livescribe.config.properties.WorkerProperties;
import com.phillippitts.livescribe.config.stt.DiarizationConfig;
import com.phillippitts.livescribe.config.stt.ScribeProperties;
import com.phillippitts.livescribe.config.stt.WhisperConfig;
import com.phillippitts.livescribe.service.align.TimestampAligner;
import com.phillippitts.livescribe.service.audio.source.AudioFileConverter;
import com.phillippitts.livescribe.service.fallback.IntegratedDiarizationTier;
import com.phillippitts.livescribe.service.fallback.ProviderFallbackChain;
import com.phillippitts.livescribe.service.fallback.ProviderTier;
import com.phillippitts.livescribe.service.fallback.RecognitionOnlyTier;
import com.phillippitts.livescribe.service.fallback.RecognitionWithDiarizationTier;
import com.phillippitts.livescribe.service.metrics.PipelineMetrics;
import com.phillippitts.livescribe.service.process.DefaultProcessFactory;
import com.phillippitts.livescribe.service.process.ProcessFactory;
import com.phillippitts.livescribe.service.process.ProcessRunner;
import com.phillippitts.livescribe.service.session.FileTranscriptionService;
import com.phillippitts.livescribe.service.session.LiveTranscriptionService;
import com.phillippitts.livescribe.service.stt.RecognitionEngine;
import com.phillippitts.livescribe.service.stt.diarization.CommandDiarizationEngine;
import com.phillippitts.livescribe.service.stt.diarization.DiarizationEngine;
import com.phillippitts.livescribe.service.stt.scribe.ScribeClient;
import com.phillippitts.livescribe.service.stt.whisper.WhisperRecognitionEngine;
import com.phillippitts.livescribe.service.transcript.CaptionWriter;
import com.phillippitts.livescribe.service.transcript.DiarizationReconciler;
import com.phillippitts.livescribe.service.transcript.SpeakerSegmenter;
import com.phillippitts.livescribe.service.transcript.TranscriptWriter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the pipeline explicitly: process plumbing, engines, provider tiers, the fallback chain
 * and the session services.
 */
@Configuration
public class PipelineConfig {

    /**
     * Local registry when no monitoring backend contributes one. Registered {@link MeterBinder}s
     * are bound here.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry(ObjectProvider<MeterBinder> binders) {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        binders.orderedStream().forEach(b -> b.bindTo(registry));
        return registry;
    }

    @Bean
    public PipelineMetrics pipelineMetrics(MeterRegistry registry) {
        return new PipelineMetrics(registry);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    @Bean
    public ProcessRunner processRunner(ProcessFactory processFactory) {
        return new ProcessRunner(processFactory);
    }

    @Bean
    public RecognitionEngine whisperRecognitionEngine(WhisperConfig cfg, ProcessRunner runner,
                                                      ApplicationEventPublisher publisher) {
        return new WhisperRecognitionEngine(cfg, runner, publisher);
    }

    @Bean
    public DiarizationEngine diarizationEngine(DiarizationConfig cfg, ProcessRunner runner,
                                               ApplicationEventPublisher publisher) {
        return new CommandDiarizationEngine(cfg, runner, publisher);
    }

    @Bean
    public ScribeClient scribeClient(ScribeProperties props) {
        return new ScribeClient(props);
    }

    @Bean
    public SpeakerSegmenter speakerSegmenter(SegmenterProperties props) {
        return new SpeakerSegmenter(props);
    }

    @Bean
    public DiarizationReconciler diarizationReconciler() {
        return new DiarizationReconciler();
    }

    @Bean
    public CaptionWriter captionWriter(SegmenterProperties props) {
        return new CaptionWriter(props.defaultSpeaker());
    }

    @Bean
    public TranscriptWriter transcriptWriter(FileTranscriptionProperties props, CaptionWriter captions) {
        return new TranscriptWriter(Path.of(props.outputDir()), captions);
    }

    @Bean
    public AudioFileConverter audioFileConverter(StreamProperties stream, FileTranscriptionProperties file,
                                                 ProcessRunner runner) {
        return new AudioFileConverter(stream, file, runner);
    }

    @Bean
    public IntegratedDiarizationTier integratedDiarizationTier(ScribeClient client, SpeakerSegmenter segmenter) {
        return new IntegratedDiarizationTier(client, segmenter);
    }

    @Bean
    public RecognitionWithDiarizationTier recognitionWithDiarizationTier(RecognitionEngine engine,
                                                                         DiarizationEngine diarizer,
                                                                         DiarizationReconciler reconciler,
                                                                         @Qualifier("sttExecutor") Executor executor,
                                                                         FallbackProperties props) {
        return new RecognitionWithDiarizationTier(engine, diarizer, reconciler, executor, props.parallelTimeout());
    }

    @Bean
    public RecognitionOnlyTier recognitionOnlyTier(RecognitionEngine engine) {
        return new RecognitionOnlyTier(engine);
    }

    @Bean
    public ProviderFallbackChain providerFallbackChain(List<ProviderTier> tiers, FallbackProperties props,
                                                       ApplicationEventPublisher publisher) {
        return new ProviderFallbackChain(ProviderFallbackChain.inPreferenceOrder(tiers, props.tiers()), publisher);
    }

    @Bean
    public TimestampAligner timestampAligner(AlignmentProperties props) {
        return new TimestampAligner(props);
    }

    @Bean
    public FileTranscriptionService fileTranscriptionService(AudioFileConverter converter,
                                                             ProviderFallbackChain chain,
                                                             TranscriptWriter writer,
                                                             Clock clock) {
        return new FileTranscriptionService(converter, chain, writer, clock);
    }

    @Bean
    public LiveTranscriptionService liveTranscriptionService(RecognitionEngine engine,
                                                             ProcessFactory processFactory,
                                                             StreamProperties stream,
                                                             FileTranscriptionProperties file,
                                                             WorkerProperties worker,
                                                             TranscriptProperties transcript,
                                                             PipelineMetrics metrics,
                                                             TranscriptWriter writer,
                                                             ApplicationEventPublisher publisher,
                                                             Clock clock) {
        return new LiveTranscriptionService(engine, processFactory, stream, file, worker, transcript,
                metrics, writer, publisher, clock);
    }
}
