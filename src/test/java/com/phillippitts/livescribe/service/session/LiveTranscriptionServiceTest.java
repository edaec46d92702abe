package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.config.properties.FileTranscriptionProperties;
import com.phillippitts.livescribe.config.properties.StreamProperties;
import com.phillippitts.livescribe.config.properties.TranscriptProperties;
import com.phillippitts.livescribe.config.properties.WorkerProperties;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.service.metrics.PipelineMetrics;
import com.phillippitts.livescribe.service.transcript.CaptionWriter;
import com.phillippitts.livescribe.service.transcript.TranscriptWriter;
import com.phillippitts.livescribe.testutil.AudioFixtures;
import com.phillippitts.livescribe.testutil.FakeRecognitionEngine;
import com.phillippitts.livescribe.testutil.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.livescribe.testutil.ProcessTestDoubles.StubProcessFactory;
import com.phillippitts.livescribe.testutil.ProcessTestDoubles.TestProcess;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LiveTranscriptionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T10:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path tmp;

    @AfterEach
    void clearContext() {
        ThreadContext.clearAll();
    }

    @Test
    void localFilesUseFileChunkLength() throws Exception {
        Path media = Files.write(tmp.resolve("lecture.mp3"), new byte[] {1});
        StubProcessFactory factory = new StubProcessFactory(
                new TestProcess(ProcessBehavior.pcm(AudioFixtures.tonePcm(6.0), 0)));

        List<TranscriptSegment> segments = runToEnd(service(factory), media.toString());

        assertThat(segments).extracting(TranscriptSegment::start).containsExactly(0.0, 5.0);
        assertThat(factory.lastCommand()).contains(media.toString());
    }

    @Test
    void streamsUseStreamChunkLength() throws Exception {
        StubProcessFactory factory = new StubProcessFactory(
                new TestProcess(ProcessBehavior.pcm(AudioFixtures.tonePcm(6.0), 0)));

        List<TranscriptSegment> segments = runToEnd(service(factory), "https://radio.test.local/live");

        assertThat(segments).extracting(TranscriptSegment::start).containsExactly(0.0, 3.0);
    }

    @Test
    void sessionIdsCarryPrefixAndClockTime() {
        LiveTranscriptionSession session = service(StubProcessFactory.failing("unused")).open("rtsp://cam/1");

        assertThat(session.sessionId()).startsWith("live-20261019-101530-");
    }

    @Test
    void detectsLocalFiles() throws Exception {
        Path file = Files.write(tmp.resolve("a.wav"), new byte[] {1});

        assertThat(LiveTranscriptionService.isLocalFile(file.toString())).isTrue();
        assertThat(LiveTranscriptionService.isLocalFile(tmp.toString())).isFalse();
        assertThat(LiveTranscriptionService.isLocalFile(tmp.resolve("missing.wav").toString())).isFalse();
        assertThat(LiveTranscriptionService.isLocalFile("file:///tmp/a.wav")).isFalse();
        assertThat(LiveTranscriptionService.isLocalFile("\u0000bad")).isFalse();
    }

    private static List<TranscriptSegment> runToEnd(LiveTranscriptionService service, String locator)
            throws InterruptedException {
        LiveTranscriptionSession session = service.start(locator);
        try {
            assertThat(session.awaitCompletion(Duration.ofSeconds(10))).isTrue();
            return session.poll();
        } finally {
            session.stop();
        }
    }

    private LiveTranscriptionService service(StubProcessFactory factory) {
        FakeRecognitionEngine engine = new FakeRecognitionEngine("whisper", c -> "segment at " + c.startTime());
        return new LiveTranscriptionService(engine, factory, StreamProperties.defaults(),
                FileTranscriptionProperties.defaults(), WorkerProperties.defaults(), TranscriptProperties.defaults(),
                new PipelineMetrics(new SimpleMeterRegistry()),
                new TranscriptWriter(tmp.resolve("out"), new CaptionWriter("speaker_1")), null, CLOCK);
    }
}
