package com.phillippitts.livescribe.service.audio.source;

import com.phillippitts.livescribe.config.properties.StreamProperties;
import com.phillippitts.livescribe.domain.AudioChunk;
import com.phillippitts.livescribe.exception.LiveScribeException;
import com.phillippitts.livescribe.exception.SourceUnavailableException;
import com.phillippitts.livescribe.testutil.AudioFixtures;
import com.phillippitts.livescribe.testutil.EventCapturingPublisher;
import com.phillippitts.livescribe.testutil.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.livescribe.testutil.ProcessTestDoubles.StubProcessFactory;
import com.phillippitts.livescribe.testutil.ProcessTestDoubles.TestProcess;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class StreamAudioSourceTest {

    private static final StreamProperties PROPS = StreamProperties.defaults().withChunkSeconds(1.0);

    @Test
    void emitsOrderedChunksAndSignalsEndAtEof() throws Exception {
        TestProcess proc = new TestProcess(ProcessBehavior.pcm(AudioFixtures.tonePcm(2.6), 0));
        StreamAudioSource source = new StreamAudioSource("clip.mp3", PROPS, new StubProcessFactory(proc), null);
        RecordingListener listener = new RecordingListener();

        source.start(listener);

        assertThat(listener.ended.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.chunks).extracting(AudioChunk::startTime).containsExactly(0.0, 1.0, 2.0);
        assertThat(listener.chunks.get(2).durationSeconds()).isEqualTo(0.6);
        assertThat(listener.errors).isEmpty();
        assertThat(source.bytesRead()).isEqualTo(2L * 41_600);
        assertThat(source.chunksEmitted()).isEqualTo(3);
        source.stop();
    }

    @Test
    void decoderExitingWithoutAudioSignalsErrorThenEnd() throws Exception {
        TestProcess proc = new TestProcess(ProcessBehavior.pcm(new byte[0], 1));
        EventCapturingPublisher events = new EventCapturingPublisher();
        StreamAudioSource source = new StreamAudioSource("missing.mp3", PROPS, new StubProcessFactory(proc), events);
        RecordingListener listener = new RecordingListener();

        source.start(listener);

        assertThat(listener.ended.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.chunks).isEmpty();
        assertThat(listener.errors).singleElement().isInstanceOf(SourceUnavailableException.class);
        assertThat(events.eventsOf(SourceErrorEvent.class))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.reason()).isEqualTo("DECODER_EXITED");
                    assertThat(e.locator()).isEqualTo("missing.mp3");
                });
    }

    @Test
    void nonZeroExitAfterAudioIsNotAnError() throws Exception {
        TestProcess proc = new TestProcess(ProcessBehavior.pcm(AudioFixtures.tonePcm(1.0), 1));
        StreamAudioSource source = new StreamAudioSource("clip.mp3", PROPS, new StubProcessFactory(proc), null);
        RecordingListener listener = new RecordingListener();

        source.start(listener);

        assertThat(listener.ended.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.chunks).hasSize(1);
        assertThat(listener.errors).isEmpty();
    }

    @Test
    void failingToLaunchDecoderIsSourceUnavailable() {
        EventCapturingPublisher events = new EventCapturingPublisher();
        StreamAudioSource source = new StreamAudioSource("rtsp://cam/1", PROPS,
                StubProcessFactory.failing("ffmpeg: not found"), events);

        assertThatThrownBy(() -> source.start(new RecordingListener()))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("ffmpeg: not found")
                .hasMessageContaining("rtsp://cam/1");
        assertThat(events.eventsOf(SourceErrorEvent.class))
                .extracting(SourceErrorEvent::reason)
                .containsExactly("DECODER_START_FAILED");
    }

    @Test
    void stopTerminatesLiveDecoderAndJoinsThread() throws Exception {
        TestProcess proc = new TestProcess(ProcessBehavior.live(AudioFixtures.tonePcm(1.0)));
        StreamAudioSource source = new StreamAudioSource("https://radio/live", PROPS,
                new StubProcessFactory(proc), null);
        RecordingListener listener = new RecordingListener();
        source.start(listener);
        await().atMost(Duration.ofSeconds(5)).until(() -> listener.chunks.size() == 1);

        long t0 = System.nanoTime();
        source.stop();
        long stopMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        assertThat(proc.wasDestroyCalled()).isTrue();
        assertThat(listener.ended.getCount()).isZero();
        assertThat(listener.errors).isEmpty();
        assertThat(source.isRunning()).isFalse();
        assertThat(stopMillis).isLessThan(PROPS.terminateTimeout().toMillis() + PROPS.threadJoinTimeout().toMillis());
        // second stop is a no-op
        source.stop();
    }

    @Test
    void startingTwiceIsRejected() {
        TestProcess proc = new TestProcess(ProcessBehavior.live(new byte[0]));
        StreamAudioSource source = new StreamAudioSource("a.wav", PROPS, new StubProcessFactory(proc), null);
        source.start(new RecordingListener());
        try {
            assertThatThrownBy(() -> source.start(new RecordingListener()))
                    .isInstanceOf(IllegalStateException.class);
        } finally {
            source.close();
        }
    }

    @Test
    void listenerFailuresDoNotKillDecodeLoop() throws Exception {
        TestProcess proc = new TestProcess(ProcessBehavior.pcm(AudioFixtures.tonePcm(3.0), 0));
        StreamAudioSource source = new StreamAudioSource("clip.mp3", PROPS, new StubProcessFactory(proc), null);
        RecordingListener listener = new RecordingListener() {
            @Override
            public void onChunk(AudioChunk chunk) {
                super.onChunk(chunk);
                throw new IllegalStateException("consumer bug");
            }
        };

        source.start(listener);

        assertThat(listener.ended.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.chunks).hasSize(3);
    }

    @Test
    void launchesFfmpegAtConfiguredRate() {
        TestProcess proc = new TestProcess(ProcessBehavior.pcm(new byte[0], 0));
        StubProcessFactory factory = new StubProcessFactory(proc);
        StreamAudioSource source = new StreamAudioSource("in.mkv", PROPS, factory, null);

        source.start(new RecordingListener());
        source.stop();

        assertThat(factory.lastCommand())
                .containsSequence("-i", "in.mkv")
                .containsSequence("-ar", "16000")
                .containsSequence("-ac", "1")
                .endsWith("pipe:1")
                .doesNotContain("-re");
    }

    static class RecordingListener implements AudioSourceListener {
        final List<AudioChunk> chunks = new CopyOnWriteArrayList<>();
        final List<LiveScribeException> errors = new CopyOnWriteArrayList<>();
        final CountDownLatch ended = new CountDownLatch(1);

        @Override
        public void onChunk(AudioChunk chunk) {
            chunks.add(chunk);
        }

        @Override
        public void onEnd() {
            ended.countDown();
        }

        @Override
        public void onError(LiveScribeException error) {
            errors.add(error);
        }
    }
}
