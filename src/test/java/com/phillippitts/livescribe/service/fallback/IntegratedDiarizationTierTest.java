package com.phillippitts.livescribe.service.fallback;

import com.phillippitts.livescribe.config.properties.SegmenterProperties;
import com.phillippitts.livescribe.config.stt.ScribeProperties;
import com.phillippitts.livescribe.domain.SpeakerTurn;
import com.phillippitts.livescribe.domain.TimedText;
import com.phillippitts.livescribe.service.stt.scribe.ScribeException;
import com.phillippitts.livescribe.service.stt.scribe.ScribeTestDoubles;
import com.phillippitts.livescribe.service.stt.scribe.ScribeTestDoubles.RecordingSleeper;
import com.phillippitts.livescribe.service.stt.scribe.ScribeTestDoubles.ScriptedTransport;
import com.phillippitts.livescribe.service.transcript.SpeakerSegmenter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class IntegratedDiarizationTierTest {

    private static final String TWO_SPEAKERS = """
            {"text":"Hello world Hi","words":[
              {"text":"Hello","start":0.0,"end":0.5,"type":"word","speaker_id":"speaker_0"},
              {"text":"world","start":0.6,"end":1.0,"type":"word","speaker_id":"speaker_0"},
              {"text":"(laughs)","start":1.2,"end":1.6,"type":"audio_event","speaker_id":"speaker_1"},
              {"text":"Hi","start":2.0,"end":2.3,"type":"word","speaker_id":"speaker_1"}
            ]}
            """;

    @TempDir
    Path tmp;

    private Path wav;
    private final SpeakerSegmenter segmenter = new SpeakerSegmenter(SegmenterProperties.defaults());

    @BeforeEach
    void setUp() throws IOException {
        wav = Files.write(tmp.resolve("panel.wav"), new byte[64]);
    }

    @Test
    void groupsProviderWordsIntoTurns() {
        ProviderResult result = tier(new ScriptedTransport().reply(200, TWO_SPEAKERS)).transcribe(wav);

        assertThat(result.isOk()).isTrue();
        assertThat(result.entries()).extracting(TimedText::text).containsExactly("Hello world", "Hi");
        assertThat(result.entries()).first().isInstanceOfSatisfying(SpeakerTurn.class, t -> {
            assertThat(t.speakerId()).isEqualTo("speaker_0");
            assertThat(t.end()).isEqualTo(1.0);
        });
    }

    @Test
    void validationErrorIsRejected() {
        ProviderResult result = tier(new ScriptedTransport().reply(422, "{\"detail\":\"bad model\"}")).transcribe(wav);

        assertThat(result.failure()).isEqualTo(FailureKind.REJECTED);
        assertThat(result.message()).contains("bad model");
    }

    @Test
    void unreadableAudioIsRejected() {
        ProviderResult result = tier(new ScriptedTransport().reply(200, TWO_SPEAKERS))
                .transcribe(tmp.resolve("missing.wav"));

        assertThat(result.failure()).isEqualTo(FailureKind.REJECTED);
        assertThat(result.message()).contains("missing.wav");
    }

    @Test
    void providerWithoutWordsIsEmptyResult() {
        ProviderResult result = tier(new ScriptedTransport().reply(200, "{\"text\":\"\",\"words\":[]}"))
                .transcribe(wav);

        assertThat(result.failure()).isEqualTo(FailureKind.EMPTY_RESULT);
    }

    @Test
    void availableOnlyWithApiKey() {
        assertThat(tier(new ScriptedTransport()).isAvailable()).isTrue();

        IntegratedDiarizationTier unconfigured = new IntegratedDiarizationTier(
                ScribeTestDoubles.client(ScribeProperties.withKey("https://api.test.local/", ""),
                        new ScriptedTransport(), new RecordingSleeper()),
                segmenter);
        assertThat(unconfigured.isAvailable()).isFalse();
    }

    @Test
    void clientReasonsMapToFailureKinds() {
        assertThat(IntegratedDiarizationTier.kindOf(ScribeException.Reason.TRANSIENT_EXHAUSTED))
                .isEqualTo(FailureKind.TRANSIENT_EXHAUSTED);
        assertThat(IntegratedDiarizationTier.kindOf(ScribeException.Reason.INVALID_RESPONSE))
                .isEqualTo(FailureKind.INVALID_RESPONSE);
        assertThat(IntegratedDiarizationTier.kindOf(ScribeException.Reason.HTTP_ERROR)).isEqualTo(FailureKind.ERROR);
    }

    private IntegratedDiarizationTier tier(ScriptedTransport transport) {
        return new IntegratedDiarizationTier(
                ScribeTestDoubles.client(ScribeTestDoubles.props(), transport, new RecordingSleeper()), segmenter);
    }
}
