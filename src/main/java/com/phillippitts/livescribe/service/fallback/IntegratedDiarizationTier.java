package com.phillippitts.livescribe.service.fallback;

import com.phillippitts.livescribe.domain.SpeakerTurn;
import com.phillippitts.livescribe.domain.Word;
import com.phillippitts.livescribe.exception.InvalidAudioException;
import com.phillippitts.livescribe.service.stt.scribe.ScribeClient;
import com.phillippitts.livescribe.service.stt.scribe.ScribeException;
import com.phillippitts.livescribe.service.transcript.SpeakerSegmenter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Recognition and diarization in one remote call; words are grouped into speaker turns.
 */
public class IntegratedDiarizationTier implements ProviderTier {

    private static final Logger LOG = LogManager.getLogger(IntegratedDiarizationTier.class);

    private final ScribeClient client;
    private final SpeakerSegmenter segmenter;

    public IntegratedDiarizationTier(ScribeClient client, SpeakerSegmenter segmenter) {
        this.client = Objects.requireNonNull(client, "client");
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
    }

    @Override
    public String name() {
        return TierNames.INTEGRATED_DIARIZATION;
    }

    @Override
    public boolean isAvailable() {
        return client.isConfigured();
    }

    @Override
    public ProviderResult transcribe(Path wav) {
        List<Word> words;
        try {
            words = client.transcribe(wav);
        } catch (InvalidAudioException e) {
            return ProviderResult.err(name(), FailureKind.REJECTED, e.getReason());
        } catch (ScribeException e) {
            return ProviderResult.err(name(), kindOf(e.getReason()), e.getMessage());
        }
        List<SpeakerTurn> turns = segmenter.segment(words);
        LOG.debug("{} words grouped into {} turns", words.size(), turns.size());
        return ProviderResult.ok(name(), turns);
    }

    static FailureKind kindOf(ScribeException.Reason reason) {
        return switch (reason) {
            case TRANSIENT_EXHAUSTED -> FailureKind.TRANSIENT_EXHAUSTED;
            case REJECTED -> FailureKind.REJECTED;
            case INVALID_RESPONSE -> FailureKind.INVALID_RESPONSE;
            case HTTP_ERROR -> FailureKind.ERROR;
        };
    }
}
