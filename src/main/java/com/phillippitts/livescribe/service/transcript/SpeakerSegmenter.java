package com.phillippitts.livescribe.service.transcript;

import com.phillippitts.livescribe.config.properties.SegmenterProperties;
import com.phillippitts.livescribe.domain.SpeakerTurn;
import com.phillippitts.livescribe.domain.Word;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Groups recognized words into speaker turns.
 *
 * <p>Pass one scans the words in start order and opens a new turn when the speaker or channel
 * changes, or when the silence since the current turn's end exceeds {@code segmenter.max-gap-seconds}.
 * Pass two folds a turn shorter than {@code segmenter.min-merge-ms} into its predecessor when both
 * share speaker and channel. Neither pass reorders turns.
 *
 * <p>A word's speaker is its speaker tag when present, otherwise {@code channel_N} for its channel,
 * otherwise the configured default label. Audio events are skipped.
 */
public class SpeakerSegmenter {

    private static final Logger LOG = LogManager.getLogger(SpeakerSegmenter.class);

    private final SegmenterProperties props;

    public SpeakerSegmenter(SegmenterProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    public List<SpeakerTurn> segment(List<Word> words) {
        Objects.requireNonNull(words, "words");
        if (words.isEmpty()) {
            return List.of();
        }
        List<Word> ordered = new ArrayList<>(words);
        // List.sort is stable, so words sharing a start keep their input order
        ordered.sort(Comparator.comparingDouble(Word::start));

        List<SpeakerTurn> turns = new ArrayList<>();
        TurnBuilder current = null;
        int events = 0;
        for (Word w : ordered) {
            if (!w.isSpoken()) {
                events++;
                continue;
            }
            String speaker = speakerOf(w);
            if (current == null || current.startsNewTurn(speaker, w, props.maxGapSeconds())) {
                if (current != null) {
                    turns.add(current.build());
                }
                current = new TurnBuilder(speaker, w);
            } else {
                current.extend(w);
            }
        }
        if (current != null) {
            turns.add(current.build());
        }
        List<SpeakerTurn> merged = mergeShortTurns(turns);
        LOG.debug("Segmented {} words ({} events skipped) into {} turns ({} before merge)",
                words.size(), events, merged.size(), turns.size());
        return merged;
    }

    /**
     * Folds each turn shorter than the merge threshold into the preceding merged turn when speaker
     * and channel match. The merged turn keeps the earlier start and takes the later end.
     */
    public List<SpeakerTurn> mergeShortTurns(List<SpeakerTurn> turns) {
        Objects.requireNonNull(turns, "turns");
        List<SpeakerTurn> merged = new ArrayList<>(turns.size());
        double minMergeSeconds = props.minMergeMs() / 1000.0;
        for (SpeakerTurn turn : turns) {
            if (!merged.isEmpty()) {
                SpeakerTurn last = merged.get(merged.size() - 1);
                if (last.speakerId().equals(turn.speakerId())
                        && Objects.equals(last.channelIndex(), turn.channelIndex())
                        && turn.duration() < minMergeSeconds) {
                    merged.set(merged.size() - 1, new SpeakerTurn(
                            last.speakerId(), last.start(), turn.end(),
                            last.text() + " " + turn.text(), last.channelIndex()));
                    continue;
                }
            }
            merged.add(turn);
        }
        return merged;
    }

    String speakerOf(Word w) {
        if (w.speakerId() != null && !w.speakerId().isBlank()) {
            return w.speakerId();
        }
        if (w.channelIndex() != null) {
            return "channel_" + w.channelIndex();
        }
        return props.defaultSpeaker();
    }

    private static final class TurnBuilder {
        private final String speaker;
        private final Integer channel;
        private final double start;
        private final StringBuilder text;
        private double end;

        TurnBuilder(String speaker, Word first) {
            this.speaker = speaker;
            this.channel = first.channelIndex();
            this.start = first.start();
            this.end = first.end();
            this.text = new StringBuilder(first.text());
        }

        boolean startsNewTurn(String wordSpeaker, Word w, double maxGap) {
            return !speaker.equals(wordSpeaker)
                    || !Objects.equals(channel, w.channelIndex())
                    || w.start() - end > maxGap;
        }

        void extend(Word w) {
            text.append(' ').append(w.text());
            end = w.end();
        }

        SpeakerTurn build() {
            return new SpeakerTurn(speaker, start, Math.max(start, end), text.toString(), channel);
        }
    }
}
