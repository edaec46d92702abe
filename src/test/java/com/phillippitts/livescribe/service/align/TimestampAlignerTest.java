package com.phillippitts.livescribe.service.align;

import com.phillippitts.livescribe.config.properties.AlignmentProperties;
import com.phillippitts.livescribe.domain.AlignmentTarget;
import com.phillippitts.livescribe.domain.Transcript;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.service.transcript.CaptionWriter;
import com.phillippitts.livescribe.service.transcript.TranscriptFiles;
import com.phillippitts.livescribe.service.transcript.TranscriptWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampAlignerTest {

    private static final List<TranscriptSegment> MEETING = List.of(
            TranscriptSegment.of("Welcome to the quarterly planning meeting, everyone.", 0.0, 10.0, 0.9),
            TranscriptSegment.of("First we will review the marketing budget for next year.", 10.0, 20.0, 0.9),
            TranscriptSegment.of("Then the engineering team presents the new roadmap.", 20.0, 30.0, 0.9));

    private final TimestampAligner aligner = new TimestampAligner(AlignmentProperties.defaults());

    @Test
    void targetsAnchorToSegmentsHoldingTheirText() {
        AlignmentReport report = aligner.align(List.of(
                AlignmentTarget.of("Intro", "Welcome to the quarterly planning meeting"),
                AlignmentTarget.of("Budget", "We review the marketing budget for next year"),
                AlignmentTarget.of("Roadmap", "The engineering team presents the new roadmap")), MEETING);

        assertThat(report.targets()).extracting(AlignmentTarget::startTimestamp).containsExactly(0.0, 10.0, 20.0);
        assertThat(report.alignedCount()).isEqualTo(3);
        assertThat(report.partial()).isFalse();
        assertThat(report.targets()).extracting(AlignmentTarget::title).containsExactly("Intro", "Budget", "Roadmap");
    }

    @Test
    void targetWithoutLongSharedRunStaysUnaligned() {
        AlignmentReport report = aligner.align(List.of(
                AlignmentTarget.of("Garden", "Completely unrelated advice about growing tomatoes indoors"),
                AlignmentTarget.of("Budget", "review the marketing budget for next year")), MEETING);

        assertThat(report.targets().get(0).isAligned()).isFalse();
        assertThat(report.targets().get(1).startTimestamp()).isEqualTo(10.0);
        assertThat(report.alignedCount()).isEqualTo(1);
        assertThat(report.partial()).isTrue();
    }

    @Test
    void searchNeverMovesBackwards() {
        AlignmentReport report = aligner.align(List.of(
                AlignmentTarget.of("Roadmap", "the engineering team presents the new roadmap"),
                AlignmentTarget.of("Intro", "welcome to the quarterly planning meeting everyone")), MEETING);

        assertThat(report.targets().get(0).startTimestamp()).isEqualTo(20.0);
        assertThat(report.targets().get(1).isAligned()).isFalse();
        assertAlignedTimestampsNonDecreasing(report.targets());
    }

    @Test
    void blankSummaryFallsBackToTitle() {
        AlignmentReport report = aligner.align(List.of(
                new AlignmentTarget("Marketing budget for next year", "  ", null)), MEETING);

        assertThat(report.targets()).singleElement()
                .satisfies(t -> assertThat(t.startTimestamp()).isEqualTo(10.0));
    }

    @Test
    void backwardTimestampsAreBumpedPastPredecessor() {
        List<AlignmentTarget> corrected = aligner.enforceMonotonic(List.of(
                new AlignmentTarget("a", "", 20.0),
                AlignmentTarget.of("b", ""),
                new AlignmentTarget("c", "", 5.0),
                new AlignmentTarget("d", "", 30.0)));

        assertThat(corrected).extracting(AlignmentTarget::startTimestamp)
                .containsExactly(20.0, null, 21.0, 30.0);
        assertAlignedTimestampsNonDecreasing(corrected);
    }

    @Test
    void emptyInputsYieldPartialReport() {
        assertThat(aligner.align(List.of(), MEETING).partial()).isTrue();
        AlignmentReport none = aligner.align(List.of(AlignmentTarget.of("x", "anything")), List.of());
        assertThat(none.alignedCount()).isZero();
        assertThat(none.targets()).extracting(AlignmentTarget::isAligned).containsExactly(false);
    }

    @Test
    void alignsToCaptionFileAndCachesParse(@TempDir Path dir) throws Exception {
        Path srt = dir.resolve("meeting.srt");
        Files.writeString(srt, new CaptionWriter("speaker_1").toSrt(MEETING));
        List<AlignmentTarget> targets = List.of(
                AlignmentTarget.of("Roadmap", "engineering team presents the new roadmap"));

        AlignmentReport first = aligner.alignToFile(targets, srt);
        AlignmentReport second = aligner.alignToFile(targets, srt);

        assertThat(first.targets().get(0).startTimestamp()).isEqualTo(20.0);
        assertThat(second).isEqualTo(first);
        AlignmentStats stats = aligner.stats();
        assertThat(stats.attempted()).isEqualTo(2);
        assertThat(stats.successful()).isEqualTo(2);
        assertThat(stats.cacheHits()).isEqualTo(1);
        assertThat(stats.successRate()).isEqualTo(1.0);

        aligner.clearCache();
        aligner.alignToFile(targets, srt);
        assertThat(aligner.stats().cacheHits()).isEqualTo(1);
    }

    @Test
    void alignsToPersistedTranscript(@TempDir Path dir) throws Exception {
        Transcript transcript = Transcript.start("aligned");
        transcript.appendAll(MEETING);
        TranscriptFiles files = new TranscriptWriter(dir, new CaptionWriter("speaker_1")).write(transcript);

        AlignmentReport report = aligner.alignToFile(
                List.of(AlignmentTarget.of("Budget", "review the marketing budget for next year")), files.json());

        assertThat(report.targets().get(0).startTimestamp()).isEqualTo(10.0);
    }

    @Test
    void missingOrUnsupportedFileYieldsUnalignedReport(@TempDir Path dir) throws Exception {
        List<AlignmentTarget> targets = List.of(AlignmentTarget.of("x", "the marketing budget for next year"));
        Path notes = Files.writeString(dir.resolve("notes.txt"), "the marketing budget for next year");

        AlignmentReport missing = aligner.alignToFile(targets, dir.resolve("absent.vtt"));
        AlignmentReport unsupported = aligner.alignToFile(targets, notes);

        assertThat(missing.partial()).isTrue();
        assertThat(missing.targets()).isEqualTo(targets);
        assertThat(unsupported.alignedCount()).isZero();
        assertThat(aligner.stats().attempted()).isEqualTo(2);
        assertThat(aligner.stats().successRate()).isZero();
    }

    private static void assertAlignedTimestampsNonDecreasing(List<AlignmentTarget> targets) {
        double[] ts = targets.stream().filter(AlignmentTarget::isAligned)
                .mapToDouble(AlignmentTarget::startTimestamp).toArray();
        double[] sorted = ts.clone();
        Arrays.sort(sorted);
        assertThat(ts).containsExactly(sorted);
    }
}
