package com.phillippitts.livescribe.service.transcript;

import com.phillippitts.livescribe.domain.TranscriptSegment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubtitleParserTest {

    @Test
    void parsesSrtCuesAndSpeakerPrefix() {
        String srt = "1\r\n00:00:01,000 --> 00:00:03,500\r\n[Speaker A] Hello there\r\n\r\n"
                + "2\n00:01:00,250 --> 00:01:02,000\nsecond line\ncontinues\n\n"
                + "3\nnot a timing line\nignored\n";

        List<TranscriptSegment> cues = SubtitleParser.parse(srt, CaptionFormat.SRT);

        assertThat(cues).hasSize(2);
        assertThat(cues.get(0)).isEqualTo(new TranscriptSegment("Hello there", 1.0, 3.5, 1.0, "Speaker A"));
        assertThat(cues.get(1).text()).isEqualTo("second line continues");
        assertThat(cues.get(1).start()).isEqualTo(60.25);
        assertThat(cues.get(1).speaker()).isNull();
    }

    @Test
    void parsesVttSkippingHeaderNotesAndIdentifiers() {
        String vtt = """
                WEBVTT - meeting

                NOTE written by the recorder

                intro
                00:00:00.000 --> 00:00:02.000 align:start
                <v Speaker B>Good <i>morning</i></v>

                00:00:02.000 --> 00:00:04.000
                Plain cue
                """;

        List<TranscriptSegment> cues = SubtitleParser.parse(vtt, CaptionFormat.VTT);

        assertThat(cues).extracting(TranscriptSegment::text).containsExactly("Good morning", "Plain cue");
        assertThat(cues).extracting(TranscriptSegment::speaker).containsExactly("Speaker B", null);
        assertThat(cues.get(1).end()).isEqualTo(4.0);
    }

    @Test
    void captionWriterOutputParsesBack() {
        CaptionWriter writer = new CaptionWriter("speaker_1");
        List<TranscriptSegment> original = List.of(
                new TranscriptSegment("one", 0.0, 1.5, 1.0, "Speaker A"),
                new TranscriptSegment("two", 1.5, 3.0, 1.0, null));

        assertThat(SubtitleParser.parse(writer.toVtt(original), CaptionFormat.VTT)).isEqualTo(original);
        assertThat(SubtitleParser.parse(writer.toSrt(original), CaptionFormat.SRT)).isEqualTo(original);
    }

    @Test
    void blankContentYieldsNothing() {
        assertThat(SubtitleParser.parse("  ", CaptionFormat.SRT)).isEmpty();
        assertThat(SubtitleParser.parse(null, CaptionFormat.VTT)).isEmpty();
    }

    @Test
    void parseFileChoosesFormatByExtension(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("talk.srt");
        Files.writeString(file, "1\n00:00:00,000 --> 00:00:01,000\nhi all\n");

        assertThat(SubtitleParser.parseFile(file)).extracting(TranscriptSegment::text).containsExactly("hi all");
        assertThat(SubtitleParser.parseFile(dir.resolve("missing.vtt"))).isEmpty();
        assertThatThrownBy(() -> SubtitleParser.parseFile(dir.resolve("notes.txt")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("notes.txt");
    }
}
