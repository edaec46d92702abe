package com.phillippitts.livescribe.service.transcript;

import com.phillippitts.livescribe.domain.SpeakerTurn;
import com.phillippitts.livescribe.domain.TimedText;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CaptionWriterTest {

    private final CaptionWriter writer = new CaptionWriter("speaker_1");

    private final List<TimedText> entries = List.of(
            new TranscriptSegment("Welcome everyone", 0.0, 2.5, 0.9, "Speaker A"),
            new SpeakerTurn("speaker_1", 2.5, 3661.75, " Thanks for having me ", null));

    @Test
    void rendersSrtWithSpeakerPrefix() {
        assertThat(writer.toSrt(entries)).isEqualTo("""
                1
                00:00:00,000 --> 00:00:02,500
                [Speaker A] Welcome everyone

                2
                00:00:02,500 --> 01:01:01,750
                Thanks for having me

                """);
    }

    @Test
    void rendersVttWithVoiceTags() {
        assertThat(writer.write(entries, CaptionFormat.VTT)).isEqualTo("""
                WEBVTT

                00:00:00.000 --> 00:00:02.500
                <v Speaker A>Welcome everyone</v>

                00:00:02.500 --> 01:01:01.750
                Thanks for having me

                """);
    }

    @Test
    void emptyInputYieldsHeaderOnly() {
        assertThat(writer.toSrt(List.of())).isEmpty();
        assertThat(writer.toVtt(List.of())).isEqualTo("WEBVTT\n\n");
    }

    @Test
    void timestampsTruncateToMillisAndClampNegatives() {
        assertThat(CaptionWriter.timestamp(1.2345, ',')).isEqualTo("00:00:01,234");
        assertThat(CaptionWriter.timestamp(-3.0, '.')).isEqualTo("00:00:00.000");
        assertThat(CaptionWriter.timestamp(59.999, '.')).isEqualTo("00:00:59.999");
    }

    @Test
    void formatResolvesFromExtension() {
        assertThat(CaptionFormat.fromFileName("meeting.SRT")).isEqualTo(CaptionFormat.SRT);
        assertThat(CaptionFormat.fromFileName("meeting.vtt")).isEqualTo(CaptionFormat.VTT);
        assertThat(CaptionFormat.fromFileName("meeting.txt")).isNull();
        assertThat(CaptionFormat.fromFileName(null)).isNull();
    }
}
