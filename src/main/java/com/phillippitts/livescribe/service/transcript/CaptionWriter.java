package com.phillippitts.livescribe.service.transcript;

import com.phillippitts.livescribe.domain.TimedText;
import com.phillippitts.livescribe.util.TimeUtils;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders timed entries as SRT or WebVTT captions.
 *
 * <p>One cue per entry, each followed by a blank line. A speaker label is shown unless it is absent
 * or equal to the default single-speaker label. Time fields are truncated to whole milliseconds.
 */
public class CaptionWriter {

    private final String defaultSpeaker;

    public CaptionWriter(String defaultSpeaker) {
        this.defaultSpeaker = Objects.requireNonNull(defaultSpeaker, "defaultSpeaker");
    }

    public String write(List<? extends TimedText> entries, CaptionFormat format) {
        return switch (format) {
            case SRT -> toSrt(entries);
            case VTT -> toVtt(entries);
        };
    }

    public String toSrt(List<? extends TimedText> entries) {
        StringBuilder sb = new StringBuilder();
        int index = 1;
        for (TimedText t : entries) {
            sb.append(index++).append('\n');
            appendTiming(sb, t, CaptionFormat.SRT);
            String text = t.text().trim();
            if (showsSpeaker(t.speaker())) {
                sb.append('[').append(t.speaker()).append("] ");
            }
            sb.append(text).append("\n\n");
        }
        return sb.toString();
    }

    public String toVtt(List<? extends TimedText> entries) {
        StringBuilder sb = new StringBuilder("WEBVTT\n\n");
        for (TimedText t : entries) {
            appendTiming(sb, t, CaptionFormat.VTT);
            String text = t.text().trim();
            if (showsSpeaker(t.speaker())) {
                sb.append("<v ").append(t.speaker()).append('>').append(text).append("</v>");
            } else {
                sb.append(text);
            }
            sb.append("\n\n");
        }
        return sb.toString();
    }

    /**
     * Formats seconds as {@code HH:MM:SS<sep>mmm}.
     */
    static String timestamp(double seconds, char millisSeparator) {
        long totalMillis = TimeUtils.secondsToMillis(Math.max(0.0, seconds));
        long hours = totalMillis / 3_600_000L;
        long minutes = (totalMillis / 60_000L) % 60;
        long secs = (totalMillis / 1000L) % 60;
        long millis = totalMillis % 1000L;
        return String.format(Locale.ROOT, "%02d:%02d:%02d%c%03d", hours, minutes, secs, millisSeparator, millis);
    }

    private static void appendTiming(StringBuilder sb, TimedText t, CaptionFormat format) {
        sb.append(timestamp(t.start(), format.millisSeparator()))
                .append(" --> ")
                .append(timestamp(t.end(), format.millisSeparator()))
                .append('\n');
    }

    private boolean showsSpeaker(String speaker) {
        return speaker != null && !speaker.isBlank() && !defaultSpeaker.equals(speaker);
    }
}
