package com.phillippitts.livescribe.service.transcript;

import com.phillippitts.livescribe.domain.TranscriptSegment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads SRT and WebVTT caption files back into {@link TranscriptSegment}s.
 *
 * <p>Cues with an unparseable timing line or no text are skipped. Speaker labels written by
 * {@link CaptionWriter} ({@code [label] } prefixes and {@code <v label>} voice tags) are moved into
 * the segment's speaker; any other markup tags are removed from the text.
 */
public final class SubtitleParser {

    private static final Logger LOG = LogManager.getLogger(SubtitleParser.class);

    /** Caption files carry no recognition confidence. */
    static final double CAPTION_CONFIDENCE = 1.0;

    private static final Pattern BLOCK_SEPARATOR = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SRT_TIMING = Pattern.compile(
            "(\\d{2}):(\\d{2}):(\\d{2}),(\\d{3})\\s*-->\\s*(\\d{2}):(\\d{2}):(\\d{2}),(\\d{3})");
    private static final Pattern VTT_TIMING = Pattern.compile(
            "(\\d{2}):(\\d{2}):(\\d{2})\\.(\\d{3})\\s*-->\\s*(\\d{2}):(\\d{2}):(\\d{2})\\.(\\d{3})");
    private static final Pattern SRT_SPEAKER = Pattern.compile("^\\[([^\\]]+)]\\s+(.*)$");
    private static final Pattern VOICE_TAG = Pattern.compile("<v(?:\\.[^ >]*)?\\s+([^>]+)>");
    private static final Pattern ANY_TAG = Pattern.compile("</?[^>]+>");

    private SubtitleParser() {}

    /**
     * Parses a caption file, choosing the format by extension. A missing file yields an empty list.
     *
     * @throws IllegalArgumentException when the extension is neither {@code .srt} nor {@code .vtt}
     * @throws UncheckedIOException when an existing file cannot be read
     */
    public static List<TranscriptSegment> parseFile(Path path) {
        CaptionFormat format = CaptionFormat.fromFileName(path.getFileName().toString());
        if (format == null) {
            throw new IllegalArgumentException("Unsupported caption file: " + path.getFileName());
        }
        if (!Files.isRegularFile(path)) {
            LOG.debug("Caption file not found: {}", path);
            return List.of();
        }
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8), format);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read caption file " + path, e);
        }
    }

    public static List<TranscriptSegment> parse(String content, CaptionFormat format) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        String normalized = content.replace("\r\n", "\n").replace('\r', '\n').strip();
        return format == CaptionFormat.SRT ? parseSrt(normalized) : parseVtt(normalized);
    }

    private static List<TranscriptSegment> parseSrt(String content) {
        List<TranscriptSegment> out = new ArrayList<>();
        for (String block : BLOCK_SEPARATOR.split(content)) {
            String[] lines = block.strip().split("\n");
            if (lines.length < 3) {
                continue;
            }
            Matcher m = SRT_TIMING.matcher(lines[1].trim());
            if (!m.lookingAt()) {
                continue;
            }
            String text = joinLines(lines, 2);
            String speaker = null;
            Matcher sm = SRT_SPEAKER.matcher(text);
            if (sm.matches()) {
                speaker = sm.group(1).trim();
                text = sm.group(2).trim();
            }
            addCue(out, m, text, speaker);
        }
        return out;
    }

    private static List<TranscriptSegment> parseVtt(String content) {
        List<TranscriptSegment> out = new ArrayList<>();
        String[] blocks = BLOCK_SEPARATOR.split(content);
        boolean headerSeen = false;
        for (String block : blocks) {
            String[] lines = block.strip().split("\n");
            if (!headerSeen) {
                if (!lines[0].trim().startsWith("WEBVTT")) {
                    continue;
                }
                headerSeen = true;
                continue;
            }
            Matcher timing = null;
            StringBuilder text = new StringBuilder();
            String speaker = null;
            for (String raw : lines) {
                String line = raw.trim();
                if (line.contains("-->")) {
                    Matcher m = VTT_TIMING.matcher(line);
                    timing = m.lookingAt() ? m : null;
                    continue;
                }
                if (timing == null) {
                    // cue identifier, NOTE or STYLE content
                    continue;
                }
                Matcher v = VOICE_TAG.matcher(line);
                if (v.find() && speaker == null) {
                    speaker = v.group(1).trim();
                }
                String plain = ANY_TAG.matcher(line).replaceAll("").trim();
                if (!plain.isEmpty()) {
                    if (text.length() > 0) {
                        text.append(' ');
                    }
                    text.append(plain);
                }
            }
            if (timing != null) {
                addCue(out, timing, text.toString(), speaker);
            }
        }
        return out;
    }

    private static void addCue(List<TranscriptSegment> out, Matcher timing, String text, String speaker) {
        if (text.isBlank()) {
            return;
        }
        double start = seconds(timing, 1);
        double end = seconds(timing, 5);
        if (end < start) {
            LOG.debug("Skipping cue with end before start: {} > {}", start, end);
            return;
        }
        out.add(new TranscriptSegment(text, start, end, CAPTION_CONFIDENCE, speaker));
    }

    private static double seconds(Matcher m, int firstGroup) {
        int h = Integer.parseInt(m.group(firstGroup));
        int min = Integer.parseInt(m.group(firstGroup + 1));
        int s = Integer.parseInt(m.group(firstGroup + 2));
        int ms = Integer.parseInt(m.group(firstGroup + 3));
        return h * 3600 + min * 60 + s + ms / 1000.0;
    }

    private static String joinLines(String[] lines, int from) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(line);
        }
        return sb.toString();
    }
}
