package com.phillippitts.livescribe.service.stt.whisper;

import com.phillippitts.livescribe.domain.RecognitionResult;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.exception.RecognitionException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses whisper.cpp stdout into a {@link RecognitionResult}.
 *
 * <p>Accepted shapes:
 * <ul>
 *   <li>whisper.cpp JSON with {@code transcription[]}: {@code offsets.from/to} in milliseconds,
 *       optional {@code tokens[].p}</li>
 *   <li>JSON with {@code segments[]}: {@code start/end} in seconds</li>
 *   <li>plain console lines {@code [00:00:01.000 --> 00:00:03.000]  text}</li>
 *   <li>bare text (no timing)</li>
 * </ul>
 *
 * <p>Blank output yields an empty result. Output that starts like JSON but does not parse is
 * rejected with {@link RecognitionException}.
 */
public final class WhisperJsonParser {

    private static final Pattern CONSOLE_LINE = Pattern.compile(
            "^\\[(\\d{2}):(\\d{2}):(\\d{2})[.,](\\d{3})\\s*-->\\s*(\\d{2}):(\\d{2}):(\\d{2})[.,](\\d{3})]\\s*(.*)$");

    private WhisperJsonParser() {}

    public static RecognitionResult parse(String stdout, String engine) {
        if (stdout == null || stdout.isBlank()) {
            return new RecognitionResult("", List.of(), List.of(), null, engine);
        }
        String trimmed = stdout.trim();
        int open = trimmed.indexOf('{');
        if (open >= 0 && trimmed.substring(0, open).isBlank()) {
            return parseJson(trimmed, engine);
        }
        return parseConsole(trimmed, engine);
    }

    private static RecognitionResult parseJson(String json, String engine) {
        JSONObject obj;
        try {
            obj = new JSONObject(json.substring(0, json.lastIndexOf('}') + 1));
        } catch (JSONException | StringIndexOutOfBoundsException e) {
            throw new RecognitionException("Malformed whisper JSON: " + e.getMessage(), engine, e);
        }
        List<TranscriptSegment> segments = new ArrayList<>();
        ProbabilityTotals totals = new ProbabilityTotals();

        JSONArray transcription = obj.optJSONArray("transcription");
        JSONArray segs = obj.optJSONArray("segments");
        if (transcription != null) {
            for (int i = 0; i < transcription.length(); i++) {
                JSONObject item = transcription.optJSONObject(i);
                if (item == null) {
                    continue;
                }
                JSONObject offsets = item.optJSONObject("offsets");
                double start = offsets == null ? 0.0 : offsets.optDouble("from", 0.0) / WhisperConstants.MILLIS_PER_SECOND;
                double end = offsets == null ? start : offsets.optDouble("to", 0.0) / WhisperConstants.MILLIS_PER_SECOND;
                addSegment(segments, totals, item.optString("text", ""), start, end, item.optJSONArray("tokens"));
            }
        } else if (segs != null) {
            for (int i = 0; i < segs.length(); i++) {
                JSONObject item = segs.optJSONObject(i);
                if (item == null) {
                    continue;
                }
                double start = item.optDouble("start", 0.0);
                double end = item.optDouble("end", start);
                addSegment(segments, totals, item.optString("text", ""), start, end, item.optJSONArray("tokens"));
            }
        } else if (!obj.has("text")) {
            throw new RecognitionException("Unrecognized whisper JSON: no transcription, segments or text", engine);
        }

        String text;
        if (!segments.isEmpty()) {
            text = joinTexts(segments);
        } else {
            text = obj.optString("text", "").trim();
        }
        return new RecognitionResult(text, segments, List.of(), totals.mean(), engine);
    }

    private static RecognitionResult parseConsole(String out, String engine) {
        List<TranscriptSegment> segments = new ArrayList<>();
        StringBuilder bare = new StringBuilder();
        for (String line : out.split("\\R")) {
            Matcher m = CONSOLE_LINE.matcher(line.trim());
            if (m.matches()) {
                double start = toSeconds(m, 1);
                double end = Math.max(start, toSeconds(m, 5));
                String text = m.group(9).trim();
                if (!text.isEmpty()) {
                    segments.add(TranscriptSegment.of(text, start, end, WhisperConstants.DEFAULT_SEGMENT_CONFIDENCE));
                }
            } else if (!line.isBlank()) {
                if (bare.length() > 0) {
                    bare.append(' ');
                }
                bare.append(line.trim());
            }
        }
        String text = segments.isEmpty() ? bare.toString() : joinTexts(segments);
        return new RecognitionResult(text, segments, List.of(), null, engine);
    }

    private static void addSegment(List<TranscriptSegment> segments, ProbabilityTotals totals,
                                   String rawText, double start, double end, JSONArray tokens) {
        String text = rawText == null ? "" : rawText.trim();
        if (text.isEmpty()) {
            return;
        }
        ProbabilityTotals local = new ProbabilityTotals();
        if (tokens != null) {
            for (int t = 0; t < tokens.length(); t++) {
                JSONObject token = tokens.optJSONObject(t);
                if (token == null || !token.has("p")) {
                    continue;
                }
                String tokenText = token.optString("text", "");
                // special tokens like [_BEG_] carry no speech probability
                if (tokenText.startsWith("[_")) {
                    continue;
                }
                double p = clamp(token.optDouble("p", 0.0));
                local.add(p);
                totals.add(p);
            }
        }
        Double mean = local.mean();
        double confidence = mean != null ? mean : WhisperConstants.DEFAULT_SEGMENT_CONFIDENCE;
        segments.add(TranscriptSegment.of(text, start, Math.max(start, end), confidence));
    }

    private static String joinTexts(List<TranscriptSegment> segments) {
        StringBuilder sb = new StringBuilder();
        for (TranscriptSegment s : segments) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(s.text());
        }
        return sb.toString();
    }

    private static double toSeconds(Matcher m, int firstGroup) {
        int h = Integer.parseInt(m.group(firstGroup));
        int min = Integer.parseInt(m.group(firstGroup + 1));
        int s = Integer.parseInt(m.group(firstGroup + 2));
        int ms = Integer.parseInt(m.group(firstGroup + 3));
        return h * 3600 + min * 60 + s + ms / 1000.0;
    }

    private static double clamp(double p) {
        if (Double.isNaN(p)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, p));
    }

    private static final class ProbabilityTotals {
        private double sum;
        private int count;

        void add(double p) {
            sum += p;
            count++;
        }

        Double mean() {
            return count == 0 ? null : sum / count;
        }
    }
}
