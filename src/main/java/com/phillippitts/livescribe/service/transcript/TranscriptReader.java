package com.phillippitts.livescribe.service.transcript;

import com.phillippitts.livescribe.domain.TranscriptSegment;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a persisted {@code transcript.json} back into segments, in stored order.
 *
 * <p>Entries without a confidence (speaker turns) read back with confidence 1.0.
 */
public final class TranscriptReader {

    private static final double DEFAULT_CONFIDENCE = 1.0;

    private TranscriptReader() {}

    public static List<TranscriptSegment> read(Path json) throws IOException {
        return parse(Files.readString(json, StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalArgumentException when the document is not a persisted transcript
     */
    public static List<TranscriptSegment> parse(String json) {
        try {
            JSONObject root = new JSONObject(json);
            JSONArray entries = root.getJSONArray("entries");
            List<TranscriptSegment> out = new ArrayList<>(entries.length());
            for (int i = 0; i < entries.length(); i++) {
                JSONObject e = entries.getJSONObject(i);
                String speaker = e.isNull("speaker") ? null : e.optString("speaker", null);
                out.add(new TranscriptSegment(
                        e.getString("text"),
                        e.getDouble("start"),
                        e.getDouble("end"),
                        e.optDouble("confidence", DEFAULT_CONFIDENCE),
                        speaker));
            }
            return out;
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid transcript JSON: " + e.getMessage(), e);
        }
    }
}
