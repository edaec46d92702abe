package com.phillippitts.livescribe.service.stt.scribe;

import com.phillippitts.livescribe.domain.Word;
import com.phillippitts.livescribe.domain.WordKind;
import com.phillippitts.livescribe.exception.RecognitionException;
import com.phillippitts.livescribe.service.stt.EngineNames;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses word lists out of speech-to-text responses.
 *
 * <p>Two shapes are accepted:
 * <ul>
 *   <li>{@code {"words": [...]}}: single channel, optionally with {@code speaker_id}</li>
 *   <li>{@code {"transcripts": [{"channel_index": 0, "words": [...]}]}}: multi-channel; every word
 *       is tagged with its transcript's channel (0 when absent)</li>
 * </ul>
 * Only entries whose {@code type} is absent or {@code "word"} are kept; spacing and audio events are
 * dropped. Anything else raises {@link RecognitionException}.
 */
public final class ScribeResponseParser {

    private ScribeResponseParser() {}

    public static List<Word> parseWords(String body) {
        if (body == null || body.isBlank()) {
            throw new RecognitionException("Empty response body", EngineNames.SCRIBE);
        }
        try {
            JSONObject obj = new JSONObject(body);
            List<Word> words = new ArrayList<>();
            if (obj.has("transcripts")) {
                JSONArray transcripts = obj.getJSONArray("transcripts");
                for (int i = 0; i < transcripts.length(); i++) {
                    JSONObject transcript = transcripts.getJSONObject(i);
                    int channel = transcript.optInt("channel_index", 0);
                    JSONArray items = transcript.optJSONArray("words");
                    if (items != null) {
                        collect(items, channel, words);
                    }
                }
            } else if (obj.has("words")) {
                collect(obj.getJSONArray("words"), null, words);
            } else {
                throw new RecognitionException("No 'words' or 'transcripts' in response. Keys: " + obj.keySet(),
                        EngineNames.SCRIBE);
            }
            return words;
        } catch (JSONException | IllegalArgumentException e) {
            throw new RecognitionException("Unparseable response: " + e.getMessage(), EngineNames.SCRIBE, e);
        }
    }

    private static void collect(JSONArray items, Integer channel, List<Word> out) {
        for (int i = 0; i < items.length(); i++) {
            JSONObject item = items.getJSONObject(i);
            String type = item.isNull("type") ? null : item.optString("type", null);
            if (WordKind.fromProviderType(type) != WordKind.WORD) {
                continue;
            }
            String speaker = item.isNull("speaker_id") ? null : item.optString("speaker_id", null);
            out.add(new Word(
                    item.optString("text", ""),
                    item.optDouble("start", 0.0),
                    item.optDouble("end", 0.0),
                    speaker,
                    channel,
                    WordKind.WORD));
        }
    }
}
