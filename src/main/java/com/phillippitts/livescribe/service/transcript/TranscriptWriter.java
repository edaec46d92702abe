package com.phillippitts.livescribe.service.transcript;

import com.phillippitts.livescribe.domain.SpeakerTurn;
import com.phillippitts.livescribe.domain.TimedText;
import com.phillippitts.livescribe.domain.Transcript;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Persists a finished {@link Transcript} as {@code transcript.json}, {@code transcript.txt},
 * {@code transcript.srt} and {@code transcript.vtt} in a per-session directory.
 */
public class TranscriptWriter {

    private static final Logger LOG = LogManager.getLogger(TranscriptWriter.class);

    static final String JSON_FILE = "transcript.json";
    static final String TEXT_FILE = "transcript.txt";
    static final String BASE_NAME = "transcript";
    private static final int JSON_INDENT = 2;

    private final Path outputDir;
    private final CaptionWriter captions;

    public TranscriptWriter(Path outputDir, CaptionWriter captions) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.captions = Objects.requireNonNull(captions, "captions");
    }

    /**
     * Writes all artifacts under {@code <output-dir>/<session-id>/}, replacing earlier files.
     */
    public TranscriptFiles write(Transcript transcript) throws IOException {
        Objects.requireNonNull(transcript, "transcript");
        Path dir = outputDir.resolve(transcript.sessionId());
        Files.createDirectories(dir);

        List<TimedText> entries = transcript.entries();
        String fullText = transcript.fullText();

        TranscriptFiles files = new TranscriptFiles(dir,
                dir.resolve(JSON_FILE),
                dir.resolve(TEXT_FILE),
                dir.resolve(BASE_NAME + "." + CaptionFormat.SRT.extension()),
                dir.resolve(BASE_NAME + "." + CaptionFormat.VTT.extension()));

        Files.writeString(files.json(), toJson(transcript, entries, fullText).toString(JSON_INDENT),
                StandardCharsets.UTF_8);
        Files.writeString(files.text(), fullText, StandardCharsets.UTF_8);
        Files.writeString(files.srt(), captions.toSrt(entries), StandardCharsets.UTF_8);
        Files.writeString(files.vtt(), captions.toVtt(entries), StandardCharsets.UTF_8);

        LOG.info("Persisted transcript session={} entries={} chars={} dir={}",
                transcript.sessionId(), entries.size(), fullText.length(), dir);
        return files;
    }

    static JSONObject toJson(Transcript transcript, List<TimedText> entries, String fullText) {
        JSONObject root = new JSONObject();
        root.put("sessionId", transcript.sessionId());
        root.put("createdAt", transcript.createdAt().toString());
        root.put("provider", transcript.provider() == null ? JSONObject.NULL : transcript.provider());
        JSONArray arr = new JSONArray();
        for (TimedText t : entries) {
            JSONObject e = new JSONObject();
            e.put("text", t.text());
            e.put("start", t.start());
            e.put("end", t.end());
            e.put("speaker", t.speaker() == null ? JSONObject.NULL : t.speaker());
            if (t instanceof TranscriptSegment seg) {
                e.put("confidence", seg.confidence());
            }
            if (t instanceof SpeakerTurn turn && turn.channelIndex() != null) {
                e.put("channel", turn.channelIndex().intValue());
            }
            arr.put(e);
        }
        root.put("entries", arr);
        root.put("fullText", fullText);
        return root;
    }
}
