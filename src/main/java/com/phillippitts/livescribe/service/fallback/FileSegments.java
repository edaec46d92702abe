package com.phillippitts.livescribe.service.fallback;

import com.phillippitts.livescribe.domain.RecognitionResult;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import com.phillippitts.livescribe.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a whole-file recognition result into transcript segments.
 */
final class FileSegments {

    private static final Logger LOG = LogManager.getLogger(FileSegments.class);

    static final double UNTIMED_CONFIDENCE = 0.8;

    private FileSegments() {}

    /**
     * Non-blank segments of the result. Text without timing becomes one segment spanning the file.
     */
    static List<TranscriptSegment> from(RecognitionResult result, Path wav) {
        List<TranscriptSegment> out = new ArrayList<>();
        for (TranscriptSegment s : result.segments()) {
            if (!s.text().isBlank()) {
                out.add(s);
            }
        }
        if (out.isEmpty() && !result.text().isBlank()) {
            out.add(TranscriptSegment.of(result.text().trim(), 0.0, durationOf(wav),
                    result.confidenceOr(UNTIMED_CONFIDENCE)));
        }
        return out;
    }

    private static double durationOf(Path wav) {
        try {
            return AudioFormat.canonicalWavSeconds(Files.size(wav));
        } catch (IOException e) {
            LOG.debug("Cannot size {}: {}", wav.getFileName(), e.toString());
            return 0.0;
        }
    }
}
