package com.phillippitts.livescribe.service.transcript;

import com.phillippitts.livescribe.domain.DiarizationInterval;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Labels recognition segments with speakers from an independent diarization pass.
 *
 * <p>Each segment takes the label of the first interval whose {@code [start, end)} contains the
 * segment midpoint. This is an approximation: a segment straddling a speaker change gets whichever
 * speaker holds its midpoint, and overlapping intervals resolve to the first in list order.
 */
public class DiarizationReconciler {

    private static final Logger LOG = LogManager.getLogger(DiarizationReconciler.class);

    public static final String UNKNOWN_SPEAKER = "Unknown";
    public static final String SPEAKER_PREFIX = "Speaker ";

    public List<TranscriptSegment> assign(List<TranscriptSegment> segments, List<DiarizationInterval> intervals) {
        Objects.requireNonNull(segments, "segments");
        Objects.requireNonNull(intervals, "intervals");
        List<TranscriptSegment> labeled = new ArrayList<>(segments.size());
        int unmatched = 0;
        for (TranscriptSegment segment : segments) {
            String label = labelFor(segment.midpoint(), intervals);
            if (label == null) {
                unmatched++;
                labeled.add(segment.withSpeaker(UNKNOWN_SPEAKER));
            } else {
                labeled.add(segment.withSpeaker(SPEAKER_PREFIX + label));
            }
        }
        if (unmatched > 0) {
            LOG.debug("{} of {} segments had no covering diarization interval", unmatched, segments.size());
        }
        return labeled;
    }

    private static String labelFor(double t, List<DiarizationInterval> intervals) {
        for (DiarizationInterval interval : intervals) {
            if (interval.contains(t)) {
                return interval.speakerLabel();
            }
        }
        return null;
    }
}
