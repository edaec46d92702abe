package com.phillippitts.livescribe.service.transcript;

import com.phillippitts.livescribe.config.properties.TranscriptProperties;
import com.phillippitts.livescribe.domain.TranscriptSegment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates live segments into a rolling window and a full retained list.
 *
 * <p>The live window is bounded by {@code transcript.max-window-seconds}, measured between segment
 * end times. The full list is never evicted and backs the persisted transcript.
 *
 * <p>Not thread-safe. A session's consumer thread owns its assembler.
 */
public class TranscriptAssembler {

    private static final Logger LOG = LogManager.getLogger(TranscriptAssembler.class);

    private static final String PARAGRAPH_BREAK = "\n\n";

    private final TranscriptProperties props;
    private final Deque<TranscriptSegment> window = new ArrayDeque<>();
    private final List<TranscriptSegment> all = new ArrayList<>();
    private String rendered = "";

    public TranscriptAssembler(TranscriptProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Appends a segment, evicting window entries that fall out of the live span, and refreshes the
     * cached rendering.
     */
    public void addSegment(TranscriptSegment segment) {
        Objects.requireNonNull(segment, "segment");
        int evicted = 0;
        while (!window.isEmpty() && segment.end() - window.peekFirst().end() > props.maxWindowSeconds()) {
            window.pollFirst();
            evicted++;
        }
        if (evicted > 0) {
            LOG.debug("Evicted {} segment(s) from live window", evicted);
        }
        window.addLast(segment);
        all.add(segment);
        rendered = renderWindow();
    }

    /**
     * Returns the cached rendering of the live window. Repeated calls without an intervening
     * {@link #addSegment} return the same string.
     */
    public String render() {
        return rendered;
    }

    /**
     * Live segments whose end lies within {@code seconds} of the latest end, oldest first.
     */
    public List<TranscriptSegment> getRecent(double seconds) {
        if (window.isEmpty()) {
            return List.of();
        }
        double latest = window.peekLast().end();
        List<TranscriptSegment> recent = new ArrayList<>();
        for (TranscriptSegment s : window) {
            if (latest - s.end() <= seconds) {
                recent.add(s);
            }
        }
        return recent;
    }

    public List<TranscriptSegment> getRecent() {
        return getRecent(props.recentSeconds());
    }

    public String renderRecent(double seconds) {
        StringBuilder sb = new StringBuilder();
        for (TranscriptSegment s : getRecent(seconds)) {
            String text = s.text().trim();
            if (text.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(text);
        }
        return sb.toString();
    }

    /** Every segment added so far, in order, regardless of window eviction. */
    public List<TranscriptSegment> fullTranscript() {
        return List.copyOf(all);
    }

    public List<TranscriptSegment> liveSegments() {
        return List.copyOf(window);
    }

    public int size() {
        return all.size();
    }

    private String renderWindow() {
        StringBuilder sb = new StringBuilder();
        TranscriptSegment previous = null;
        for (TranscriptSegment s : window) {
            String text = s.text().trim();
            if (text.isEmpty()) {
                continue;
            }
            if (previous != null) {
                if (s.start() - previous.end() > props.paragraphGapSeconds()) {
                    sb.append(PARAGRAPH_BREAK);
                } else if (!endsSentence(sb)) {
                    sb.append(' ');
                }
            }
            sb.append(text);
            previous = s;
        }
        return sb.toString();
    }

    private static boolean endsSentence(CharSequence sb) {
        if (sb.length() == 0) {
            return true;
        }
        char last = sb.charAt(sb.length() - 1);
        return last == '.' || last == '!' || last == '?' || last == '\n';
    }
}
