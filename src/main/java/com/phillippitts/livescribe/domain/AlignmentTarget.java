package com.phillippitts.livescribe.domain;

import java.util.Objects;

/**
 * A derived summary (chapter, highlight) to be re-anchored onto the transcript timeline.
 *
 * @param title          short title (must not be null)
 * @param summaryText    summary body used as the search cue (may be empty)
 * @param startTimestamp aligned start in seconds, or null while unaligned
 */
public record AlignmentTarget(String title, String summaryText, Double startTimestamp) {

    public AlignmentTarget {
        Objects.requireNonNull(title, "title must not be null");
        summaryText = summaryText == null ? "" : summaryText;
    }

    public static AlignmentTarget of(String title, String summaryText) {
        return new AlignmentTarget(title, summaryText, null);
    }

    public AlignmentTarget withStartTimestamp(double seconds) {
        return new AlignmentTarget(title, summaryText, seconds);
    }

    public boolean isAligned() {
        return startTimestamp != null;
    }

    /** Summary text when present, otherwise the title. */
    public String searchText() {
        return summaryText.isBlank() ? title : summaryText;
    }
}
