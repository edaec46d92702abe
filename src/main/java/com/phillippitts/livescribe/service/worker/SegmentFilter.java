package com.phillippitts.livescribe.service.worker;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a recognized text is worth emitting.
 *
 * <p>Rejects blank text, text shorter than the minimum, text made only of filler tokens, and
 * text equal (trimmed, case-insensitive) to one of the last few accepted texts.
 *
 * <p>Not thread-safe; owned by the worker thread.
 */
final class SegmentFilter {

    static final String EMPTY = "empty";
    static final String TOO_SHORT = "too_short";
    static final String FILLER = "filler";
    static final String DUPLICATE = "duplicate";

    private final int minTextLength;
    private final Set<String> fillers;
    private final int historySize;
    private final Deque<String> recent = new ArrayDeque<>();

    SegmentFilter(int minTextLength, Collection<String> fillers, int historySize) {
        this.minTextLength = minTextLength;
        this.fillers = fillers.stream()
                .map(f -> f.trim().toLowerCase(Locale.ROOT))
                .filter(f -> !f.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        this.historySize = historySize;
    }

    /**
     * @return the rejection reason, or empty when the text should be emitted
     */
    Optional<String> rejectionReason(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return Optional.of(EMPTY);
        }
        if (trimmed.length() < minTextLength) {
            return Optional.of(TOO_SHORT);
        }
        if (isOnlyFillers(trimmed)) {
            return Optional.of(FILLER);
        }
        if (recent.contains(key(trimmed))) {
            return Optional.of(DUPLICATE);
        }
        return Optional.empty();
    }

    /** Records an emitted text for duplicate detection. */
    void remember(String text) {
        if (historySize <= 0) {
            return;
        }
        recent.addLast(key(text));
        while (recent.size() > historySize) {
            recent.removeFirst();
        }
    }

    private boolean isOnlyFillers(String text) {
        if (fillers.isEmpty()) {
            return false;
        }
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}']+");
        boolean sawToken = false;
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            sawToken = true;
            if (!fillers.contains(token)) {
                return false;
            }
        }
        return sawToken;
    }

    private static String key(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }
}
