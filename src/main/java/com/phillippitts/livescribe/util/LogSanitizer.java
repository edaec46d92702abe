package com.phillippitts.livescribe.util;

/** Utility for privacy-safe logging of transcript previews. */
public final class LogSanitizer {

    /** Default preview length used for DEBUG-level transcript previews. */
    public static final int DEFAULT_PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Short single-line preview: newlines flattened, truncated, with an ellipsis when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replace('\n', ' ').replace('\r', ' ').trim();
        String cut = truncate(flat, DEFAULT_PREVIEW_CHARS);
        return cut.length() < flat.length() ? cut + "..." : cut;
    }
}
