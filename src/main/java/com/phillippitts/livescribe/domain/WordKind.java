package com.phillippitts.livescribe.domain;

/**
 * Kind of a recognized token. Audio events (laughter, music) are carried but never spoken.
 */
public enum WordKind {
    WORD,
    EVENT;

    /**
     * Maps a provider type string to a kind; absent or {@code "word"} means {@link #WORD}.
     */
    public static WordKind fromProviderType(String type) {
        if (type == null || type.isBlank() || "word".equalsIgnoreCase(type)) {
            return WORD;
        }
        return EVENT;
    }
}
