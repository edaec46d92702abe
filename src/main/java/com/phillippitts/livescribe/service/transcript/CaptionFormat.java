package com.phillippitts.livescribe.service.transcript;

import java.util.Locale;

/** Subtitle formats produced by {@link CaptionWriter}. */
public enum CaptionFormat {
    SRT("srt", ','),
    VTT("vtt", '.');

    private final String extension;
    private final char millisSeparator;

    CaptionFormat(String extension, char millisSeparator) {
        this.extension = extension;
        this.millisSeparator = millisSeparator;
    }

    public String extension() {
        return extension;
    }

    char millisSeparator() {
        return millisSeparator;
    }

    /**
     * Resolves a format from a file name by extension, or null when neither matches.
     */
    public static CaptionFormat fromFileName(String name) {
        if (name == null) {
            return null;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (CaptionFormat f : values()) {
            if (lower.endsWith("." + f.extension)) {
                return f;
            }
        }
        return null;
    }
}
