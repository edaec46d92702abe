package com.phillippitts.livescribe.service.align;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes text for fuzzy matching: lower case, punctuation to spaces, whitespace collapsed.
 */
public final class TextNormalizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextNormalizer() {}

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String spaced = NON_WORD.matcher(lower).replaceAll(" ");
        return WHITESPACE.matcher(spaced).replaceAll(" ").strip();
    }
}
