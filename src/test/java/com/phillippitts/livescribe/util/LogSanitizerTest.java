package com.phillippitts.livescribe.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void previewFlattensAndTruncates() {
        String longText = "line one\nline two " + "x".repeat(60);
        String preview = LogSanitizer.preview(longText);
        assertThat(preview).doesNotContain("\n").endsWith("...");
        assertThat(preview).hasSize(LogSanitizer.DEFAULT_PREVIEW_CHARS + 3);
    }

    @Test
    void shortTextIsUnchanged() {
        assertThat(LogSanitizer.preview("hello")).isEqualTo("hello");
        assertThat(LogSanitizer.preview(null)).isEmpty();
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("abc", 0)).isEmpty();
    }
}
