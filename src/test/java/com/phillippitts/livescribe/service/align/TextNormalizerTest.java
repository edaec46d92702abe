package com.phillippitts.livescribe.service.align;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void lowercasesAndReplacesPunctuation() {
        assertThat(TextNormalizer.normalize("  Hello, World!\tIt's   fine. ")).isEqualTo("hello world it s fine");
    }

    @Test
    void keepsUnicodeLetters() {
        assertThat(TextNormalizer.normalize("Café déjà-vu")).isEqualTo("café déjà vu");
    }

    @Test
    void emptyForNullOrBlank() {
        assertThat(TextNormalizer.normalize(null)).isEmpty();
        assertThat(TextNormalizer.normalize("?!")).isEmpty();
    }
}
