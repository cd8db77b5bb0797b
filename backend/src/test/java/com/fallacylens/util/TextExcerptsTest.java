package com.fallacylens.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextExcerptsTest {

    @Test
    @DisplayName("Short text is returned flattened")
    void shortText() {
        assertThat(TextExcerpts.truncate("line one\nline   two", 40)).isEqualTo("line one line two");
    }

    @Test
    @DisplayName("Long text is cut with an ellipsis")
    void longText() {
        assertThat(TextExcerpts.truncate("abcdefghij", 4)).isEqualTo("abcd...");
    }

    @Test
    @DisplayName("Null or non-positive limit yields empty")
    void empty() {
        assertThat(TextExcerpts.truncate(null, 10)).isEmpty();
        assertThat(TextExcerpts.truncate("abc", 0)).isEmpty();
    }
}
