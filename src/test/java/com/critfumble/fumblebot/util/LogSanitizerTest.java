package com.critfumble.fumblebot.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateCutsToMaxAndHandlesNull() {
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("abc", 10)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate(null, 3)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 0)).isEmpty();
    }

    @Test
    void previewFlattensWhitespaceAndMarksTruncation() {
        assertThat(LogSanitizer.preview("roll\n  a   d20", 20)).isEqualTo("roll a d20");
        assertThat(LogSanitizer.preview("roll a d20 for me", 6)).isEqualTo("roll a...");
        assertThat(LogSanitizer.preview(null, 6)).isEmpty();
    }
}
