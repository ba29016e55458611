package com.phillippitts.truthtell.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateHandlesNullAndNonPositiveLimits() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 10)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
    }

    @Test
    void previewFlattensLineBreaks() {
        assertThat(LogSanitizer.preview("line one\r\nline two\nthree")).isEqualTo("line one line two three");
    }

    @Test
    void previewShortensLongText() {
        String text = "x".repeat(100);

        String preview = LogSanitizer.preview(text);

        assertThat(preview).hasSize(LogSanitizer.DEFAULT_PREVIEW_CHARS + 3).endsWith("...");
    }

    @Test
    void previewOfNullIsEmpty() {
        assertThat(LogSanitizer.preview(null)).isEmpty();
    }
}
