package com.structura.labeling.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncatesLongText() {
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("ab", 3)).isEqualTo("ab");
    }

    @Test
    void truncatesByCodePointsWithoutSplittingSurrogatePairs() {
        String emoji = "\uD83D\uDE00";
        String text = "ab" + emoji + emoji + "cd";

        assertThat(LogSanitizer.truncate(text, 3)).isEqualTo("ab" + emoji);
        assertThat(LogSanitizer.truncate(text, 6)).isEqualTo(text);
        assertThat(LogSanitizer.truncate("第".repeat(5), 2)).isEqualTo("第第");
    }

    @Test
    void handlesNullAndNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 0)).isEmpty();
    }

    @Test
    void singleLineCollapsesLineBreaks() {
        assertThat(LogSanitizer.singleLine("a\r\nb\tc", 20)).isEqualTo("a b c");
    }
}
