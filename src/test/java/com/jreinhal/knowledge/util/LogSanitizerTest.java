package com.jreinhal.knowledge.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Nested
    @DisplayName("textSummary()")
    class TextSummaryTest {
        @Test
        @DisplayName("Should describe null as empty")
        void shouldHandleNull() {
            assertThat(LogSanitizer.textSummary(null)).isEqualTo("[len=0,id=none]");
        }

        @Test
        @DisplayName("Should report length and a stable id")
        void shouldReturnLengthAndHash() {
            String result = LogSanitizer.textSummary("how do we deploy?");

            assertThat(result).startsWith("[len=17,id=").endsWith("]");
            assertThat(result).isEqualTo(LogSanitizer.textSummary("how do we deploy?"));
        }
    }

    @Nested
    @DisplayName("sanitize()")
    class SanitizeTest {
        @Test
        @DisplayName("Should fold line breaks and strip control characters")
        void shouldStripControlChars() {
            assertThat(LogSanitizer.sanitize("line1\r\nline2")).isEqualTo("line1 line2");
            assertThat(LogSanitizer.sanitize("inject\u0000ed\u001B")).isEqualTo("injected");
            assertThat(LogSanitizer.sanitize(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("preview() and maskEmail()")
    class PreviewTest {
        @Test
        @DisplayName("Should truncate long values")
        void shouldTruncate() {
            assertThat(LogSanitizer.preview("abcdefgh", 3)).isEqualTo("abc...");
            assertThat(LogSanitizer.preview("abc", 3)).isEqualTo("abc");
        }

        @Test
        @DisplayName("Should keep only the first character and domain")
        void shouldMaskEmail() {
            assertThat(LogSanitizer.maskEmail("alice@example.com")).isEqualTo("a***@example.com");
            assertThat(LogSanitizer.maskEmail("not-an-email")).isEqualTo("***");
            assertThat(LogSanitizer.maskEmail(null)).isEmpty();
        }
    }
}
