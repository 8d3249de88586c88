package com.ownmyhealth.phi.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Nested
    @DisplayName("sanitize()")
    class SanitizeTest {
        @Test
        @DisplayName("Should return empty string for null")
        void shouldHandleNull() {
            assertThat(LogSanitizer.sanitize(null)).isEmpty();
        }

        @Test
        @DisplayName("Should flatten forged log lines")
        void shouldFlattenNewlines() {
            assertThat(LogSanitizer.sanitize("ok\r\n2026-01-01 INFO admin logged in")).isEqualTo("ok 2026-01-01 INFO admin logged in");
        }

        @Test
        @DisplayName("Should strip control characters")
        void shouldStripControlChars() {
            assertThat(LogSanitizer.sanitize("a\u0000b\u001Bc\u007F")).isEqualTo("abc");
        }
    }

    @Nested
    @DisplayName("maskEmail()")
    class MaskEmailTest {
        @Test
        @DisplayName("Should keep first letter and domain")
        void shouldMaskLocalPart() {
            assertThat(LogSanitizer.maskEmail("jane.doe@example.com")).isEqualTo("j***@example.com");
        }

        @Test
        @DisplayName("Should collapse non-addresses")
        void shouldCollapseGarbage() {
            assertThat(LogSanitizer.maskEmail(null)).isEqualTo("***");
            assertThat(LogSanitizer.maskEmail("@example.com")).isEqualTo("***");
            assertThat(LogSanitizer.maskEmail("jane@")).isEqualTo("***");
            assertThat(LogSanitizer.maskEmail("no-at-sign")).isEqualTo("***");
        }
    }
}
