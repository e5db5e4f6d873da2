package io.authflow.core.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void shouldReturnNullStringForNullInput() {
        assertThat(LogSanitizer.sanitize(null)).isEqualTo("null");
    }

    @Test
    void shouldReturnCleanStringUnchanged() {
        assertThat(LogSanitizer.sanitize("risk-based-login")).isEqualTo("risk-based-login");
    }

    @Test
    void shouldStripCrLfSequence() {
        assertThat(LogSanitizer.sanitize("tenant-a\r\n[Security] forged entry"))
                .isEqualTo("tenant-a[Security] forged entry");
    }

    @Test
    void shouldStripOtherControlCharacters() {
        assertThat(LogSanitizer.sanitize("a\tb\u0000c\u001Bd\u007Fe")).isEqualTo("abcde");
    }

    @Test
    void shouldPreserveSpecialCharsThatAreNotControlChars() {
        assertThat(LogSanitizer.sanitize("request.country=\"DE\" <script>"))
                .isEqualTo("request.country=\"DE\" <script>");
    }

    @Test
    void shouldKeepValueAtLengthCap() {
        String value = "x".repeat(256);

        assertThat(LogSanitizer.sanitize(value)).isEqualTo(value);
    }

    @Test
    void shouldTruncateOverlongValueWithEllipsis() {
        // Given
        String value = "x".repeat(300);

        // When
        String sanitized = LogSanitizer.sanitize(value);

        // Then
        assertThat(sanitized).hasSize(259).endsWith("...");
        assertThat(sanitized).startsWith("x".repeat(256));
    }

    @Test
    void shouldHandleEmptyString() {
        assertThat(LogSanitizer.sanitize("")).isEmpty();
    }
}
