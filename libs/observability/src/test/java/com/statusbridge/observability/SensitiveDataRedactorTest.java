package com.statusbridge.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SensitiveDataRedactor}: header redaction,
 * case insensitivity, custom patterns, and edge cases.
 */
@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Nested
    @DisplayName("Default patterns")
    class DefaultPatterns {

        @Test
        @DisplayName("should redact the Authorization header and keep the rest in order")
        void shouldRedactAuthorizationHeader() {
            Map<String, String> headers = new LinkedHashMap<>();
            headers.put("Host", "bridge.internal:8080");
            headers.put("Authorization", "Basic YWxlcnQ6c2VjcmV0");
            headers.put("Content-Type", "application/json");

            Map<String, Object> result = redactor.redact(headers);

            assertThat(result).containsExactly(
                    Map.entry("Host", "bridge.internal:8080"),
                    Map.entry("Authorization", SensitiveDataRedactor.REDACTED),
                    Map.entry("Content-Type", "application/json"));
        }

        @Test
        @DisplayName("should redact token, secret, cookie and api key fields")
        void shouldRedactOtherSecrets() {
            Map<String, Object> data = Map.of(
                    "X-Api-Token", "abc",
                    "client_secret", "xyz",
                    "Cookie", "JSESSIONID=1",
                    "apiKey", "AKIA");

            assertThat(redactor.redact(data).values()).containsOnly(SensitiveDataRedactor.REDACTED);
        }

        @Test
        @DisplayName("should match regardless of case and as substring")
        void shouldMatchCaseInsensitiveSubstrings() {
            assertThat(redactor.isSensitive("PROXY-AUTHORIZATION")).isTrue();
            assertThat(redactor.isSensitive("userPassword")).isTrue();
            assertThat(redactor.isSensitive("User-Agent")).isFalse();
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("should return empty map for null or empty input")
        void shouldReturnEmptyForNullOrEmpty() {
            assertThat(redactor.redact(null)).isEmpty();
            assertThat(redactor.redact(Map.of())).isEmpty();
        }

        @Test
        @DisplayName("should return false for null field name")
        void shouldReturnFalseForNull() {
            assertThat(redactor.isSensitive(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("Custom patterns")
    class CustomPatterns {

        @Test
        @DisplayName("should use only the custom sensitive patterns")
        void shouldUseCustomPatterns() {
            var custom = new SensitiveDataRedactor(Set.of("x-signature"));

            Map<String, Object> result = custom.redact(Map.of(
                    "X-Signature", "sha256=...",
                    "Authorization", "Basic abc"));

            assertThat(result.get("X-Signature")).isEqualTo(SensitiveDataRedactor.REDACTED);
            assertThat(result.get("Authorization")).isEqualTo("Basic abc");
            assertThat(custom.sensitivePatterns()).containsExactly("x-signature");
        }
    }
}
