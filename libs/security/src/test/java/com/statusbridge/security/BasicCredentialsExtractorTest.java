package com.statusbridge.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for BasicCredentialsExtractor: decoding of "Basic xxx" Authorization headers
 * and graceful handling of missing or malformed ones.
 */
@DisplayName("BasicCredentialsExtractor")
class BasicCredentialsExtractorTest {

    @Nested
    @DisplayName("valid headers")
    class ValidHeaders {

        @Test
        @DisplayName("decodes 'Basic base64(user:pass)'")
        void decodesCredentials() {
            // alertmanager:s3cret
            var result = BasicCredentialsExtractor.extract("Basic YWxlcnRtYW5hZ2VyOnMzY3JldA==");

            assertThat(result).contains(new BasicCredentials("alertmanager", "s3cret"));
        }

        @Test
        @DisplayName("keeps colons that belong to the password")
        void keepsColonsInPassword() {
            var header = BasicCredentialsExtractor.encode(new BasicCredentials("am", "a:b:c"));

            assertThat(BasicCredentialsExtractor.extract(header))
                    .contains(new BasicCredentials("am", "a:b:c"));
        }

        @Test
        @DisplayName("is case-insensitive for the scheme and tolerates extra whitespace")
        void caseInsensitiveScheme() {
            var result = BasicCredentialsExtractor.extract("  basic    YWxlcnRtYW5hZ2VyOnMzY3JldA==  ");

            assertThat(result).map(BasicCredentials::username).contains("alertmanager");
        }
    }

    @Nested
    @DisplayName("invalid headers")
    class InvalidHeaders {

        @Test
        @DisplayName("returns empty for null or blank header")
        void nullOrBlank() {
            assertThat(BasicCredentialsExtractor.extract(null)).isEmpty();
            assertThat(BasicCredentialsExtractor.extract("   ")).isEmpty();
        }

        @Test
        @DisplayName("returns empty for the Bearer scheme")
        void bearerScheme() {
            assertThat(BasicCredentialsExtractor.extract("Bearer eyJhbGciOiJIUzI1NiJ9")).isEmpty();
        }

        @Test
        @DisplayName("returns empty for 'Basic' with no payload")
        void basicWithoutPayload() {
            assertThat(BasicCredentialsExtractor.extract("Basic")).isEmpty();
            assertThat(BasicCredentialsExtractor.extract("Basic ")).isEmpty();
        }

        @Test
        @DisplayName("returns empty for a scheme that only starts with 'Basic'")
        void schemePrefixOnly() {
            assertThat(BasicCredentialsExtractor.extract("BasicYWxlcnQ6eA==")).isEmpty();
        }

        @Test
        @DisplayName("returns empty for invalid base64 or missing colon")
        void badPayload() {
            assertThat(BasicCredentialsExtractor.extract("Basic !!!not-base64!!!")).isEmpty();
            // "nocolon"
            assertThat(BasicCredentialsExtractor.extract("Basic bm9jb2xvbg==")).isEmpty();
        }
    }

    @Test
    @DisplayName("toString never exposes the password")
    void toStringHidesPassword() {
        assertThat(new BasicCredentials("am", "hunter2").toString())
                .contains("am")
                .doesNotContain("hunter2");
    }
}
