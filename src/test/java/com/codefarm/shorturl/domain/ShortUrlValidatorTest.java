package com.codefarm.shorturl.domain;

import com.codefarm.shorturl.exception.InvalidAliasException;
import com.codefarm.shorturl.exception.InvalidUrlException;
import com.codefarm.shorturl.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ShortUrlValidator unit test")
class ShortUrlValidatorTest {

    @Nested
    @DisplayName("original URL")
    class OriginalUrl {

        @Test
        @DisplayName("surrounding whitespace is trimmed")
        void trims() {
            assertThat(ShortUrlValidator.validateOriginalUrl("  https://example.com/a?b=c  "))
                    .isEqualTo("https://example.com/a?b=c");
        }

        @ParameterizedTest
        @ValueSource(strings = {"ftp://example.com/file", "javascript:alert(1)", "example.com/path", "/relative"})
        @DisplayName("non-http schemes and relative references are rejected")
        void rejectsNonHttp(String url) {
            assertThatThrownBy(() -> ShortUrlValidator.validateOriginalUrl(url))
                    .isInstanceOf(InvalidUrlException.class);
        }

        @Test
        @DisplayName("blank and oversized URLs are rejected")
        void rejectsBlankAndLong() {
            assertThatThrownBy(() -> ShortUrlValidator.validateOriginalUrl(" "))
                    .isInstanceOf(InvalidUrlException.class);
            String longUrl = "https://example.com/" + "a".repeat(ShortUrlValidator.MAX_URL_LENGTH);
            assertThatThrownBy(() -> ShortUrlValidator.validateOriginalUrl(longUrl))
                    .isInstanceOf(InvalidUrlException.class);
        }

        @Test
        @DisplayName("malformed syntax is rejected")
        void rejectsMalformed() {
            assertThatThrownBy(() -> ShortUrlValidator.validateOriginalUrl("https://exa mple.com"))
                    .isInstanceOf(InvalidUrlException.class);
        }
    }

    @Nested
    @DisplayName("custom alias")
    class Alias {

        @ParameterizedTest
        @ValueSource(strings = {"my-custom-link", "abc", "Spring2025", "a-b-c"})
        @DisplayName("letters, digits and single inner hyphens are accepted")
        void accepts(String alias) {
            assertThat(ShortUrlValidator.isValidAlias(alias)).isTrue();
            assertThatCode(() -> ShortUrlValidator.validateAlias(alias)).doesNotThrowAnyException();
        }

        @ParameterizedTest
        @ValueSource(strings = {"-bad", "bad-", "ba--d", "ab", "has space", "under_score", "ümlaut"})
        @DisplayName("edge hyphens, double hyphens, short and foreign characters are rejected")
        void rejects(String alias) {
            assertThat(ShortUrlValidator.isValidAlias(alias)).isFalse();
            assertThatThrownBy(() -> ShortUrlValidator.validateAlias(alias))
                    .isInstanceOf(InvalidAliasException.class);
        }

        @Test
        @DisplayName("length is bounded at 50")
        void maxLength() {
            assertThat(ShortUrlValidator.isValidAlias("a".repeat(50))).isTrue();
            assertThat(ShortUrlValidator.isValidAlias("a".repeat(51))).isFalse();
            assertThat(ShortUrlValidator.isValidAlias(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("expiry and metadata")
    class ExpiryAndMetadata {

        private final Instant now = Instant.parse("2025-06-01T12:00:00Z");

        @Test
        @DisplayName("expiry must lie strictly in the future")
        void expiry() {
            assertThatCode(() -> ShortUrlValidator.validateExpiry(null, now)).doesNotThrowAnyException();
            assertThatCode(() -> ShortUrlValidator.validateExpiry(now.plusSeconds(1), now)).doesNotThrowAnyException();
            assertThatThrownBy(() -> ShortUrlValidator.validateExpiry(now, now))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("at most ten metadata entries")
        void entryCount() {
            Map<String, String> metadata = new HashMap<>();
            for (int i = 0; i < 11; i++) {
                metadata.put("k" + i, "v");
            }
            assertThatThrownBy(() -> ShortUrlValidator.validateMetadata(metadata))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("metadata text is bounded at 100 characters")
        void textLength() {
            assertThatCode(() -> ShortUrlValidator.validateMetadata(Map.of("campaign", "a".repeat(100))))
                    .doesNotThrowAnyException();
            assertThatThrownBy(() -> ShortUrlValidator.validateMetadata(Map.of("campaign", "a".repeat(101))))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Test
    @DisplayName("owner ids are bounded at 64 characters and may be absent")
    void ownerIdLength() {
        assertThatCode(() -> ShortUrlValidator.validateOwnerId(null)).doesNotThrowAnyException();
        assertThatCode(() -> ShortUrlValidator.validateOwnerId("u".repeat(64))).doesNotThrowAnyException();
        assertThatThrownBy(() -> ShortUrlValidator.validateOwnerId("u".repeat(100)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Owner id must not exceed 64 characters");
    }
}
