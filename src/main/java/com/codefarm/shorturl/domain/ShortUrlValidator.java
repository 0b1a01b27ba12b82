package com.codefarm.shorturl.domain;

import com.codefarm.shorturl.exception.InvalidAliasException;
import com.codefarm.shorturl.exception.InvalidUrlException;
import com.codefarm.shorturl.exception.ValidationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Input rules shared by creation and alias availability checks.
 */
public final class ShortUrlValidator {

    public static final int MAX_URL_LENGTH = 2048;
    public static final int MIN_ALIAS_LENGTH = 3;
    public static final int MAX_ALIAS_LENGTH = 50;
    public static final int MAX_METADATA_ENTRIES = 10;
    public static final int MAX_METADATA_TEXT_LENGTH = 100;
    public static final int MAX_OWNER_ID_LENGTH = 64;

    private static final Pattern ALIAS_CHARACTERS = Pattern.compile("^[a-zA-Z0-9-]+$");

    private ShortUrlValidator() {
    }

    /**
     * @return the trimmed URL
     * @throws InvalidUrlException unless the value is an absolute http/https URL with a host
     */
    public static String validateOriginalUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidUrlException("URL cannot be empty");
        }
        String trimmed = url.trim();
        if (trimmed.length() > MAX_URL_LENGTH) {
            throw new InvalidUrlException("URL must not exceed " + MAX_URL_LENGTH + " characters");
        }
        try {
            URI uri = new URI(trimmed);
            if (!uri.isAbsolute() || uri.getHost() == null) {
                throw new InvalidUrlException("URL must be absolute: " + trimmed);
            }
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new InvalidUrlException("Only HTTP/HTTPS URLs are allowed");
            }
            return trimmed;
        } catch (URISyntaxException e) {
            throw new InvalidUrlException("Invalid URL format: " + e.getReason());
        }
    }

    public static boolean isValidAlias(String alias) {
        return alias != null
                && alias.length() >= MIN_ALIAS_LENGTH
                && alias.length() <= MAX_ALIAS_LENGTH
                && ALIAS_CHARACTERS.matcher(alias).matches()
                && !alias.startsWith("-")
                && !alias.endsWith("-")
                && !alias.contains("--");
    }

    public static void validateAlias(String alias) {
        if (!isValidAlias(alias)) {
            throw new InvalidAliasException("Custom alias must be " + MIN_ALIAS_LENGTH + "-" + MAX_ALIAS_LENGTH
                    + " characters of letters, digits and single inner hyphens");
        }
    }

    public static void validateExpiry(Instant expiresAt, Instant now) {
        if (expiresAt != null && !expiresAt.isAfter(now)) {
            throw new ValidationException("Expiration date must be in the future");
        }
    }

    public static void validateOwnerId(String ownerId) {
        if (ownerId != null && ownerId.length() > MAX_OWNER_ID_LENGTH) {
            throw new ValidationException("Owner id must not exceed " + MAX_OWNER_ID_LENGTH + " characters");
        }
    }

    public static void validateMetadata(Map<String, String> metadata) {
        if (metadata == null) {
            return;
        }
        if (metadata.size() > MAX_METADATA_ENTRIES) {
            throw new ValidationException("Metadata cannot exceed " + MAX_METADATA_ENTRIES + " entries");
        }
        metadata.forEach((key, value) -> {
            if (key == null || key.isBlank() || key.length() > MAX_METADATA_TEXT_LENGTH
                    || value == null || value.length() > MAX_METADATA_TEXT_LENGTH) {
                throw new ValidationException("Metadata keys and values must be 1-" + MAX_METADATA_TEXT_LENGTH
                        + " characters");
            }
        });
    }
}
