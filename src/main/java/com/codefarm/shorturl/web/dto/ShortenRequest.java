package com.codefarm.shorturl.web.dto;

import java.time.Instant;
import java.util.Map;

public record ShortenRequest(
        String originalUrl,
        String customAlias,
        Instant expiresAt,
        Map<String, String> metadata
) {
}
