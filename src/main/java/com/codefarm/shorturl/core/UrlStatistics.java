package com.codefarm.shorturl.core;

import com.codefarm.shorturl.domain.ShortUrlRecord;
import com.codefarm.shorturl.domain.UrlStatus;

import java.time.Instant;
import java.util.Map;

public record UrlStatistics(
        String shortCode,
        String originalUrl,
        UrlStatus status,
        long accessCount,
        Instant createdAt,
        Instant lastAccessedAt,
        Instant expiresAt,
        String createdBy,
        boolean customAlias,
        Map<String, String> metadata
) {
    static UrlStatistics from(ShortUrlRecord state) {
        return new UrlStatistics(state.shortCode(), state.originalUrl(), state.status(), state.accessCount(),
                state.createdAt(), state.lastAccessedAt(), state.expiresAt(), state.createdBy(),
                state.customAlias(), state.metadata());
    }
}
