package com.codefarm.shorturl.domain;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * State of one short URL after folding its events up to {@code version}.
 */
public record ShortUrlRecord(
        UUID id,
        String shortCode,
        String originalUrl,
        UrlStatus status,
        Instant createdAt,
        Instant expiresAt,
        Instant lastAccessedAt,
        long accessCount,
        String createdBy,
        boolean customAlias,
        Map<String, String> metadata,
        long version
) {
    public ShortUrlRecord {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isActive() {
        return status == UrlStatus.ACTIVE;
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    ShortUrlRecord withAccess(Instant accessedAt, long newVersion) {
        return new ShortUrlRecord(id, shortCode, originalUrl, status, createdAt, expiresAt,
                accessedAt, accessCount + 1, createdBy, customAlias, metadata, newVersion);
    }

    ShortUrlRecord withStatus(UrlStatus newStatus, long newVersion) {
        return new ShortUrlRecord(id, shortCode, originalUrl, newStatus, createdAt, expiresAt,
                lastAccessedAt, accessCount, createdBy, customAlias, metadata, newVersion);
    }
}
