package com.codefarm.shorturl.core;

import java.time.Instant;
import java.util.Map;

/**
 * @param customAlias optional caller-chosen code; blank means generate one
 * @param expiresAt   optional, must lie in the future
 */
public record CreateShortUrlCommand(
        String originalUrl,
        String ownerId,
        String customAlias,
        Instant expiresAt,
        Map<String, String> metadata
) {
    public boolean hasCustomAlias() {
        return customAlias != null && !customAlias.isBlank();
    }
}
