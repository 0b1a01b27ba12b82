package com.codefarm.shorturl.core;

import com.codefarm.shorturl.domain.ShortUrlRecord;

import java.time.Instant;

public record CreatedShortUrl(
        String shortCode,
        String originalUrl,
        Instant createdAt,
        Instant expiresAt
) {
    static CreatedShortUrl from(ShortUrlRecord state) {
        return new CreatedShortUrl(state.shortCode(), state.originalUrl(), state.createdAt(), state.expiresAt());
    }
}
