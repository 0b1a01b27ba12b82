package com.codefarm.shorturl.cache;

import com.codefarm.shorturl.config.ShortUrlProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process cache with a per-entry time to live. Every entry is bounded by the TTL it
 * was written with, so disabled or expired URLs drop out even without an explicit
 * invalidation.
 * <p>
 * A code invalidated because its URL stopped resolving is remembered for one TTL. A
 * {@link #set} for it in that window is dropped, so a lookup that read the URL before
 * the disable committed cannot put it back.
 */
@Component
public class CaffeineUrlCache implements UrlCache {

    private static final Logger log = LoggerFactory.getLogger(CaffeineUrlCache.class);

    private final Cache<String, CachedUrl> cache;
    private final Cache<String, CacheInvalidationReason> invalidated;

    @Autowired
    public CaffeineUrlCache(ShortUrlProperties properties) {
        this(properties.cache().maximumSize(), properties.cache().ttl(), Ticker.systemTicker());
    }

    CaffeineUrlCache(long maximumSize, Duration invalidationWindow, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
        this.invalidated = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(invalidationWindow)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Optional<String> get(String shortCode) {
        CachedUrl cached = cache.getIfPresent(shortCode);
        if (cached == null) {
            log.debug("Cache miss for {}", shortCode);
            return Optional.empty();
        }
        log.debug("Cache hit for {}", shortCode);
        return Optional.of(cached.originalUrl());
    }

    @Override
    public void set(String shortCode, String originalUrl, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            log.debug("Not caching {} with non-positive ttl {}", shortCode, ttl);
            return;
        }
        cache.asMap().compute(shortCode, (code, current) -> {
            CacheInvalidationReason reason = invalidated.getIfPresent(code);
            if (reason != null) {
                log.debug("Not caching {}, invalidated for {}", code, reason);
                return null;
            }
            return new CachedUrl(originalUrl, ttl);
        });
    }

    @Override
    public void invalidate(String shortCode, CacheInvalidationReason reason) {
        if (reason.isTerminal()) {
            invalidated.put(shortCode, reason);
        }
        cache.asMap().remove(shortCode);
        log.info("Invalidated cache for {}, reason: {}", shortCode, reason);
    }

    long estimatedSize() {
        return cache.estimatedSize();
    }

    private record CachedUrl(String originalUrl, Duration ttl) {
    }

    private static final class PerEntryExpiry implements Expiry<String, CachedUrl> {

        @Override
        public long expireAfterCreate(String key, CachedUrl value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedUrl value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CachedUrl value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
