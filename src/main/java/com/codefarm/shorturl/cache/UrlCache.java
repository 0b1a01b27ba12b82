package com.codefarm.shorturl.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Fast lookup tier in front of the store, mapping short codes to original URLs.
 */
public interface UrlCache {

    Optional<String> get(String shortCode);

    /**
     * @param ttl how long the entry may be served; non-positive values skip caching
     */
    void set(String shortCode, String originalUrl, Duration ttl);

    /**
     * Removes the entry before returning, so the next lookup goes to the store.
     */
    void invalidate(String shortCode, CacheInvalidationReason reason);
}
