package com.codefarm.shorturl.support.fixture;

import com.codefarm.shorturl.domain.AccessContext;
import com.codefarm.shorturl.domain.DeviceInfo;
import com.codefarm.shorturl.domain.GeoLocation;
import com.codefarm.shorturl.domain.ShortUrlAggregate;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

public final class ShortUrlFixture {

    public static final String ORIGINAL_URL = "https://example.com/articles/42";
    public static final String OWNER = "owner-1";

    private ShortUrlFixture() {
    }

    public static ShortUrlAggregate committed(String shortCode, Clock clock) {
        return committed(shortCode, null, clock);
    }

    public static ShortUrlAggregate committed(String shortCode, Instant expiresAt, Clock clock) {
        ShortUrlAggregate aggregate = ShortUrlAggregate.create(shortCode, false, ORIGINAL_URL, OWNER,
                expiresAt, Map.of(), clock);
        aggregate.markCommitted();
        return aggregate;
    }

    public static AccessContext desktopAccess() {
        return new AccessContext("203.0.113.7", "Mozilla/5.0 (Windows NT 10.0) Chrome/120.0",
                "https://news.example.org", GeoLocation.UNKNOWN,
                new DeviceInfo("Desktop", "Chrome", "Windows", false));
    }
}
