package com.codefarm.shorturl.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One entry of a short URL's append-only log. {@code version} starts at 1 and grows by one
 * per event of the same aggregate.
 */
public record ShortUrlEvent(
        UUID eventId,
        UUID aggregateId,
        long version,
        Instant occurredAt,
        EventPayload payload
) {
    public ShortUrlEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(occurredAt, "occurredAt");
        Objects.requireNonNull(payload, "payload");
        if (version < 1) {
            throw new IllegalArgumentException("Event version must start at 1, got " + version);
        }
    }

    public EventType type() {
        return payload.type();
    }
}
