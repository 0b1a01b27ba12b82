package com.codefarm.shorturl.domain;

import java.time.Instant;
import java.util.Map;

/**
 * The four things that can happen to a short URL.
 * <p>
 * Each variant knows how it changes the state. {@link #applyTo} is pure: the result
 * depends only on the current state and the event envelope, so any aggregate can be
 * rebuilt by folding its log.
 */
public sealed interface EventPayload
        permits EventPayload.Created, EventPayload.Accessed, EventPayload.Expired, EventPayload.Disabled {

    EventType type();

    /**
     * @param current state before the event, {@code null} only for {@link Created}
     * @param event   envelope carrying this payload
     * @return state after the event
     */
    ShortUrlRecord applyTo(ShortUrlRecord current, ShortUrlEvent event);

    record Created(
            String shortCode,
            String originalUrl,
            boolean customAlias,
            String createdBy,
            Instant expiresAt,
            Map<String, String> metadata
    ) implements EventPayload {

        public Created {
            metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        }

        @Override
        public EventType type() {
            return EventType.CREATED;
        }

        @Override
        public ShortUrlRecord applyTo(ShortUrlRecord current, ShortUrlEvent event) {
            if (current != null) {
                throw new IllegalStateException("Short URL " + current.shortCode() + " was already created");
            }
            return new ShortUrlRecord(event.aggregateId(), shortCode, originalUrl, UrlStatus.ACTIVE,
                    event.occurredAt(), expiresAt, null, 0L, createdBy, customAlias, metadata, event.version());
        }
    }

    record Accessed(String shortCode, AccessContext access) implements EventPayload {

        @Override
        public EventType type() {
            return EventType.ACCESSED;
        }

        @Override
        public ShortUrlRecord applyTo(ShortUrlRecord current, ShortUrlEvent event) {
            return requireCreated(current, this).withAccess(event.occurredAt(), event.version());
        }
    }

    record Expired(String shortCode, Instant expiredAt) implements EventPayload {

        @Override
        public EventType type() {
            return EventType.EXPIRED;
        }

        @Override
        public ShortUrlRecord applyTo(ShortUrlRecord current, ShortUrlEvent event) {
            return requireCreated(current, this).withStatus(UrlStatus.EXPIRED, event.version());
        }
    }

    record Disabled(String shortCode, DisableReason reason, String adminNotes) implements EventPayload {

        @Override
        public EventType type() {
            return EventType.DISABLED;
        }

        @Override
        public ShortUrlRecord applyTo(ShortUrlRecord current, ShortUrlEvent event) {
            return requireCreated(current, this).withStatus(UrlStatus.DISABLED, event.version());
        }
    }

    private static ShortUrlRecord requireCreated(ShortUrlRecord current, EventPayload payload) {
        if (current == null) {
            throw new IllegalStateException(payload.type().getTypeName() + " applied before UrlCreated");
        }
        return current;
    }
}
