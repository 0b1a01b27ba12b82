package com.codefarm.shorturl.domain;

import com.codefarm.shorturl.exception.UrlNotAccessibleException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Lifecycle of one short URL, kept as an append-only list of events.
 * <p>
 * Commands validate against the current state and raise events; the state itself only
 * ever changes by applying an event, whether freshly raised or replayed from the store.
 * Not thread-safe: concurrent writers are separated by the store's version check.
 */
public class ShortUrlAggregate {

    private final Clock clock;
    private final List<ShortUrlEvent> uncommittedEvents = new ArrayList<>();

    private ShortUrlRecord state;
    private long committedVersion;

    private ShortUrlAggregate(Clock clock) {
        this.clock = clock;
    }

    public static ShortUrlAggregate create(
            String shortCode,
            boolean customAlias,
            String originalUrl,
            String ownerId,
            Instant expiresAt,
            Map<String, String> metadata,
            Clock clock) {
        Instant now = clock.instant();
        String url = ShortUrlValidator.validateOriginalUrl(originalUrl);
        if (customAlias) {
            ShortUrlValidator.validateAlias(shortCode);
        } else if (shortCode == null || shortCode.isBlank()) {
            throw new IllegalArgumentException("Generated short code cannot be empty");
        }
        ShortUrlValidator.validateOwnerId(ownerId);
        ShortUrlValidator.validateExpiry(expiresAt, now);
        ShortUrlValidator.validateMetadata(metadata);

        ShortUrlAggregate aggregate = new ShortUrlAggregate(clock);
        aggregate.raise(UUID.randomUUID(),
                new EventPayload.Created(shortCode, url, customAlias, ownerId, expiresAt, metadata), now);
        return aggregate;
    }

    /**
     * Rebuilds an aggregate by folding its stored events in version order.
     *
     * @throws IllegalStateException if the stream is empty, does not start with a creation,
     *                               has gaps or mixes aggregates
     */
    public static ShortUrlAggregate replay(List<ShortUrlEvent> events, Clock clock) {
        if (events == null || events.isEmpty()) {
            throw new IllegalStateException("Cannot replay an empty event stream");
        }
        List<ShortUrlEvent> ordered = events.stream()
                .sorted(Comparator.comparingLong(ShortUrlEvent::version))
                .toList();
        UUID aggregateId = ordered.get(0).aggregateId();

        ShortUrlAggregate aggregate = new ShortUrlAggregate(clock);
        long expectedVersion = 1;
        for (ShortUrlEvent event : ordered) {
            if (!event.aggregateId().equals(aggregateId)) {
                throw new IllegalStateException("Event " + event.eventId() + " belongs to " + event.aggregateId()
                        + ", not " + aggregateId);
            }
            if (event.version() != expectedVersion) {
                throw new IllegalStateException("Expected version " + expectedVersion + " for " + aggregateId
                        + " but found " + event.version());
            }
            aggregate.state = event.payload().applyTo(aggregate.state, event);
            expectedVersion++;
        }
        aggregate.committedVersion = aggregate.state.version();
        return aggregate;
    }

    /**
     * Counts an access, or marks the URL expired if the access came after {@code expiresAt}.
     *
     * @throws UrlNotAccessibleException if the URL is not active
     */
    public AccessOutcome recordAccess(AccessContext access) {
        if (!state.isActive()) {
            throw new UrlNotAccessibleException(state.shortCode(), state.status());
        }
        Instant now = clock.instant();
        if (state.isExpiredAt(now)) {
            raise(state.id(), new EventPayload.Expired(state.shortCode(), state.expiresAt()), now);
            return AccessOutcome.EXPIRED;
        }
        raise(state.id(), new EventPayload.Accessed(state.shortCode(), access == null ? AccessContext.ANONYMOUS : access), now);
        return AccessOutcome.ACCESSED;
    }

    /**
     * Disables an active URL. Already disabled or expired URLs are left untouched.
     *
     * @return whether an event was raised
     */
    public boolean disable(DisableReason reason, String adminNotes) {
        if (state.status() != UrlStatus.ACTIVE) {
            return false;
        }
        raise(state.id(), new EventPayload.Disabled(state.shortCode(), reason, adminNotes), clock.instant());
        return true;
    }

    public UUID id() {
        return state.id();
    }

    public String shortCode() {
        return state.shortCode();
    }

    public ShortUrlRecord state() {
        return state;
    }

    public long version() {
        return state.version();
    }

    /**
     * Version already in the store, the {@code expectedVersion} for the next save.
     */
    public long committedVersion() {
        return committedVersion;
    }

    public List<ShortUrlEvent> uncommittedEvents() {
        return List.copyOf(uncommittedEvents);
    }

    public void markCommitted() {
        uncommittedEvents.clear();
        committedVersion = state.version();
    }

    private void raise(UUID aggregateId, EventPayload payload, Instant occurredAt) {
        long nextVersion = state == null ? 1 : state.version() + 1;
        ShortUrlEvent event = new ShortUrlEvent(UUID.randomUUID(), aggregateId, nextVersion, occurredAt, payload);
        state = payload.applyTo(state, event);
        uncommittedEvents.add(event);
    }
}
