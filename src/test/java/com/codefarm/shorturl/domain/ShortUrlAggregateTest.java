package com.codefarm.shorturl.domain;

import com.codefarm.shorturl.exception.InvalidAliasException;
import com.codefarm.shorturl.exception.UrlNotAccessibleException;
import com.codefarm.shorturl.exception.ValidationException;
import com.codefarm.shorturl.support.MutableClock;
import com.codefarm.shorturl.support.fixture.ShortUrlFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ShortUrlAggregate unit test")
class ShortUrlAggregateTest {

    private final MutableClock clock = MutableClock.at("2025-06-01T12:00:00Z");

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("raises a single version 1 creation event")
        void createdEvent() {
            ShortUrlAggregate aggregate = ShortUrlAggregate.create("my-custom-link", true,
                    "https://example.com", "owner-1", null, Map.of("campaign", "spring"), clock);

            assertThat(aggregate.uncommittedEvents()).singleElement()
                    .satisfies(event -> {
                        assertThat(event.version()).isEqualTo(1);
                        assertThat(event.type()).isEqualTo(EventType.CREATED);
                        assertThat(event.occurredAt()).isEqualTo(clock.instant());
                    });
            ShortUrlRecord state = aggregate.state();
            assertThat(state.status()).isEqualTo(UrlStatus.ACTIVE);
            assertThat(state.accessCount()).isZero();
            assertThat(state.customAlias()).isTrue();
            assertThat(state.metadata()).containsEntry("campaign", "spring");
            assertThat(aggregate.committedVersion()).isZero();
        }

        @Test
        @DisplayName("an expiry in the past is rejected")
        void pastExpiry() {
            assertThatThrownBy(() -> ShortUrlAggregate.create("abc123", false, "https://example.com",
                    "owner-1", clock.instant().minusSeconds(1), null, clock))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("an owner id longer than its column is rejected before any event is raised")
        void ownerTooLong() {
            assertThatThrownBy(() -> ShortUrlAggregate.create("abc123", false, "https://example.com",
                    "u".repeat(100), null, null, clock))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("custom aliases go through alias rules")
        void invalidAlias() {
            assertThatThrownBy(() -> ShortUrlAggregate.create("-bad", true, "https://example.com",
                    "owner-1", null, null, clock))
                    .isInstanceOf(InvalidAliasException.class);
        }

        @Test
        @DisplayName("markCommitted clears pending events and moves the committed version")
        void markCommitted() {
            ShortUrlAggregate aggregate = ShortUrlFixture.committed("abc123", clock);

            assertThat(aggregate.uncommittedEvents()).isEmpty();
            assertThat(aggregate.committedVersion()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("recordAccess")
    class RecordAccess {

        @Test
        @DisplayName("five accesses count five and keep the last timestamp")
        void countsAccesses() {
            ShortUrlAggregate aggregate = ShortUrlFixture.committed("abc123", clock);
            Instant last = null;
            for (int i = 0; i < 5; i++) {
                clock.advance(Duration.ofSeconds(1));
                last = clock.instant();
                assertThat(aggregate.recordAccess(ShortUrlFixture.desktopAccess())).isEqualTo(AccessOutcome.ACCESSED);
            }

            assertThat(aggregate.state().accessCount()).isEqualTo(5);
            assertThat(aggregate.state().lastAccessedAt()).isEqualTo(last);
            assertThat(aggregate.version()).isEqualTo(6);
            assertThat(aggregate.uncommittedEvents())
                    .extracting(ShortUrlEvent::version)
                    .containsExactly(2L, 3L, 4L, 5L, 6L);
        }

        @Test
        @DisplayName("an access after expiry expires the URL instead of counting")
        void expiresLazily() {
            ShortUrlAggregate aggregate = ShortUrlFixture.committed("abc123",
                    clock.instant().plusMillis(100), clock);
            clock.advance(Duration.ofMillis(200));

            AccessOutcome outcome = aggregate.recordAccess(ShortUrlFixture.desktopAccess());

            assertThat(outcome).isEqualTo(AccessOutcome.EXPIRED);
            assertThat(aggregate.state().status()).isEqualTo(UrlStatus.EXPIRED);
            assertThat(aggregate.state().accessCount()).isZero();
            assertThat(aggregate.uncommittedEvents()).singleElement()
                    .extracting(ShortUrlEvent::type).isEqualTo(EventType.EXPIRED);
        }

        @Test
        @DisplayName("an access exactly at expiry still counts")
        void boundaryIsInclusive() {
            Instant expiresAt = clock.instant().plusSeconds(10);
            ShortUrlAggregate aggregate = ShortUrlFixture.committed("abc123", expiresAt, clock);
            clock.set(expiresAt);

            assertThat(aggregate.recordAccess(null)).isEqualTo(AccessOutcome.ACCESSED);
        }

        @Test
        @DisplayName("a disabled URL refuses access")
        void disabledRefuses() {
            ShortUrlAggregate aggregate = ShortUrlFixture.committed("abc123", clock);
            aggregate.disable(DisableReason.SPAM, null);

            assertThatThrownBy(() -> aggregate.recordAccess(ShortUrlFixture.desktopAccess()))
                    .isInstanceOf(UrlNotAccessibleException.class)
                    .extracting("status").isEqualTo(UrlStatus.DISABLED);
        }
    }

    @Nested
    @DisplayName("disable")
    class Disable {

        @Test
        @DisplayName("disabling twice raises one event")
        void idempotent() {
            ShortUrlAggregate aggregate = ShortUrlFixture.committed("abc123", clock);

            assertThat(aggregate.disable(DisableReason.POLICY_VIOLATION, "reported")).isTrue();
            assertThat(aggregate.disable(DisableReason.POLICY_VIOLATION, "reported again")).isFalse();

            assertThat(aggregate.uncommittedEvents()).singleElement()
                    .extracting(ShortUrlEvent::payload)
                    .isEqualTo(new EventPayload.Disabled("abc123", DisableReason.POLICY_VIOLATION, "reported"));
            assertThat(aggregate.state().status()).isEqualTo(UrlStatus.DISABLED);
        }

        @Test
        @DisplayName("an expired URL stays expired")
        void expiredStays() {
            ShortUrlAggregate aggregate = ShortUrlFixture.committed("abc123",
                    clock.instant().plusSeconds(1), clock);
            clock.advance(Duration.ofSeconds(2));
            aggregate.recordAccess(null);

            assertThat(aggregate.disable(DisableReason.ADMIN_ACTION, null)).isFalse();
            assertThat(aggregate.state().status()).isEqualTo(UrlStatus.EXPIRED);
        }
    }

    @Nested
    @DisplayName("replay")
    class Replay {

        @Test
        @DisplayName("folding the log reproduces the live state")
        void reproducesState() {
            ShortUrlAggregate live = ShortUrlAggregate.create("abc123", false, "https://example.com",
                    "owner-1", null, Map.of(), clock);
            List<ShortUrlEvent> log = new ArrayList<>(live.uncommittedEvents());
            live.markCommitted();
            clock.advance(Duration.ofMinutes(1));
            live.recordAccess(ShortUrlFixture.desktopAccess());
            clock.advance(Duration.ofMinutes(1));
            live.disable(DisableReason.COPYRIGHT, "takedown");
            log.addAll(live.uncommittedEvents());

            ShortUrlAggregate replayed = ShortUrlAggregate.replay(log, clock);

            assertThat(replayed.state()).isEqualTo(live.state());
            assertThat(replayed.committedVersion()).isEqualTo(3);
            assertThat(replayed.uncommittedEvents()).isEmpty();
        }

        @Test
        @DisplayName("out of order input is sorted by version")
        void sortsByVersion() {
            ShortUrlAggregate source = ShortUrlAggregate.create("abc123", false, "https://example.com",
                    "owner-1", null, null, clock);
            source.recordAccess(null);
            List<ShortUrlEvent> log = source.uncommittedEvents();

            ShortUrlAggregate replayed = ShortUrlAggregate.replay(List.of(log.get(1), log.get(0)), clock);

            assertThat(replayed.version()).isEqualTo(2);
            assertThat(replayed.state().accessCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("gaps, empty streams and foreign events are rejected")
        void rejectsBrokenStreams() {
            ShortUrlAggregate source = ShortUrlAggregate.create("abc123", false, "https://example.com",
                    "owner-1", null, null, clock);
            ShortUrlEvent created = source.uncommittedEvents().get(0);
            ShortUrlEvent gap = new ShortUrlEvent(UUID.randomUUID(), created.aggregateId(), 3, clock.instant(),
                    new EventPayload.Accessed("abc123", AccessContext.ANONYMOUS));
            ShortUrlEvent foreign = new ShortUrlEvent(UUID.randomUUID(), UUID.randomUUID(), 2, clock.instant(),
                    new EventPayload.Accessed("abc123", AccessContext.ANONYMOUS));

            assertThatThrownBy(() -> ShortUrlAggregate.replay(List.of(), clock))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> ShortUrlAggregate.replay(List.of(created, gap), clock))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> ShortUrlAggregate.replay(List.of(created, foreign), clock))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("a stream that does not open with creation is rejected")
        void requiresCreationFirst() {
            ShortUrlEvent accessed = new ShortUrlEvent(UUID.randomUUID(), UUID.randomUUID(), 1, clock.instant(),
                    new EventPayload.Accessed("abc123", AccessContext.ANONYMOUS));

            assertThatThrownBy(() -> ShortUrlAggregate.replay(List.of(accessed), clock))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("before UrlCreated");
        }
    }
}
