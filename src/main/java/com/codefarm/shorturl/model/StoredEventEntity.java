package com.codefarm.shorturl.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "short_url_events",
        uniqueConstraints = {
                // two writers that both read version N cannot both append N + 1
                @UniqueConstraint(name = StoredEventEntity.VERSION_CONSTRAINT, columnNames = {"aggregate_id", "version"})
        },
        indexes = {
                @Index(name = "idx_short_url_events_type_time", columnList = "event_type, occurred_at")
        }
)
public class StoredEventEntity {

    public static final String VERSION_CONSTRAINT = "ux_short_url_events_version";

    @Id
    @Column(name = "event_id", nullable = false)
    private UUID eventId;

    @Column(name = "aggregate_id", nullable = false, updatable = false)
    private UUID aggregateId;

    @Column(name = "version", nullable = false, updatable = false)
    private long version;

    @Column(name = "event_type", nullable = false, length = 50, updatable = false)
    private String eventType;

    @Lob
    @Column(name = "payload", nullable = false, updatable = false)
    private String payload;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    protected StoredEventEntity() {
        // JPA only
    }

    public StoredEventEntity(UUID eventId, UUID aggregateId, long version, String eventType,
                             String payload, Instant occurredAt) {
        this.eventId = eventId;
        this.aggregateId = aggregateId;
        this.version = version;
        this.eventType = eventType;
        this.payload = payload;
        this.occurredAt = occurredAt;
    }

    public UUID getEventId() {
        return eventId;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }

    public long getVersion() {
        return version;
    }

    public String getEventType() {
        return eventType;
    }

    public String getPayload() {
        return payload;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
