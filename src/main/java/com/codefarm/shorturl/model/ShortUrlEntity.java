package com.codefarm.shorturl.model;

import com.codefarm.shorturl.domain.ShortUrlRecord;
import com.codefarm.shorturl.domain.UrlStatus;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Read model of a short URL, rewritten from the aggregate state on every save.
 * The event log in {@link StoredEventEntity} is the system of record.
 */
@Entity
@Table(
        name = "short_urls",
        uniqueConstraints = {
                @UniqueConstraint(name = ShortUrlEntity.SHORT_CODE_CONSTRAINT, columnNames = "short_code")
        },
        indexes = {
                @Index(name = "idx_short_urls_created_by", columnList = "created_by")
        }
)
public class ShortUrlEntity {

    public static final String SHORT_CODE_CONSTRAINT = "ux_short_urls_short_code";

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "short_code", nullable = false, length = 50, updatable = false)
    private String shortCode;

    @Column(name = "original_url", nullable = false, length = 2048, updatable = false)
    private String originalUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private UrlStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "last_accessed_at")
    private Instant lastAccessedAt;

    @Column(name = "access_count", nullable = false)
    private long accessCount;

    @Column(name = "created_by", length = 64)
    private String createdBy;

    @Column(name = "is_custom", nullable = false)
    private boolean custom;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "short_url_metadata", joinColumns = @JoinColumn(name = "short_url_id"))
    @MapKeyColumn(name = "meta_key", length = 100)
    @Column(name = "meta_value", length = 100)
    private Map<String, String> metadata = new HashMap<>();

    @Column(name = "aggregate_version", nullable = false)
    private long version;

    protected ShortUrlEntity() {
        // JPA only
    }

    public static ShortUrlEntity from(ShortUrlRecord state) {
        ShortUrlEntity entity = new ShortUrlEntity();
        entity.id = state.id();
        entity.shortCode = state.shortCode();
        entity.originalUrl = state.originalUrl();
        entity.createdAt = state.createdAt();
        entity.expiresAt = state.expiresAt();
        entity.createdBy = state.createdBy();
        entity.custom = state.customAlias();
        entity.metadata = new HashMap<>(state.metadata());
        entity.update(state);
        return entity;
    }

    public void update(ShortUrlRecord state) {
        this.status = state.status();
        this.lastAccessedAt = state.lastAccessedAt();
        this.accessCount = state.accessCount();
        this.version = state.version();
    }

    public ShortUrlRecord toRecord() {
        return new ShortUrlRecord(id, shortCode, originalUrl, status, createdAt, expiresAt, lastAccessedAt,
                accessCount, createdBy, custom, metadata, version);
    }

    public UUID getId() {
        return id;
    }
}
