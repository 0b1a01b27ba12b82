package com.codefarm.shorturl.store;

import com.codefarm.shorturl.domain.ShortUrlAggregate;
import com.codefarm.shorturl.domain.ShortUrlEvent;
import com.codefarm.shorturl.domain.ShortUrlRecord;
import com.codefarm.shorturl.exception.ConcurrencyConflictException;
import com.codefarm.shorturl.exception.ShortCodeConflictException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of short URLs: the event log per aggregate plus a queryable read model.
 */
public interface ShortUrlStore {

    /**
     * Loads the aggregate by replaying its full event log.
     */
    Optional<ShortUrlAggregate> getByShortCode(String shortCode);

    /**
     * Read model lookup for redirects: an active record not yet past its expiry.
     */
    Optional<ShortUrlRecord> findActive(String shortCode, Instant now);

    /**
     * Appends the aggregate's uncommitted events and refreshes the read model, all or nothing.
     * The caller marks the aggregate committed once this returns.
     *
     * @param expectedVersion version the caller loaded, {@code 0} for a new aggregate
     * @throws ShortCodeConflictException   if a new aggregate's short code is already taken
     * @throws ConcurrencyConflictException if another writer moved the aggregate past {@code expectedVersion}
     */
    void save(ShortUrlAggregate aggregate, long expectedVersion);

    boolean existsByShortCode(String shortCode);

    /**
     * @return the event log in version order, empty for an unknown short code
     */
    List<ShortUrlEvent> eventsFor(String shortCode);

    /**
     * Read model page of the short URLs one owner created, in every status.
     */
    Page<ShortUrlRecord> findByOwner(String ownerId, Pageable pageable);
}
