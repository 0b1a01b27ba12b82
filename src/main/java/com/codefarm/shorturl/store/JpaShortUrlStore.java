package com.codefarm.shorturl.store;

import com.codefarm.shorturl.domain.ShortUrlAggregate;
import com.codefarm.shorturl.domain.ShortUrlEvent;
import com.codefarm.shorturl.domain.ShortUrlRecord;
import com.codefarm.shorturl.domain.UrlStatus;
import com.codefarm.shorturl.exception.ConcurrencyConflictException;
import com.codefarm.shorturl.exception.ShortCodeConflictException;
import com.codefarm.shorturl.model.ShortUrlEntity;
import com.codefarm.shorturl.model.StoredEventEntity;
import com.codefarm.shorturl.repository.ShortUrlRepository;
import com.codefarm.shorturl.repository.StoredEventRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JpaShortUrlStore implements ShortUrlStore {

    private static final Logger log = LoggerFactory.getLogger(JpaShortUrlStore.class);

    private final ShortUrlRepository shortUrlRepository;
    private final StoredEventRepository eventRepository;
    private final EventSerializer serializer;
    private final Clock clock;

    public JpaShortUrlStore(
            ShortUrlRepository shortUrlRepository,
            StoredEventRepository eventRepository,
            EventSerializer serializer,
            Clock clock) {
        this.shortUrlRepository = shortUrlRepository;
        this.eventRepository = eventRepository;
        this.serializer = serializer;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ShortUrlAggregate> getByShortCode(String shortCode) {
        return shortUrlRepository.findByShortCode(shortCode)
                .map(entity -> ShortUrlAggregate.replay(loadEvents(entity.getId()), clock));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ShortUrlRecord> findActive(String shortCode, Instant now) {
        return shortUrlRepository.findResolvable(shortCode, UrlStatus.ACTIVE, now)
                .map(ShortUrlEntity::toRecord);
    }

    @Override
    @Transactional
    public void save(ShortUrlAggregate aggregate, long expectedVersion) {
        List<ShortUrlEvent> pending = aggregate.uncommittedEvents();
        if (pending.isEmpty()) {
            return;
        }
        UUID aggregateId = aggregate.id();
        ShortUrlRecord state = aggregate.state();

        long currentVersion = eventRepository.findCurrentVersion(aggregateId);
        if (currentVersion != expectedVersion) {
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, currentVersion);
        }

        try {
            if (expectedVersion == 0) {
                if (shortUrlRepository.existsByShortCode(state.shortCode())) {
                    throw new ShortCodeConflictException("Short code already taken: " + state.shortCode());
                }
                shortUrlRepository.save(ShortUrlEntity.from(state));
            } else {
                ShortUrlEntity entity = shortUrlRepository.findById(aggregateId)
                        .orElseThrow(() -> new IllegalStateException("Read model missing for short URL " + aggregateId));
                entity.update(state);
            }
            eventRepository.saveAll(pending.stream().map(serializer::toEntity).toList());
            eventRepository.flush();
        } catch (DataIntegrityViolationException e) {
            throw translateIntegrityViolation(e, state.shortCode(), aggregateId, expectedVersion);
        } catch (ConcurrencyFailureException e) {
            if (expectedVersion == 0) {
                throw e;
            }
            throw new ConcurrencyConflictException("Concurrent append to short URL " + aggregateId
                    + " at version " + expectedVersion, e);
        }

        log.debug("Saved {} event(s) for short URL {} up to version {}",
                pending.size(), state.shortCode(), state.version());
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByShortCode(String shortCode) {
        return shortUrlRepository.existsByShortCode(shortCode);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ShortUrlEvent> eventsFor(String shortCode) {
        return shortUrlRepository.findByShortCode(shortCode)
                .map(entity -> loadEvents(entity.getId()))
                .orElse(List.of());
    }

    @Override
    @Transactional(readOnly = true)
    public Page<ShortUrlRecord> findByOwner(String ownerId, Pageable pageable) {
        return shortUrlRepository.findByCreatedBy(ownerId, pageable).map(ShortUrlEntity::toRecord);
    }

    /**
     * Only the two unique constraints mean another writer won; any other integrity error
     * (value too long, null column) is an infrastructure failure and propagates unchanged.
     */
    private static RuntimeException translateIntegrityViolation(
            DataIntegrityViolationException e, String shortCode, UUID aggregateId, long expectedVersion) {
        String constraint = violatedConstraint(e);
        if (constraint == null) {
            return e;
        }
        if (constraint.contains(ShortUrlEntity.SHORT_CODE_CONSTRAINT)) {
            return new ShortCodeConflictException("Short code already taken: " + shortCode, e);
        }
        if (constraint.contains(StoredEventEntity.VERSION_CONSTRAINT)) {
            return new ConcurrencyConflictException("Concurrent append to short URL " + aggregateId
                    + " at version " + expectedVersion, e);
        }
        return e;
    }

    static String violatedConstraint(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation && violation.getConstraintName() != null) {
                return violation.getConstraintName().toLowerCase(Locale.ROOT);
            }
        }
        return null;
    }

    private List<ShortUrlEvent> loadEvents(UUID aggregateId) {
        return eventRepository.findByAggregateIdOrderByVersionAsc(aggregateId).stream()
                .map(serializer::toEvent)
                .toList();
    }
}
