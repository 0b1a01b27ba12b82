package com.codefarm.shorturl.core;

import com.codefarm.shorturl.cache.CacheInvalidationReason;
import com.codefarm.shorturl.cache.UrlCache;
import com.codefarm.shorturl.config.ShortUrlProperties;
import com.codefarm.shorturl.domain.AccessContext;
import com.codefarm.shorturl.domain.AccessOutcome;
import com.codefarm.shorturl.domain.DisableReason;
import com.codefarm.shorturl.domain.ShortUrlAggregate;
import com.codefarm.shorturl.domain.ShortUrlEvent;
import com.codefarm.shorturl.domain.ShortUrlRecord;
import com.codefarm.shorturl.domain.ShortUrlValidator;
import com.codefarm.shorturl.exception.ConcurrencyConflictException;
import com.codefarm.shorturl.exception.ConflictException;
import com.codefarm.shorturl.exception.CustomAliasAlreadyExistsException;
import com.codefarm.shorturl.exception.ShortCodeConflictException;
import com.codefarm.shorturl.exception.UrlNotFoundException;
import com.codefarm.shorturl.exception.ValidationException;
import com.codefarm.shorturl.store.ShortUrlStore;
import com.codefarm.shorturl.util.ShortCodeGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class ShortUrlServiceImpl implements ShortUrlService {

    private static final Logger log = LoggerFactory.getLogger(ShortUrlServiceImpl.class);

    private static final String ANONYMOUS_OWNER = "anonymous";

    static final int MAX_BULK_SIZE = 100;
    static final int MAX_PAGE_SIZE = 100;

    private final ShortUrlStore store;
    private final UrlCache cache;
    private final ShortCodeGenerator generator;
    private final AccessRecorder accessRecorder;
    private final ShortUrlProperties properties;
    private final Clock clock;

    public ShortUrlServiceImpl(
            ShortUrlStore store,
            UrlCache cache,
            ShortCodeGenerator generator,
            AccessRecorder accessRecorder,
            ShortUrlProperties properties,
            Clock clock) {
        this.store = store;
        this.cache = cache;
        this.generator = generator;
        this.accessRecorder = accessRecorder;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public CreatedShortUrl createShortUrl(CreateShortUrlCommand command) {
        String ownerId = (command.ownerId() == null || command.ownerId().isBlank())
                ? ANONYMOUS_OWNER
                : command.ownerId().trim();

        ShortUrlAggregate aggregate = command.hasCustomAlias()
                ? createWithAlias(command, ownerId)
                : createWithGeneratedCode(command, ownerId);

        ShortUrlRecord state = aggregate.state();
        cacheQuietly(state);
        log.info("Created short URL {} for owner {}", state.shortCode(), ownerId);
        return CreatedShortUrl.from(state);
    }

    @Override
    public List<BulkCreateResult> createShortUrls(List<CreateShortUrlCommand> commands) {
        if (commands == null || commands.isEmpty()) {
            throw new ValidationException("At least one URL is required");
        }
        if (commands.size() > MAX_BULK_SIZE) {
            throw new ValidationException("Cannot create more than " + MAX_BULK_SIZE + " URLs at once");
        }

        List<BulkCreateResult> results = new ArrayList<>(commands.size());
        for (int i = 0; i < commands.size(); i++) {
            try {
                results.add(BulkCreateResult.success(i, createShortUrl(commands.get(i))));
            } catch (ValidationException | ConflictException e) {
                log.debug("Bulk item {} rejected: {}", i, e.getMessage());
                results.add(BulkCreateResult.failure(i, e.getMessage()));
            }
        }
        long failed = results.stream().filter(result -> !result.succeeded()).count();
        log.info("Bulk create finished: {} created, {} failed", results.size() - failed, failed);
        return results;
    }

    @Override
    public Optional<String> resolve(String shortCode, AccessContext access) {
        Optional<String> originalUrl = lookup(shortCode);
        originalUrl.ifPresent(url -> accessRecorder.dispatch(shortCode, access));
        return originalUrl;
    }

    @Override
    public Optional<String> lookup(String shortCode) {
        Optional<String> cached = cachedUrl(shortCode);
        if (cached.isPresent()) {
            return cached;
        }

        Optional<ShortUrlRecord> active = store.findActive(shortCode, clock.instant());
        if (active.isEmpty()) {
            log.debug("No active short URL for {}", shortCode);
            return Optional.empty();
        }
        ShortUrlRecord state = active.get();
        cacheQuietly(state);
        return Optional.of(state.originalUrl());
    }

    @Override
    public AccessOutcome recordAccess(String shortCode, AccessContext access) {
        return accessRecorder.record(shortCode, access);
    }

    @Override
    public void disable(String shortCode, DisableReason reason, String adminNotes) {
        disableAndInvalidate(shortCode, reason, adminNotes);
        log.info("Disabled short URL {} for reason: {}", shortCode, reason);
    }

    /**
     * Soft delete: the URL stops resolving but its code is never handed out again.
     */
    @Override
    public void delete(String shortCode) {
        disableAndInvalidate(shortCode, DisableReason.OWNER_DELETED, null);
        log.info("Deleted short URL {}", shortCode);
    }

    @Override
    public UrlStatistics getStatistics(String shortCode) {
        return store.getByShortCode(shortCode)
                .map(aggregate -> UrlStatistics.from(aggregate.state()))
                .orElseThrow(() -> notFound(shortCode));
    }

    @Override
    public boolean isAvailable(String alias) {
        if (!ShortUrlValidator.isValidAlias(alias)) {
            return false;
        }
        return cachedUrl(alias).isEmpty() && !store.existsByShortCode(alias);
    }

    @Override
    public Page<UrlStatistics> listByOwner(String ownerId, int page, int size) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("Owner id is required");
        }
        if (page < 0) {
            throw new ValidationException("Page must not be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new ValidationException("Page size must be between 1 and " + MAX_PAGE_SIZE);
        }
        PageRequest request = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
        return store.findByOwner(ownerId.trim(), request).map(UrlStatistics::from);
    }

    @Override
    public List<ShortUrlEvent> history(String shortCode) {
        List<ShortUrlEvent> events = store.eventsFor(shortCode);
        if (events.isEmpty()) {
            throw notFound(shortCode);
        }
        return events;
    }

    private ShortUrlAggregate createWithAlias(CreateShortUrlCommand command, String ownerId) {
        String alias = command.customAlias().trim();
        ShortUrlAggregate aggregate = ShortUrlAggregate.create(alias, true, command.originalUrl(), ownerId,
                command.expiresAt(), command.metadata(), clock);
        if (store.existsByShortCode(alias)) {
            throw new CustomAliasAlreadyExistsException(alias);
        }
        try {
            store.save(aggregate, 0);
        } catch (ShortCodeConflictException e) {
            throw new CustomAliasAlreadyExistsException(alias, e);
        }
        aggregate.markCommitted();
        generator.markIssued(alias);
        return aggregate;
    }

    private ShortUrlAggregate createWithGeneratedCode(CreateShortUrlCommand command, String ownerId) {
        int attempts = properties.generator().insertAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            String shortCode = generateUniqueShortCode();
            ShortUrlAggregate aggregate = ShortUrlAggregate.create(shortCode, false, command.originalUrl(), ownerId,
                    command.expiresAt(), command.metadata(), clock);
            try {
                store.save(aggregate, 0);
                aggregate.markCommitted();
                return aggregate;
            } catch (ShortCodeConflictException e) {
                log.warn("Short code {} lost an insert race, regenerating (attempt {}/{})", shortCode, attempt, attempts);
            }
        }
        throw new ShortCodeConflictException("Failed to store a unique short code after " + attempts + " attempts");
    }

    private String generateUniqueShortCode() {
        int attempts = properties.generator().maxAttempts();
        for (int i = 0; i < attempts; i++) {
            String code = generator.nextCode();
            if (!store.existsByShortCode(code)) {
                return code;
            }
            log.debug("Generated short code {} already stored, retrying", code);
        }
        throw new ShortCodeConflictException("Failed to generate unique short code");
    }

    private void disableAndInvalidate(String shortCode, DisableReason reason, String adminNotes) {
        int attempts = properties.access().maxAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            ShortUrlAggregate aggregate = store.getByShortCode(shortCode).orElseThrow(() -> notFound(shortCode));
            if (!aggregate.disable(reason, adminNotes)) {
                cache.invalidate(shortCode, CacheInvalidationReason.forDisableReason(reason));
                return;
            }
            try {
                store.save(aggregate, aggregate.committedVersion());
            } catch (ConcurrencyConflictException e) {
                log.debug("Version conflict disabling {} (attempt {}/{})", shortCode, attempt, attempts);
                continue;
            }
            aggregate.markCommitted();
            cache.invalidate(shortCode, CacheInvalidationReason.forDisableReason(reason));
            return;
        }
        throw new ConcurrencyConflictException("Gave up disabling " + shortCode + " after " + attempts + " attempts");
    }

    private Optional<String> cachedUrl(String shortCode) {
        try {
            return cache.get(shortCode);
        } catch (RuntimeException e) {
            log.warn("Cache lookup failed for {}, falling back to store", shortCode, e);
            return Optional.empty();
        }
    }

    private void cacheQuietly(ShortUrlRecord state) {
        Duration ttl = cacheTtl(state);
        try {
            cache.set(state.shortCode(), state.originalUrl(), ttl);
        } catch (RuntimeException e) {
            log.warn("Failed to cache short URL {}", state.shortCode(), e);
        }
    }

    private Duration cacheTtl(ShortUrlRecord state) {
        Duration ttl = properties.cache().ttl();
        if (state.expiresAt() == null) {
            return ttl;
        }
        Duration remaining = Duration.between(clock.instant(), state.expiresAt());
        return remaining.compareTo(ttl) < 0 ? remaining : ttl;
    }

    private static UrlNotFoundException notFound(String shortCode) {
        return new UrlNotFoundException("Short code not found: " + shortCode);
    }
}
