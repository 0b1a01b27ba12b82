package com.codefarm.shorturl.core;

import com.codefarm.shorturl.analytics.AccessAnalyticsSink;
import com.codefarm.shorturl.cache.CacheInvalidationReason;
import com.codefarm.shorturl.cache.UrlCache;
import com.codefarm.shorturl.config.AsyncConfig;
import com.codefarm.shorturl.config.ShortUrlProperties;
import com.codefarm.shorturl.domain.AccessContext;
import com.codefarm.shorturl.domain.AccessOutcome;
import com.codefarm.shorturl.domain.ShortUrlAggregate;
import com.codefarm.shorturl.domain.UrlStatus;
import com.codefarm.shorturl.exception.ConcurrencyConflictException;
import com.codefarm.shorturl.exception.UrlNotAccessibleException;
import com.codefarm.shorturl.store.ShortUrlStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns a redirect into an access event on the short URL's aggregate.
 * <p>
 * {@link #dispatch} is the redirect path's entry point: it hands the work to the access
 * executor and returns at once. Delivery is best effort. A full queue or a failure is
 * logged and the access is lost. A recording that outlives the timeout is no longer
 * awaited but keeps running. Nothing is retried synchronously and nothing reaches the
 * caller.
 */
@Component
public class AccessRecorder {

    private static final Logger log = LoggerFactory.getLogger(AccessRecorder.class);

    private final ShortUrlStore store;
    private final UrlCache cache;
    private final AccessAnalyticsSink analyticsSink;
    private final Executor executor;
    private final Duration timeout;
    private final int maxAttempts;

    @Autowired
    public AccessRecorder(
            ShortUrlStore store,
            UrlCache cache,
            AccessAnalyticsSink analyticsSink,
            @Qualifier(AsyncConfig.ACCESS_EXECUTOR_NAME) Executor executor,
            ShortUrlProperties properties) {
        this(store, cache, analyticsSink, executor, properties.access().timeout(), properties.access().maxAttempts());
    }

    AccessRecorder(ShortUrlStore store, UrlCache cache, AccessAnalyticsSink analyticsSink,
                   Executor executor, Duration timeout, int maxAttempts) {
        this.store = store;
        this.cache = cache;
        this.analyticsSink = analyticsSink;
        this.executor = executor;
        this.timeout = timeout;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Records the access in the background.
     *
     * @return completes when the recording finished, failed, was rejected or stopped being
     * awaited; never exceptionally
     */
    public CompletableFuture<Void> dispatch(String shortCode, AccessContext access) {
        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(() -> record(shortCode, access), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Access recording for {} rejected by executor", shortCode, e);
            return CompletableFuture.completedFuture(null);
        }
        return future
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    if (ex instanceof TimeoutException) {
                        log.warn("Access recording for {} not finished within {}ms, no longer awaited; it may still complete",
                                shortCode, timeout.toMillis());
                    } else {
                        log.warn("Access recording for {} failed", shortCode, ex);
                    }
                    return null;
                });
    }

    /**
     * Loads the aggregate, applies the access and saves it, reloading on a version conflict.
     *
     * @throws ConcurrencyConflictException if every attempt lost a race with another writer
     */
    public AccessOutcome record(String shortCode, AccessContext access) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<ShortUrlAggregate> loaded = store.getByShortCode(shortCode);
            if (loaded.isEmpty()) {
                log.debug("Access to unknown short code {} ignored", shortCode);
                return AccessOutcome.NOT_FOUND;
            }
            ShortUrlAggregate aggregate = loaded.get();

            AccessOutcome outcome;
            try {
                outcome = aggregate.recordAccess(access);
            } catch (UrlNotAccessibleException e) {
                log.debug("Access to {} rejected: {}", shortCode, e.getMessage());
                cache.invalidate(shortCode, e.getStatus() == UrlStatus.EXPIRED
                        ? CacheInvalidationReason.URL_EXPIRED
                        : CacheInvalidationReason.URL_DISABLED);
                return AccessOutcome.REJECTED;
            }

            try {
                store.save(aggregate, aggregate.committedVersion());
                aggregate.markCommitted();
            } catch (ConcurrencyConflictException e) {
                log.debug("Version conflict recording access to {} (attempt {}/{})", shortCode, attempt, maxAttempts);
                continue;
            }

            if (outcome == AccessOutcome.EXPIRED) {
                cache.invalidate(shortCode, CacheInvalidationReason.URL_EXPIRED);
                log.info("Short URL {} expired on access", shortCode);
            } else {
                analyticsSink.recordAccess(shortCode, access);
            }
            return outcome;
        }
        throw new ConcurrencyConflictException("Gave up recording access to " + shortCode
                + " after " + maxAttempts + " attempts");
    }
}
