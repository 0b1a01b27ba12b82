package com.codefarm.shorturl.core;

import com.codefarm.shorturl.domain.AccessContext;
import com.codefarm.shorturl.domain.AccessOutcome;
import com.codefarm.shorturl.domain.DisableReason;
import com.codefarm.shorturl.domain.ShortUrlEvent;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.Optional;

public interface ShortUrlService {

    CreatedShortUrl createShortUrl(CreateShortUrlCommand command);

    /**
     * Creates each URL independently; one invalid or conflicting item does not stop the rest.
     *
     * @return one result per command, in input order
     */
    List<BulkCreateResult> createShortUrls(List<CreateShortUrlCommand> commands);

    /**
     * Resolves a short code for a redirect and records the access in the background.
     *
     * @return the original URL, empty when the code is unknown, disabled or expired
     */
    Optional<String> resolve(String shortCode, AccessContext access);

    /**
     * Same lookup as {@link #resolve} without counting an access.
     */
    Optional<String> lookup(String shortCode);

    AccessOutcome recordAccess(String shortCode, AccessContext access);

    void disable(String shortCode, DisableReason reason, String adminNotes);

    void delete(String shortCode);

    UrlStatistics getStatistics(String shortCode);

    boolean isAvailable(String alias);

    /**
     * Newest first.
     */
    Page<UrlStatistics> listByOwner(String ownerId, int page, int size);

    List<ShortUrlEvent> history(String shortCode);
}
