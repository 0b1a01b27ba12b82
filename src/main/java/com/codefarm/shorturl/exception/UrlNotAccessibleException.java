package com.codefarm.shorturl.exception;

import com.codefarm.shorturl.domain.UrlStatus;

/**
 * An access was attempted on a short URL that is no longer active.
 */
public class UrlNotAccessibleException extends RuntimeException {

    private final UrlStatus status;

    public UrlNotAccessibleException(String shortCode, UrlStatus status) {
        super("Cannot access short URL " + shortCode + " with status " + status);
        this.status = status;
    }

    public UrlStatus getStatus() {
        return status;
    }
}
