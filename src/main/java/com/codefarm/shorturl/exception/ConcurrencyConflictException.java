package com.codefarm.shorturl.exception;

import java.util.UUID;

public class ConcurrencyConflictException extends ConflictException {

    public ConcurrencyConflictException(UUID aggregateId, long expectedVersion, long currentVersion) {
        super("Concurrency conflict for short URL " + aggregateId
                + ": expected version " + expectedVersion + " but found " + currentVersion);
    }

    public ConcurrencyConflictException(String message) {
        super(message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
