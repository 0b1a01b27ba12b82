package com.codefarm.shorturl.exception;

/**
 * The store already holds something that clashes with the write. The caller may retry
 * with a fresh code or a refreshed version.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
