package com.codefarm.shorturl.exception;

/**
 * Rejected input: surfaced to the caller as is and never retried.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
