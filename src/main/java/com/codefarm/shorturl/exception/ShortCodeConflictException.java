package com.codefarm.shorturl.exception;

public class ShortCodeConflictException extends ConflictException {

    public ShortCodeConflictException(String message) {
        super(message);
    }

    public ShortCodeConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
