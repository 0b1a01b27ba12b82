package com.codefarm.shorturl.exception;

public class InvalidAliasException extends ValidationException {

    public InvalidAliasException(String message) {
        super(message);
    }
}
