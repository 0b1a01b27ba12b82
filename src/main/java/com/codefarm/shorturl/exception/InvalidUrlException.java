package com.codefarm.shorturl.exception;

public class InvalidUrlException extends ValidationException {

    public InvalidUrlException(String message) {
        super(message);
    }
}
