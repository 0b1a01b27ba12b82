package com.codefarm.shorturl.exception;

public class CustomAliasAlreadyExistsException extends ConflictException {

    public CustomAliasAlreadyExistsException(String alias) {
        super("Alias already in use: " + alias);
    }

    public CustomAliasAlreadyExistsException(String alias, Throwable cause) {
        super("Alias already in use: " + alias, cause);
    }
}
