package com.codefarm.shorturl.domain;

public enum AccessOutcome {
    /** Counted as an access. */
    ACCESSED,
    /** The access discovered the expiry; not counted. */
    EXPIRED,
    /** The record was no longer active. */
    REJECTED,
    /** No record for the short code. */
    NOT_FOUND
}
