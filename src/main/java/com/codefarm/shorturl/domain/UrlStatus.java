package com.codefarm.shorturl.domain;

public enum UrlStatus {
    ACTIVE,
    EXPIRED,
    DISABLED,
    // reserved for policy enforcement, nothing transitions here yet
    SUSPENDED
}
