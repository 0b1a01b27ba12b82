package com.codefarm.shorturl.domain;

public enum DisableReason {
    ADMIN_ACTION,
    POLICY_VIOLATION,
    SUSPICIOUS_ACTIVITY,
    COPYRIGHT,
    SPAM,
    OWNER_DELETED
}
