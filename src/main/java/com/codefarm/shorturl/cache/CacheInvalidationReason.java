package com.codefarm.shorturl.cache;

import com.codefarm.shorturl.domain.DisableReason;

public enum CacheInvalidationReason {
    MANUAL_INVALIDATION,
    URL_DELETED,
    URL_DISABLED,
    URL_EXPIRED,
    SUSPICIOUS_ACTIVITY,
    POLICY_VIOLATION;

    /**
     * Whether the URL can never resolve again after this invalidation.
     */
    public boolean isTerminal() {
        return this != MANUAL_INVALIDATION;
    }

    public static CacheInvalidationReason forDisableReason(DisableReason reason) {
        return switch (reason) {
            case OWNER_DELETED -> URL_DELETED;
            case SUSPICIOUS_ACTIVITY -> SUSPICIOUS_ACTIVITY;
            case POLICY_VIOLATION, COPYRIGHT, SPAM -> POLICY_VIOLATION;
            case ADMIN_ACTION -> URL_DISABLED;
        };
    }
}
