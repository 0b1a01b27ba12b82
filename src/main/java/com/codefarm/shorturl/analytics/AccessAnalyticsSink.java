package com.codefarm.shorturl.analytics;

import com.codefarm.shorturl.domain.AccessContext;

/**
 * Receives every counted access. Called off the request path; implementations may drop
 * data but should not block for long.
 */
public interface AccessAnalyticsSink {

    void recordAccess(String shortCode, AccessContext access);
}
