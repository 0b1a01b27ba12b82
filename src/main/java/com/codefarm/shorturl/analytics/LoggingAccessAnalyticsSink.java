package com.codefarm.shorturl.analytics;

import com.codefarm.shorturl.domain.AccessContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingAccessAnalyticsSink implements AccessAnalyticsSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingAccessAnalyticsSink.class);

    @Override
    public void recordAccess(String shortCode, AccessContext access) {
        log.debug("Access to {} from {} ({} {} on {}), referrer '{}', country {}",
                shortCode,
                access.ipAddress(),
                access.device().deviceType(),
                access.device().browser(),
                access.device().operatingSystem(),
                access.referrer(),
                access.location().country());
    }
}
