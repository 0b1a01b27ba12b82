package com.codefarm.shorturl.web;

import com.codefarm.shorturl.domain.AccessContext;
import com.codefarm.shorturl.domain.GeoLocation;
import com.codefarm.shorturl.util.DeviceInfoParser;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Builds the access context of a redirect from the request, honouring proxy headers.
 */
@Component
public class ClientInfoExtractor {

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String REAL_IP = "X-Real-IP";

    public AccessContext extract(HttpServletRequest request) {
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        return new AccessContext(
                clientIp(request),
                userAgent,
                request.getHeader(HttpHeaders.REFERER),
                GeoLocation.UNKNOWN,
                DeviceInfoParser.parse(userAgent)
        );
    }

    static String clientIp(HttpServletRequest request) {
        String forwardedFor = request.getHeader(FORWARDED_FOR);
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }
        String realIp = request.getHeader(REAL_IP);
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        String remote = request.getRemoteAddr();
        return remote == null ? "unknown" : remote;
    }
}
