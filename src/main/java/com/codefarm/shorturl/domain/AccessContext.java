package com.codefarm.shorturl.domain;

/**
 * Who followed a short link. Every field is optional from the caller's side; missing
 * values are stored as empty strings or the {@code UNKNOWN} constants. Client supplied
 * text is cut to the {@code MAX_*} lengths.
 */
public record AccessContext(
        String ipAddress,
        String userAgent,
        String referrer,
        GeoLocation location,
        DeviceInfo device
) {
    public static final int MAX_IP_ADDRESS_LENGTH = 64;
    public static final int MAX_USER_AGENT_LENGTH = 512;
    public static final int MAX_REFERRER_LENGTH = 1024;

    public static final AccessContext ANONYMOUS = new AccessContext("", "", "", GeoLocation.UNKNOWN, DeviceInfo.UNKNOWN);

    public AccessContext {
        ipAddress = truncate(ipAddress, MAX_IP_ADDRESS_LENGTH);
        userAgent = truncate(userAgent, MAX_USER_AGENT_LENGTH);
        referrer = truncate(referrer, MAX_REFERRER_LENGTH);
        location = location == null ? GeoLocation.UNKNOWN : location;
        device = device == null ? DeviceInfo.UNKNOWN : device;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }
}
