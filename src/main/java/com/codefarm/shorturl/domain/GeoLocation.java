package com.codefarm.shorturl.domain;

public record GeoLocation(
        String country,
        String region,
        String city,
        double latitude,
        double longitude
) {
    public static final GeoLocation UNKNOWN = new GeoLocation("Unknown", "Unknown", "Unknown", 0.0, 0.0);
}
