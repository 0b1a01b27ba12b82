package com.codefarm.shorturl.domain;

public record DeviceInfo(
        String deviceType,
        String browser,
        String operatingSystem,
        boolean mobile
) {
    public static final DeviceInfo UNKNOWN = new DeviceInfo("Unknown", "Unknown", "Unknown", false);
}
