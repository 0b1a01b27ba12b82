package com.codefarm.shorturl.util;

import com.codefarm.shorturl.domain.DeviceInfo;

/**
 * Coarse user agent sniffing. Order matters: Edge and Chrome both claim to be Safari,
 * and Android claims to be Linux.
 */
public final class DeviceInfoParser {

    private DeviceInfoParser() {
    }

    public static DeviceInfo parse(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return DeviceInfo.UNKNOWN;
        }
        boolean mobile = userAgent.contains("Mobile") || userAgent.contains("Android")
                || userAgent.contains("iPhone");
        String deviceType = userAgent.contains("iPad") || userAgent.contains("Tablet")
                ? "Tablet"
                : (mobile ? "Mobile" : "Desktop");
        return new DeviceInfo(deviceType, browser(userAgent), operatingSystem(userAgent), mobile);
    }

    private static String browser(String userAgent) {
        if (userAgent.contains("Edg")) return "Edge";
        if (userAgent.contains("Firefox")) return "Firefox";
        if (userAgent.contains("Chrome")) return "Chrome";
        if (userAgent.contains("Safari")) return "Safari";
        return "Unknown";
    }

    private static String operatingSystem(String userAgent) {
        if (userAgent.contains("Windows")) return "Windows";
        if (userAgent.contains("Android")) return "Android";
        if (userAgent.contains("iPhone") || userAgent.contains("iPad")) return "iOS";
        if (userAgent.contains("Mac")) return "macOS";
        if (userAgent.contains("Linux")) return "Linux";
        return "Unknown";
    }
}
