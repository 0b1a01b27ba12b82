package com.codefarm.shorturl.web.dto;

public record AvailabilityResponse(String alias, boolean available) {
}
