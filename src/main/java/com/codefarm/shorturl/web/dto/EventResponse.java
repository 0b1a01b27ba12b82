package com.codefarm.shorturl.web.dto;

import com.codefarm.shorturl.domain.EventPayload;
import com.codefarm.shorturl.domain.ShortUrlEvent;

import java.time.Instant;
import java.util.UUID;

public record EventResponse(
        UUID eventId,
        long version,
        String type,
        Instant occurredAt,
        EventPayload payload
) {
    public static EventResponse from(ShortUrlEvent event) {
        return new EventResponse(event.eventId(), event.version(), event.type().getTypeName(),
                event.occurredAt(), event.payload());
    }
}
