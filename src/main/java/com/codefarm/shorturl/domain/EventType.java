package com.codefarm.shorturl.domain;

import java.util.Arrays;

/**
 * Stored discriminator of an {@link EventPayload} variant.
 */
public enum EventType {
    CREATED("UrlCreated", EventPayload.Created.class),
    ACCESSED("UrlAccessed", EventPayload.Accessed.class),
    EXPIRED("UrlExpired", EventPayload.Expired.class),
    DISABLED("UrlDisabled", EventPayload.Disabled.class);

    private final String typeName;
    private final Class<? extends EventPayload> payloadType;

    EventType(String typeName, Class<? extends EventPayload> payloadType) {
        this.typeName = typeName;
        this.payloadType = payloadType;
    }

    public String getTypeName() {
        return typeName;
    }

    public Class<? extends EventPayload> getPayloadType() {
        return payloadType;
    }

    public static EventType fromTypeName(String typeName) {
        return Arrays.stream(values())
                .filter(type -> type.typeName.equals(typeName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + typeName));
    }
}
