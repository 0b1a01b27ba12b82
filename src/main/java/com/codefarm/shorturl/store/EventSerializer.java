package com.codefarm.shorturl.store;

import com.codefarm.shorturl.domain.EventPayload;
import com.codefarm.shorturl.domain.EventType;
import com.codefarm.shorturl.domain.ShortUrlEvent;
import com.codefarm.shorturl.exception.EventSerializationException;
import com.codefarm.shorturl.model.StoredEventEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Maps events to rows: the envelope goes to columns, the payload to JSON keyed by its type name.
 */
@Component
public class EventSerializer {

    private final ObjectMapper objectMapper;

    public EventSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public StoredEventEntity toEntity(ShortUrlEvent event) {
        try {
            return new StoredEventEntity(
                    event.eventId(),
                    event.aggregateId(),
                    event.version(),
                    event.type().getTypeName(),
                    objectMapper.writeValueAsString(event.payload()),
                    event.occurredAt()
            );
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event " + event.eventId(), e);
        }
    }

    public ShortUrlEvent toEvent(StoredEventEntity entity) {
        try {
            EventType type = EventType.fromTypeName(entity.getEventType());
            EventPayload payload = objectMapper.readValue(entity.getPayload(), type.getPayloadType());
            return new ShortUrlEvent(entity.getEventId(), entity.getAggregateId(), entity.getVersion(),
                    entity.getOccurredAt(), payload);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException("Failed to deserialize event " + entity.getEventId()
                    + " of type " + entity.getEventType(), e);
        }
    }
}
