package com.rms.fanout.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.fanout.core.model.DomainEvent;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * JSON encoding of {@link DomainEvent}s for the recent-event store and the bus.
 *
 * <p>Encoding is deterministic for a given event (payload insertion order is preserved), which keeps
 * content hashes stable for JetStream de-duplication.</p>
 */
@Component
public class DomainEventCodec {

    private final ObjectMapper mapper;

    public DomainEventCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(DomainEvent event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event for recipient " + event.recipientId(), e);
        }
    }

    public byte[] encodeBytes(DomainEvent event) {
        return encode(event).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @throws InvalidEventException when the text is not JSON or misses a required field
     */
    public DomainEvent decode(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidEventException("Empty event body", null);
        }
        try {
            return mapper.readValue(json, DomainEvent.class);
        } catch (JsonProcessingException e) {
            throw new InvalidEventException("Malformed event: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws InvalidEventException when the bytes are not a valid event document
     */
    public DomainEvent decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new InvalidEventException("Empty event body", null);
        }
        try {
            return mapper.readValue(body, DomainEvent.class);
        } catch (IOException e) {
            throw new InvalidEventException("Malformed event: " + e.getMessage(), e);
        }
    }
}
