package com.rms.fanout.ingest;

import com.rms.fanout.core.codec.DomainEventCodec;
import com.rms.fanout.core.codec.InvalidEventException;
import com.rms.fanout.core.model.DomainEvent;
import com.rms.fanout.core.model.EventTopic;
import com.rms.fanout.core.store.RecipientKey;
import org.springframework.stereotype.Component;

/**
 * Turns a raw agent message body into a {@link DomainEvent} with a canonical topic.
 */
@Component
public class AgentEventParser {

    private final DomainEventCodec codec;

    public AgentEventParser(DomainEventCodec codec) {
        this.codec = codec;
    }

    /**
     * @throws InvalidEventException when the body is not a valid event document, or its recipient or group
     *                               id does not match {@link RecipientKey#ID_PATTERN}
     */
    public DomainEvent parse(byte[] body) {
        DomainEvent event = codec.decode(body);
        if (!RecipientKey.isValidId(event.recipientId())) {
            throw new InvalidEventException("Unusable wallet_id '" + event.recipientId() + "'");
        }
        if (event.groupId() != null && !RecipientKey.isValidId(event.groupId())) {
            throw new InvalidEventException("Unusable group_id '" + event.groupId() + "'");
        }
        String canonical = EventTopic.normalize(event.topic());
        return canonical.equals(event.topic()) ? event : event.withTopic(canonical);
    }
}
