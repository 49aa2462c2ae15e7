package com.rms.fanout.cache;

import com.rms.fanout.core.model.DomainEvent;

/**
 * Composite key of one cache entry: a recipient and a concrete topic (never the ALL wildcard).
 */
public record TopicKey(String recipientId, String topic) {

    public static TopicKey of(DomainEvent event) {
        return new TopicKey(event.recipientId(), event.topic());
    }
}
