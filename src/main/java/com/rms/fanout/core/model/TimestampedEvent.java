package com.rms.fanout.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A {@link DomainEvent} together with the instant it entered the cache.
 *
 * <p>The timestamp orders events inside a topic cache and drives both the lookback filter of
 * subscriptions and age-based eviction.</p>
 */
public record TimestampedEvent(Instant timestamp, DomainEvent event) {

    public TimestampedEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(event, "event");
    }

    public boolean isBefore(Instant instant) {
        return timestamp.isBefore(instant);
    }
}
