package com.rms.fanout.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, normalized notification about a state change of one recipient.
 *
 * <h2>Wire shape</h2>
 * <pre>
 * {
 *   "wallet_id": "W1",          // "recipient_id" is accepted on input
 *   "group_id":  "G1" | null,
 *   "topic":     "credentials",
 *   "origin":    "tenant",
 *   "payload":   { "state": "done", "thread_id": "t1", ... }
 * }
 * </pre>
 *
 * <h2>Equality</h2>
 * Structural (record semantics over all components, payload compared by content). The cache relies on
 * this to recognise replays of the same event coming from backfill and from live notifications.
 *
 * <h2>Payload</h2>
 * Kept as a generic map so that unknown topics stay representable. Filter helpers such as
 * {@link #state()} read it lazily.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DomainEvent(
        @JsonProperty("wallet_id") @JsonAlias("recipient_id") String recipientId,
        @JsonProperty("group_id") String groupId,
        @JsonProperty("topic") String topic,
        @JsonProperty("origin") String origin,
        @JsonProperty("payload") Map<String, Object> payload
) {

    /** Payload key carrying the protocol state of the exchange the event belongs to. */
    public static final String STATE_FIELD = "state";

    public DomainEvent {
        recipientId = requireText(recipientId, "wallet_id");
        topic = requireText(topic, "topic");
        origin = requireText(origin, "origin");
        groupId = (groupId == null || groupId.isBlank()) ? null : groupId;
        if (payload == null) {
            throw new IllegalArgumentException("payload is required");
        }
        // Payload values may legitimately be JSON null, so Map.copyOf is not an option.
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /** {@code payload.state} when present and textual. */
    public Optional<String> state() {
        Object value = payload.get(STATE_FIELD);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    public Optional<Object> payloadValue(String field) {
        return Optional.ofNullable(payload.get(field));
    }

    @JsonIgnore
    public Optional<EventTopic> getKnownTopic() {
        return EventTopic.fromName(topic);
    }

    public DomainEvent withTopic(String newTopic) {
        return new DomainEvent(recipientId, groupId, newTopic, origin, payload);
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }
}
