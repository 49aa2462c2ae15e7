package com.rms.fanout.subscription;

import com.rms.fanout.core.model.DomainEvent;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Caller-side predicate applied on top of the cache stream: group, field/value and desired state.
 * Payload fields are read lazily, so events of unknown topics are filtered the same way.
 */
public final class EventFilter implements Predicate<DomainEvent> {

    private final String groupId;
    private final String field;
    private final String fieldId;
    private final String desiredState;

    private EventFilter(String groupId, String field, String fieldId, String desiredState) {
        this.groupId = groupId;
        this.field = field;
        this.fieldId = fieldId;
        this.desiredState = desiredState;
    }

    public static EventFilter of(SubscriptionRequest request) {
        return new EventFilter(request.groupId(), request.field(), request.fieldId(), request.desiredState());
    }

    @Override
    public boolean test(DomainEvent event) {
        if (groupId != null && !groupId.equals(event.groupId())) {
            return false;
        }
        if (field != null) {
            Optional<Object> value = event.payloadValue(field);
            if (value.isEmpty() || !fieldId.equals(String.valueOf(value.get()))) {
                return false;
            }
        }
        return desiredState == null || Objects.equals(desiredState, event.state().orElse(null));
    }
}
