package com.rms.fanout.subscription;

import com.rms.fanout.core.model.EventTopic;

import java.time.Duration;
import java.util.Objects;

/**
 * =====================================================================
 * SubscriptionRequest
 * =====================================================================
 *
 * What a subscriber wants to see.
 *
 * FIELDS
 * ------
 *   recipientId   required
 *   topic         required; canonical, agent-side or ALL_WEBHOOKS
 *   groupId       optional; restricts to the recipient's events in that
 *                 group and requires the recipient to exist there
 *   field/fieldId optional pair; payload[field] must render as fieldId
 *   desiredState  optional; payload.state must equal it, and the
 *                 subscription ends after the first match
 *   lookback      how far back cached events are still delivered
 *   timeout       deadline of the subscription, ZERO = none
 */
public record SubscriptionRequest(
		String recipientId,
		String topic,
		String groupId,
		String field,
		String fieldId,
		String desiredState,
		Duration lookback,
		Duration timeout) {

	public SubscriptionRequest {
		if (recipientId == null || recipientId.isBlank()) {
			throw new IllegalArgumentException("recipientId is required");
		}
		if (topic == null || topic.isBlank()) {
			throw new IllegalArgumentException("topic is required");
		}
		if ((field == null) != (fieldId == null)) {
			throw new IllegalArgumentException("field and fieldId must be given together");
		}
		Objects.requireNonNull(lookback, "lookback");
		Objects.requireNonNull(timeout, "timeout");
		if (lookback.isNegative() || timeout.isNegative()) {
			throw new IllegalArgumentException("lookback and timeout must not be negative");
		}
		groupId = blankToNull(groupId);
		desiredState = blankToNull(desiredState);
	}

	public static Builder builder(String recipientId) {
		return new Builder(recipientId);
	}

	public boolean hasFieldFilter() {
		return field != null;
	}

	/** Single-event subscriptions complete on their first match. */
	public boolean completesOnFirstMatch() {
		return desiredState != null;
	}

	private static String blankToNull(String s) {
		return (s == null || s.isBlank()) ? null : s;
	}

	public static final class Builder {
		private final String recipientId;
		private String topic = EventTopic.ALL;
		private String groupId;
		private String field;
		private String fieldId;
		private String desiredState;
		private Duration lookback = Duration.ofSeconds(60);
		private Duration timeout = Duration.ZERO;

		private Builder(String recipientId) {
			this.recipientId = recipientId;
		}

		public Builder topic(String topic) {
			this.topic = topic;
			return this;
		}

		public Builder groupId(String groupId) {
			this.groupId = groupId;
			return this;
		}

		public Builder field(String field, String fieldId) {
			this.field = field;
			this.fieldId = fieldId;
			return this;
		}

		public Builder desiredState(String desiredState) {
			this.desiredState = desiredState;
			return this;
		}

		public Builder lookback(Duration lookback) {
			this.lookback = lookback;
			return this;
		}

		public Builder timeout(Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		public SubscriptionRequest build() {
			return new SubscriptionRequest(recipientId, topic, groupId, field, fieldId, desiredState, lookback,
					timeout);
		}
	}
}
