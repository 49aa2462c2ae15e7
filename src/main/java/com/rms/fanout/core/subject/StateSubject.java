package com.rms.fanout.core.subject;

import com.rms.fanout.core.model.DomainEvent;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * =====================================================================
 * StateSubject
 * =====================================================================
 *
 * PURPOSE ------- Canonical subject under which ingested events are
 * republished for state monitoring.
 *
 * CANONICAL FORMAT (LOCKED) ------------------------
 *
 * <prefix>.<group>.<recipient>.<topic>.<state>
 *
 * Examples: agent.state.none.W1.credentials.done
 * agent.state.G1.W2.proofs.request-received
 *
 * A missing group or state is rendered as "none" so that the token count
 * never changes and wildcard filters ({@code agent.state.*.W1.>}) keep
 * working.
 *
 * TOKENS ------ Recipient, group, topic and state come from upstream
 * events and are NOT trusted. Characters that NATS treats specially
 * ('.', '*', '>', whitespace) are replaced by '_'.
 */
public final class StateSubject {

	/** Placeholder for absent group/state. */
	public static final String NONE = "none";

	private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_-]");

	private final String prefix;
	private final String group;
	private final String recipient;
	private final String topic;
	private final String state;

	private StateSubject(Builder b) {
		this.prefix = requirePrefix(b.prefix);
		this.group = token(b.group);
		this.recipient = token(Objects.requireNonNull(b.recipient, "recipient"));
		this.topic = token(Objects.requireNonNull(b.topic, "topic"));
		this.state = token(b.state);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Subject for an ingested event.
	 */
	public static StateSubject of(String prefix, DomainEvent event) {
		return builder().prefix(prefix).group(event.groupId()).recipient(event.recipientId()).topic(event.topic())
				.state(event.state().orElse(null)).build();
	}

	/**
	 * Converts this object into its JetStream subject string. Always five
	 * tokens after the prefix.
	 */
	public String toSubject() {
		return prefix + "." + group + "." + recipient + "." + topic + "." + state;
	}

	@Override
	public String toString() {
		return toSubject();
	}

	private static String requirePrefix(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("prefix is required");
		}
		if (value.startsWith(".") || value.endsWith(".") || value.contains("*") || value.contains(">")) {
			throw new IllegalArgumentException("prefix must be a concrete subject prefix but was: " + value);
		}
		return value;
	}

	private static String token(String value) {
		if (value == null || value.isBlank()) {
			return NONE;
		}
		return UNSAFE.matcher(value.trim()).replaceAll("_");
	}

	public String group() {
		return group;
	}

	public String recipient() {
		return recipient;
	}

	public String topic() {
		return topic;
	}

	public String state() {
		return state;
	}

	public static final class Builder {

		private String prefix;
		private String group;
		private String recipient;
		private String topic;
		private String state;

		public Builder prefix(String prefix) {
			this.prefix = prefix;
			return this;
		}

		public Builder group(String group) {
			this.group = group;
			return this;
		}

		public Builder recipient(String recipient) {
			this.recipient = recipient;
			return this;
		}

		public Builder topic(String topic) {
			this.topic = topic;
			return this;
		}

		public Builder state(String state) {
			this.state = state;
			return this;
		}

		public StateSubject build() {
			return new StateSubject(this);
		}
	}
}
