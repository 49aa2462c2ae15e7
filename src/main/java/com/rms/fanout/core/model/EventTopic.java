package com.rms.fanout.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * =====================================================================
 * EventTopic
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Closed set of the topics the fan-out layer knows about, together with
 * the agent-side names that map onto each of them.
 *
 * Upstream agents name their topics differently from what subscribers
 * ask for (e.g. {@code issue_credential_v2_0} vs {@code credentials}).
 * Ingestion normalizes through {@link #normalize(String)} so that the
 * cache and the subscribers only ever see canonical names.
 *
 * UNKNOWN TOPICS
 * --------------
 * Topics outside this enum are NOT rejected. {@link #normalize(String)}
 * returns them unchanged and the event keeps a generic map payload, so
 * new agent topics flow through without a release.
 *
 * WILDCARD
 * --------
 * {@link #ALL} is not a topic of any event. It only appears in
 * subscriptions and means "every topic of this recipient".
 */
public enum EventTopic {

    BASIC_MESSAGES("basic-messages", "basicmessages"),
    CONNECTIONS("connections"),
    CREDENTIALS("credentials", "issue_credential", "issue_credential_v2_0"),
    ENDORSEMENTS("endorsements", "endorse_transaction"),
    ISSUER_CRED_REV("issuer_cred_rev"),
    OOB("oob", "out_of_band"),
    PROBLEM_REPORT("problem_report"),
    PROOFS("proofs", "present_proof", "present_proof_v2_0"),
    REVOCATION("revocation", "revocation_registry");

    /** Subscription wildcard matching every topic of a recipient. */
    public static final String ALL = "ALL_WEBHOOKS";

    private static final Map<String, EventTopic> BY_NAME;

    static {
        Map<String, EventTopic> byName = new HashMap<>();
        for (EventTopic topic : values()) {
            byName.put(topic.value, topic);
            for (String alias : topic.agentNames) {
                byName.put(alias, topic);
            }
        }
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private final String value;
    private final List<String> agentNames;

    EventTopic(String value, String... agentNames) {
        this.value = value;
        this.agentNames = Arrays.asList(agentNames);
    }

    /** Canonical topic name as seen by subscribers. */
    public String value() {
        return value;
    }

    /**
     * Resolves a canonical or agent-side topic name.
     *
     * @param name topic as received (case-insensitive)
     * @return the known topic, or empty for topics this build does not know
     */
    public static Optional<EventTopic> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Maps an agent topic onto its canonical name. Unknown topics are returned trimmed but otherwise
     * unchanged.
     */
    public static String normalize(String name) {
        return fromName(name).map(EventTopic::value).orElse(name == null ? null : name.trim());
    }

    public static boolean isAll(String topic) {
        return ALL.equals(topic);
    }
}
