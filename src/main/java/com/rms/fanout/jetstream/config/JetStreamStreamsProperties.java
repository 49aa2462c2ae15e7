package com.rms.fanout.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The two JetStream streams the fan-out service depends on.
 *
 * <ul>
 *   <li>{@code events}: raw agent events, the ingestion source. Limits retention keeps them for
 *       {@code max-age} whether or not anyone consumes, which is what makes the ingestion replay window
 *       work after a restart.</li>
 *   <li>{@code state}: normalized events republished per recipient/topic/state for state monitoring.</li>
 * </ul>
 *
 * <p>Configuration prefix: {@code fanout.jetstream.streams}. Both streams have working defaults.</p>
 */
@ConfigurationProperties(prefix = "fanout.jetstream.streams")
public class JetStreamStreamsProperties {

    public static final String EVENTS_KEY = "events";
    public static final String STATE_KEY = "state";

    private StreamSpec events = StreamSpec.of("agent_events", "agent.events.>", Duration.ofDays(1));
    private StreamSpec state = StreamSpec.of("agent_state_monitoring", "agent.state.>", Duration.ofHours(1));

    public StreamSpec getEvents() { return events; }
    public void setEvents(StreamSpec events) { this.events = events; }

    public StreamSpec getState() { return state; }
    public void setState(StreamSpec state) { this.state = state; }

    /**
     * Streams for the given logical keys, in key order; every enabled stream when {@code keys} is empty.
     *
     * @throws IllegalArgumentException for an unknown key
     * @throws IllegalStateException    for a key whose stream is disabled
     */
    public List<StreamSpec> selectByKeys(List<String> keys) {
        Map<String, StreamSpec> byKey = new LinkedHashMap<>();
        byKey.put(EVENTS_KEY, events);
        byKey.put(STATE_KEY, state);

        List<StreamSpec> out = new ArrayList<>();
        if (keys == null || keys.isEmpty()) {
            byKey.values().stream().filter(s -> s != null && s.isEnabled()).forEach(out::add);
            return out;
        }
        for (String raw : keys) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String key = raw.trim().toLowerCase(Locale.ROOT);
            StreamSpec spec = byKey.get(key);
            if (spec == null) {
                throw new IllegalArgumentException("Unknown stream key '" + raw + "', expected one of " + byKey.keySet());
            }
            if (!spec.isEnabled()) {
                throw new IllegalStateException("Stream '" + key + "' is selected for bootstrap but disabled");
            }
            out.add(spec);
        }
        return out;
    }

    public static class StreamSpec {

        private String name;
        private boolean enabled = true;
        private List<String> subjects = new ArrayList<>();

        /** Retention; for the events stream also the upper bound of the ingestion replay window. */
        private Duration maxAge;

        /** {@code Limits | Interest | WorkQueue} */
        private String retentionPolicy = "Limits";

        /** {@code File | Memory} */
        private String storageType = "File";

        private int replicas = 1;

        /** Server-side de-duplication window for {@code Nats-Msg-Id}. */
        private Duration duplicateWindow = Duration.ofMinutes(2);

        private List<String> placementTags = new ArrayList<>();

        static StreamSpec of(String name, String subject, Duration maxAge) {
            StreamSpec s = new StreamSpec();
            s.name = name;
            s.subjects = new ArrayList<>(List.of(subject));
            s.maxAge = maxAge;
            return s;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public List<String> getSubjects() { return subjects; }
        public void setSubjects(List<String> subjects) { this.subjects = subjects; }

        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

        public String getRetentionPolicy() { return retentionPolicy; }
        public void setRetentionPolicy(String retentionPolicy) { this.retentionPolicy = retentionPolicy; }

        public String getStorageType() { return storageType; }
        public void setStorageType(String storageType) { this.storageType = storageType; }

        public int getReplicas() { return replicas; }
        public void setReplicas(int replicas) { this.replicas = replicas; }

        public Duration getDuplicateWindow() { return duplicateWindow; }
        public void setDuplicateWindow(Duration duplicateWindow) { this.duplicateWindow = duplicateWindow; }

        public List<String> getPlacementTags() { return placementTags; }
        public void setPlacementTags(List<String> placementTags) { this.placementTags = placementTags; }
    }
}
