package com.rms.fanout.jetstream.bootstrap;

import com.rms.fanout.jetstream.config.JetStreamBootstrapProperties;
import com.rms.fanout.jetstream.config.JetStreamStreamsProperties;
import com.rms.fanout.jetstream.config.JetStreamStreamsProperties.StreamSpec;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.Placement;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * =====================================================================
 * JetStreamBootstrapper
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Provisions the agent-events stream (ingestion source) and the
 * state-monitoring stream (republish target) before ingestion starts.
 *
 * Enabled on at most one instance per environment, or on none when the
 * streams are managed by infrastructure tooling.
 *
 * OUTCOME PER STREAM
 * ------------------
 *   missing            → created from the declared configuration
 *   present, matching  → left alone
 *   present, drifted   → never modified; fails startup or logs a
 *                        warning, see {@code fail-on-mismatch}
 *
 * Once every selected stream is in place a
 * {@link JetStreamBootstrapCompleteEvent} is published.
 */
@Component
@ConditionalOnProperty(prefix = "fanout.bootstrap", name = "enabled", havingValue = "true")
public class JetStreamBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(JetStreamBootstrapper.class);

    /** JetStream API error code for "stream not found". */
    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    enum Outcome { CREATED, MATCHED, DRIFTED }

    private final JetStreamManagement jsm;
    private final JetStreamStreamsProperties streamsProps;
    private final JetStreamBootstrapProperties bootstrapProps;
    private final ApplicationEventPublisher events;

    public JetStreamBootstrapper(JetStreamManagement jsm,
                                 JetStreamStreamsProperties streamsProps,
                                 JetStreamBootstrapProperties bootstrapProps,
                                 ApplicationEventPublisher events) {
        this.jsm = jsm;
        this.streamsProps = streamsProps;
        this.bootstrapProps = bootstrapProps;
        this.events = events;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<StreamSpec> selected = streamsProps.selectByKeys(bootstrapProps.getStreamKeys());
        log.info("Provisioning JetStream streams {}",
                selected.stream().map(StreamSpec::getName).toList());

        for (StreamSpec spec : selected) {
            Outcome outcome = ensureStream(spec);
            log.info("Stream {}: {}", spec.getName(), outcome);
        }

        events.publishEvent(new JetStreamBootstrapCompleteEvent());
    }

    /**
     * Creates the stream when missing, otherwise compares it with its declaration.
     *
     * @throws JetStreamApiException for any API error other than "stream not found"
     * @throws IllegalStateException on drift when {@code fail-on-mismatch} is set
     */
    Outcome ensureStream(StreamSpec spec) throws IOException, JetStreamApiException {
        StreamConfiguration desired = toStreamConfig(spec);

        StreamConfiguration actual;
        try {
            actual = jsm.getStreamInfo(desired.getName()).getConfiguration();
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() != JS_STREAM_NOT_FOUND_ERR) {
                throw e;
            }
            jsm.addStream(desired);
            log.info("Created stream {} subjects={} maxAge={} storage={} replicas={}",
                    desired.getName(), desired.getSubjects(), desired.getMaxAge(),
                    desired.getStorageType(), desired.getReplicas());
            return Outcome.CREATED;
        }

        List<String> drift = drift(desired, actual);
        if (drift.isEmpty()) {
            return Outcome.MATCHED;
        }

        String msg = "Stream " + desired.getName() + " differs from its declared configuration: "
                + String.join("; ", drift);
        if (bootstrapProps.isFailOnMismatch()) {
            throw new IllegalStateException(msg);
        }
        log.warn(msg);
        return Outcome.DRIFTED;
    }

    static List<String> drift(StreamConfiguration desired, StreamConfiguration actual) {
        List<String> out = new ArrayList<>();
        compare(out, "retentionPolicy", desired.getRetentionPolicy(), actual.getRetentionPolicy());
        compare(out, "storageType", desired.getStorageType(), actual.getStorageType());
        compare(out, "maxAge", desired.getMaxAge(), actual.getMaxAge());
        compare(out, "replicas", desired.getReplicas(), actual.getReplicas());
        if (desired.getDuplicateWindow() != null) {
            compare(out, "duplicateWindow", desired.getDuplicateWindow(), actual.getDuplicateWindow());
        }
        compare(out, "subjects", new HashSet<>(desired.getSubjects()), new HashSet<>(actual.getSubjects()));
        compare(out, "placementTags", new HashSet<>(tags(desired)), new HashSet<>(tags(actual)));
        return out;
    }

    private static void compare(List<String> out, String field, Object expected, Object actual) {
        if (!Objects.equals(expected, actual)) {
            out.add(field + " expected=" + expected + " actual=" + actual);
        }
    }

    private static Collection<String> tags(StreamConfiguration config) {
        Placement placement = config.getPlacement();
        return placement == null || placement.getTags() == null ? List.of() : placement.getTags();
    }

    /**
     * Translates a declared stream into a JetStream configuration.
     *
     * @throws IllegalArgumentException when the declaration is incomplete or names an unknown policy
     */
    static StreamConfiguration toStreamConfig(StreamSpec spec) {
        String name = spec.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Stream name is required");
        }
        if (spec.getSubjects() == null || spec.getSubjects().isEmpty()) {
            throw new IllegalArgumentException("Stream " + name + " declares no subjects");
        }
        if (spec.getMaxAge() == null) {
            throw new IllegalArgumentException("Stream " + name + " declares no maxAge");
        }

        StreamConfiguration.Builder builder = StreamConfiguration.builder()
                .name(name)
                .subjects(spec.getSubjects())
                .retentionPolicy(retention(spec.getRetentionPolicy()))
                .storageType(storage(spec.getStorageType()))
                .maxAge(spec.getMaxAge())
                .replicas(spec.getReplicas());

        if (spec.getDuplicateWindow() != null) {
            builder.duplicateWindow(spec.getDuplicateWindow());
        }
        if (spec.getPlacementTags() != null && !spec.getPlacementTags().isEmpty()) {
            builder.placement(Placement.builder().tags(spec.getPlacementTags()).build());
        }
        return builder.build();
    }

    // Limits by default: the ingestion replay must not depend on consumer interest.
    private static RetentionPolicy retention(String value) {
        String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        return switch (v) {
            case "", "limits" -> RetentionPolicy.Limits;
            case "interest" -> RetentionPolicy.Interest;
            case "workqueue" -> RetentionPolicy.WorkQueue;
            default -> throw new IllegalArgumentException("Unsupported retentionPolicy: " + value);
        };
    }

    private static StorageType storage(String value) {
        String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "", "file" -> StorageType.File;
            case "memory" -> StorageType.Memory;
            default -> throw new IllegalArgumentException("Unsupported storageType: " + value);
        };
    }
}
