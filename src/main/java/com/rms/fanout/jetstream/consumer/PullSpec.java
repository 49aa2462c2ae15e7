package com.rms.fanout.jetstream.consumer;

import java.time.Instant;
import java.util.Objects;

/**
 * What to pull: stream, subject filter and the instant delivery starts from.
 *
 * <p>Consumers are ephemeral. A restarting instance replays everything since {@code startTime}
 * instead of resuming a server-side position.</p>
 */
public record PullSpec(String stream, String filterSubject, Instant startTime) {

    public PullSpec {
        if (stream == null || stream.isBlank()) {
            throw new IllegalArgumentException("stream is required");
        }
        if (filterSubject == null || filterSubject.isBlank()) {
            throw new IllegalArgumentException("filterSubject is required");
        }
        Objects.requireNonNull(startTime, "startTime");
    }
}
