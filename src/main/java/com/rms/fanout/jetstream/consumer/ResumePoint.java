package com.rms.fanout.jetstream.consumer;

import io.nats.client.Message;
import io.nats.client.impl.NatsJetStreamMetaData;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * The instant a replacement consumer starts delivering from.
 *
 * <p>A message is <em>pending</em> from the moment it is fetched until its handler settles it (acked, or
 * discarded as poison). The resume point is the timestamp of the oldest pending message or, with nothing
 * pending, of the newest settled one. A consumer created from it therefore redelivers every message that
 * was fetched but never settled, including those a failed pull loop had buffered.</p>
 *
 * <p>Pending messages are keyed by stream sequence, so a redelivery settles the original entry. Messages
 * without JetStream metadata are not tracked.</p>
 *
 * <p>Thread-safe: the pull loop records deliveries while handlers settle on other threads.</p>
 */
public final class ResumePoint {

    private final Map<Long, Instant> pending = new HashMap<>();
    private Instant settledUpTo;

    public ResumePoint(Instant start) {
        this.settledUpTo = start;
    }

    public synchronized void delivered(Message msg) {
        NatsJetStreamMetaData meta = metaData(msg);
        if (meta != null) {
            pending.putIfAbsent(meta.streamSequence(), meta.timestamp().toInstant());
        }
    }

    public synchronized void settled(Message msg) {
        NatsJetStreamMetaData meta = metaData(msg);
        if (meta == null) {
            return;
        }
        pending.remove(meta.streamSequence());
        Instant ts = meta.timestamp().toInstant();
        if (ts.isAfter(settledUpTo)) {
            settledUpTo = ts;
        }
    }

    public synchronized Instant current() {
        Instant oldestPending = null;
        for (Instant ts : pending.values()) {
            if (oldestPending == null || ts.isBefore(oldestPending)) {
                oldestPending = ts;
            }
        }
        return oldestPending != null ? oldestPending : settledUpTo;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    private static NatsJetStreamMetaData metaData(Message msg) {
        if (!msg.isJetStream()) {
            return null;
        }
        NatsJetStreamMetaData meta = msg.metaData();
        return meta == null || meta.timestamp() == null ? null : meta;
    }
}
