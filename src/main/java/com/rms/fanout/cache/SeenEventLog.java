package com.rms.fanout.cache;

import com.rms.fanout.core.model.DomainEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-subscription memory of events already handed to the client.
 *
 * <p>Keyed by the event itself (structural equality), so a replay of the same event from backfill and
 * from a live notification is delivered once. Each entry remembers the newest cache timestamp it was
 * seen with.</p>
 *
 * <h2>Forgetting</h2>
 * {@link #expire(Instant)} runs between drain passes:
 * <ul>
 *   <li>entries last seen before the cache's age cutoff are dropped, since no cache entry can still hold
 *       their event;</li>
 *   <li>if more than {@code capacity} entries remain, the oldest are dropped and the watermark is raised
 *       to the newest dropped timestamp. Events cached at or before the watermark count as seen, so an
 *       overflow never turns into redelivery.</li>
 * </ul>
 * A single pass may exceed the capacity; it is enforced at the next {@code expire}.
 *
 * <p>Confined to the subscription's populate task.</p>
 */
final class SeenEventLog {

    private final Map<DomainEvent, Instant> seen = new HashMap<>();
    private final int capacity;

    private Instant watermark;

    SeenEventLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    /**
     * Records the event as cached at {@code cachedAt}.
     *
     * @return {@code true} if the event had not been handed out before
     */
    boolean markSeen(DomainEvent event, Instant cachedAt) {
        Instant previous = seen.get(event);
        if (previous != null) {
            if (cachedAt.isAfter(previous)) {
                seen.put(event, cachedAt);
            }
            return false;
        }
        if (watermark != null && !cachedAt.isAfter(watermark)) {
            return false;
        }
        seen.put(event, cachedAt);
        return true;
    }

    /**
     * Drops entries last seen before {@code cutoff}, then trims to capacity.
     *
     * @return number of dropped entries
     */
    int expire(Instant cutoff) {
        int before = seen.size();
        seen.values().removeIf(ts -> ts.isBefore(cutoff));

        int excess = seen.size() - capacity;
        if (excess > 0) {
            List<Map.Entry<DomainEvent, Instant>> byAge = new ArrayList<>(seen.entrySet());
            byAge.sort(Map.Entry.comparingByValue());
            for (Map.Entry<DomainEvent, Instant> e : byAge.subList(0, excess)) {
                seen.remove(e.getKey());
                if (watermark == null || e.getValue().isAfter(watermark)) {
                    watermark = e.getValue();
                }
            }
        }
        return before - seen.size();
    }

    boolean contains(DomainEvent event) {
        return seen.containsKey(event);
    }

    int size() {
        return seen.size();
    }
}
