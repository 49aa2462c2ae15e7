package com.rms.fanout.cache;

import com.rms.fanout.core.model.TimestampedEvent;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cached events of one (recipient, topic) pair.
 *
 * <h2>Structure</h2>
 * <ul>
 *   <li>A bounded deque in arrival order (oldest at the head). It serves both as the authoritative
 *       insertion order and, read from the tail, as the newest-first view; no second queue is kept.</li>
 *   <li>Its own lock. Every read and write of the deque happens under it.</li>
 *   <li>The last time the pair was written or drained with new results, read by the idle sweep.</li>
 *   <li>An {@code evicted} flag set by the sweep while holding the lock. A writer that acquires the lock
 *       of an evicted entry must go back to the map and use a fresh one.</li>
 * </ul>
 */
final class TopicCache {

    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<TimestampedEvent> events;
    private final int capacity;

    private volatile Instant lastAccessed;

    /** Guarded by {@link #lock}. */
    private boolean evicted;

    TopicCache(int capacity, Instant createdAt) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(Math.min(capacity, 64));
        this.lastAccessed = createdAt;
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    /**
     * Appends an event, evicting the oldest first when the cache is full.
     *
     * @return {@code true} when an event had to be evicted
     */
    boolean append(TimestampedEvent event) {
        requireLocked();
        boolean full = events.size() >= capacity;
        if (full) {
            events.pollFirst();
        }
        events.addLast(event);
        lastAccessed = event.timestamp().isAfter(lastAccessed) ? event.timestamp() : lastAccessed;
        return full;
    }

    /**
     * Drops events whose timestamp is before {@code cutoff}.
     *
     * @return number of dropped events
     */
    int pruneOlderThan(Instant cutoff) {
        requireLocked();
        int removed = 0;
        Iterator<TimestampedEvent> it = events.iterator();
        while (it.hasNext()) {
            if (it.next().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    List<TimestampedEvent> newestFirst() {
        requireLocked();
        List<TimestampedEvent> copy = new ArrayList<>(events.size());
        events.descendingIterator().forEachRemaining(copy::add);
        return copy;
    }

    List<TimestampedEvent> oldestFirst() {
        requireLocked();
        return new ArrayList<>(events);
    }

    int size() {
        requireLocked();
        return events.size();
    }

    void markEvicted() {
        requireLocked();
        evicted = true;
        events.clear();
    }

    boolean isEvicted() {
        requireLocked();
        return evicted;
    }

    void touch(Instant now) {
        lastAccessed = now;
    }

    Instant lastAccessed() {
        return lastAccessed;
    }

    private void requireLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("TopicCache accessed without holding its lock");
        }
    }
}
