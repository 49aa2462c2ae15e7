package com.rms.fanout.core.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * RecentEventStore
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Shared, short-term history of serialized events per recipient plus a
 * change-notification channel.
 *
 * The store is the replay source for a freshly started cache and the
 * wake-up signal for every running cache instance. It is never the
 * primary cache: subscriptions are served from process memory.
 *
 * ORDERING
 * --------
 * Events are scored by {@code timestamp_ns}; range reads are ascending.
 *
 * STALENESS
 * ---------
 * Entries older than the cache's max event age are logically stale.
 * Callers exclude them by querying from {@code now - maxEventAge}; the
 * store is not required to purge them eagerly.
 */
public interface RecentEventStore {

    /**
     * Stores one serialized event and then publishes a {@link NotificationMessage} for it.
     *
     * <p>Completes only once both writes succeeded.</p>
     */
    Mono<Void> append(RecipientKey key, String eventJson, long timestampNs);

    /**
     * Serialized events with {@code startNs <= timestamp <= endNs}, ascending.
     */
    Flux<String> queryRange(RecipientKey key, long startNs, long endNs);

    /**
     * Serialized events with {@code timestamp >= startNs}, ascending.
     */
    Flux<String> querySince(RecipientKey key, long startNs);

    /**
     * Every recipient that currently has stored events.
     *
     * <p>Enumeration errors end the sequence early instead of failing it.</p>
     */
    Flux<RecipientKey> listKnownRecipients();

    /**
     * Whether anything is stored under {@code key}.
     */
    Mono<Boolean> exists(RecipientKey key);

    /**
     * Removes entries scored below {@code cutoffNs}.
     *
     * @return number of removed entries
     */
    Mono<Long> purgeOlderThan(RecipientKey key, long cutoffNs);

    /**
     * Raw notification messages, as published by {@link #append}. Connection failures terminate the
     * flux with an error; resubscribing reconnects.
     */
    Flux<String> notifications();
}
