package com.rms.fanout.cache;

import com.rms.fanout.core.codec.DomainEventCodec;
import com.rms.fanout.core.codec.InvalidEventException;
import com.rms.fanout.core.lifecycle.FatalErrorHandler;
import com.rms.fanout.core.lifecycle.TaskSupervisor;
import com.rms.fanout.core.model.CacheManagerState;
import com.rms.fanout.core.model.DomainEvent;
import com.rms.fanout.core.model.EventTopic;
import com.rms.fanout.core.model.TimestampedEvent;
import com.rms.fanout.core.store.EpochNanos;
import com.rms.fanout.core.store.NotificationMessage;
import com.rms.fanout.core.store.RecentEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process fan-out engine: per (recipient, topic) caches fed from the recent-event store and drained
 * by any number of concurrent subscriptions.
 *
 * <h2>Background tasks</h2>
 * <ul>
 *   <li><b>incoming-consumer</b>: takes events off the incoming queue one at a time, in order, on a
 *       dedicated thread and appends them to their cache entry.</li>
 *   <li><b>notification-listener</b>: follows the store's notification channel, re-reads each announced
 *       event and queues it. Connection failures are retried a bounded number of times, then the process
 *       is terminated through {@link FatalErrorHandler}.</li>
 *   <li><b>backfill</b>: one-shot replay of every recipient's events younger than {@code maxEventAge}.
 *       Failures are logged only.</li>
 *   <li><b>cleanup-sweep</b>: periodically removes entries idle for longer than {@code maxEventAge}.</li>
 * </ul>
 *
 * <h2>Locking</h2>
 * The entry map is a {@link ConcurrentHashMap}. Each entry carries its own lock; every access to an
 * entry's events holds it. The sweep marks an entry evicted and unmaps it while holding the lock, and a
 * writer that finds an evicted entry retries against a fresh one.
 *
 * <h2>Subscriptions</h2>
 * See {@link #stream(String, String, Duration, Duration)}.
 */
@Component
public class EventCacheManager implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(EventCacheManager.class);

    static final String TASK_CONSUMER = "incoming-consumer";
    static final String TASK_NOTIFICATIONS = "notification-listener";
    static final String TASK_BACKFILL = "backfill";
    static final String TASK_SWEEP = "cleanup-sweep";

    private final RecentEventStore store;
    private final DomainEventCodec codec;
    private final EventCacheProperties props;
    private final FatalErrorHandler fatalErrorHandler;
    private final Clock clock;

    private final Map<TopicKey, TopicCache> caches = new ConcurrentHashMap<>();
    private final TaskSupervisor tasks = new TaskSupervisor("event-cache");
    private final AtomicReference<CacheManagerState> state = new AtomicReference<>(CacheManagerState.STOPPED);

    /** Replaced on every stop: a unicast sink accepts a single subscriber. */
    private volatile Sinks.Many<DomainEvent> incoming = newIncomingQueue();
    private volatile Scheduler consumerScheduler;

    public EventCacheManager(RecentEventStore store, DomainEventCodec codec, EventCacheProperties props,
                             FatalErrorHandler fatalErrorHandler, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.props = props;
        this.fatalErrorHandler = fatalErrorHandler;
        this.clock = clock;
    }

    // ------------------------------------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------------------------------------

    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        start();
    }

    /**
     * Launches the background tasks. No-op unless {@link CacheManagerState#STOPPED}.
     */
    public void start() {
        if (!state.compareAndSet(CacheManagerState.STOPPED, CacheManagerState.STARTING)) {
            log.debug("EventCacheManager start ignored in state={}", state.get());
            return;
        }
        log.info("EventCacheManager starting: maxQueueSize={} maxEventAge={} cleanupPeriod={} clientPollPeriod={}",
                props.getMaxQueueSize(), props.getMaxEventAge(), props.getCleanupPeriod(),
                props.getClientPollPeriod());

        Scheduler consumer = Schedulers.newSingle("event-cache-consumer");
        consumerScheduler = consumer;

        tasks.launch(TASK_CONSUMER, incoming.asFlux()
                .publishOn(consumer)
                .doOnNext(this::ingestSafely));

        tasks.launch(TASK_NOTIFICATIONS, notificationListener()
                .doOnError(err -> fatalErrorHandler.onFatalError("EventCacheManager." + TASK_NOTIFICATIONS, err)));

        tasks.launchOneShot(TASK_BACKFILL, backfill().subscribeOn(Schedulers.boundedElastic()));

        tasks.launch(TASK_SWEEP, Flux.interval(props.getCleanupPeriod(), props.getCleanupPeriod())
                .onBackpressureDrop()
                .publishOn(Schedulers.boundedElastic())
                .doOnNext(tick -> sweepSafely()));

        state.set(CacheManagerState.RUNNING);
        log.info("EventCacheManager running");
    }

    /**
     * Cancels the background tasks in reverse launch order. Cached entries are kept.
     */
    public void stop() {
        if (!state.compareAndSet(CacheManagerState.RUNNING, CacheManagerState.STOPPING)) {
            return;
        }
        log.info("EventCacheManager stopping");
        tasks.cancelAll();

        Scheduler consumer = consumerScheduler;
        consumerScheduler = null;
        if (consumer != null) {
            consumer.dispose();
        }
        incoming = newIncomingQueue();

        state.set(CacheManagerState.STOPPED);
        log.info("EventCacheManager stopped");
    }

    @Override
    public void destroy() {
        stop();
    }

    public CacheManagerState state() {
        return state.get();
    }

    /**
     * Running with every long-running task alive and no failed task.
     */
    public boolean isHealthy() {
        return state.get() == CacheManagerState.RUNNING && tasks.allRunning();
    }

    public Map<String, TaskSupervisor.TaskState> taskStatus() {
        return tasks.status();
    }

    // ------------------------------------------------------------------------------------------------
    // Ingest
    // ------------------------------------------------------------------------------------------------

    /**
     * Queues an event for the consumer task. Never blocks; ordering between calls is preserved.
     */
    public void push(DomainEvent event) {
        incoming.emitNext(event, Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100)));
    }

    void ingest(DomainEvent event) {
        Instant now = clock.instant();
        TimestampedEvent entry = new TimestampedEvent(now, event);
        TopicKey key = TopicKey.of(event);
        Instant cutoff = now.minus(props.getMaxEventAge());

        while (true) {
            TopicCache cache = caches.computeIfAbsent(key, k -> new TopicCache(props.getMaxQueueSize(), now));
            cache.lock();
            try {
                if (cache.isEvicted()) {
                    // Swept between lookup and lock; the map no longer holds this entry.
                    continue;
                }
                cache.pruneOlderThan(cutoff);
                if (cache.append(entry)) {
                    log.warn("Cache full for recipient={} topic={} (max {}); evicted oldest event",
                            key.recipientId(), key.topic(), props.getMaxQueueSize());
                }
                log.trace("Cached event recipient={} topic={}", key.recipientId(), key.topic());
                return;
            } finally {
                cache.unlock();
            }
        }
    }

    private void ingestSafely(DomainEvent event) {
        try {
            ingest(event);
        } catch (RuntimeException e) {
            log.error("Failed to cache event recipient={} topic={}: {}",
                    event.recipientId(), event.topic(), e.toString(), e);
        }
    }

    /**
     * A channel that completes is treated like one that failed: the listener must outlive it.
     */
    Flux<DomainEvent> notificationListener() {
        return Flux.defer(store::notifications)
                .concatWith(Flux.error(() -> new IllegalStateException("Notification channel closed")))
                .concatMap(this::fetchNotified)
                .doOnNext(this::push)
                .retryWhen(Retry.fixedDelay(props.getNotificationMaxRetries(), props.getNotificationRetryDelay())
                        .transientErrors(true)
                        .doBeforeRetry(sig -> log.warn(
                                "Notification subscription failed; retry {}/{}: {}",
                                sig.totalRetriesInARow() + 1, props.getNotificationMaxRetries(),
                                sig.failure().toString())));
    }

    private Flux<DomainEvent> fetchNotified(String raw) {
        NotificationMessage notification;
        try {
            notification = NotificationMessage.parse(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping malformed notification '{}': {}", raw, e.getMessage());
            return Flux.empty();
        }
        long ts = notification.timestampNs();
        return store.queryRange(notification.key(), ts, ts)
                .concatMap(this::decodeOrSkip);
    }

    Mono<Long> backfill() {
        return Mono.defer(() -> {
            long sinceNs = EpochNanos.of(clock.instant().minus(props.getMaxEventAge()));
            log.debug("Backfilling events since timestamp_ns={}", sinceNs);

            return store.listKnownRecipients()
                    .concatMap(key -> store.purgeOlderThan(key, sinceNs)
                            .doOnNext(purged -> {
                                if (purged > 0) {
                                    log.debug("Purged {} stale events for {}", purged, key);
                                }
                            })
                            .thenMany(store.querySince(key, sinceNs))
                            .onErrorResume(e -> {
                                log.warn("Backfill skipped recipient {}: {}", key, e.toString());
                                return Flux.empty();
                            }))
                    .concatMap(this::decodeOrSkip)
                    .doOnNext(this::push)
                    .count()
                    .doOnNext(total -> log.info("Backfilled a total of {} events", total))
                    .onErrorResume(e -> {
                        log.error("Backfill failed: {}", e.toString(), e);
                        return Mono.just(0L);
                    });
        });
    }

    private Mono<DomainEvent> decodeOrSkip(String json) {
        try {
            return Mono.just(codec.decode(json));
        } catch (InvalidEventException e) {
            log.warn("Dropping invalid stored event: {}", e.getMessage());
            return Mono.empty();
        }
    }

    // ------------------------------------------------------------------------------------------------
    // Eviction
    // ------------------------------------------------------------------------------------------------

    /**
     * Removes every entry idle for longer than {@code maxEventAge}.
     *
     * @return number of removed entries
     */
    int sweep() {
        Instant cutoff = clock.instant().minus(props.getMaxEventAge());
        int removed = 0;
        for (Map.Entry<TopicKey, TopicCache> e : caches.entrySet()) {
            TopicCache cache = e.getValue();
            if (!cache.lastAccessed().isBefore(cutoff)) {
                continue;
            }
            cache.lock();
            try {
                if (cache.isEvicted() || !cache.lastAccessed().isBefore(cutoff)) {
                    continue;
                }
                cache.markEvicted();
                caches.remove(e.getKey(), cache);
                removed++;
            } finally {
                cache.unlock();
            }
        }
        if (removed > 0) {
            log.debug("Cleanup sweep removed {} idle cache entries; {} remain", removed, caches.size());
        }
        return removed;
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Cleanup sweep failed: {}", e.toString(), e);
        }
    }

    // ------------------------------------------------------------------------------------------------
    // Subscriptions
    // ------------------------------------------------------------------------------------------------

    /**
     * Streams cached and future events of a recipient.
     *
     * <ul>
     *   <li>Every {@code clientPollPeriod} a populate task snapshots the entry (or, for
     *       {@link EventTopic#ALL}, every entry of the recipient) newest-first, skips events this
     *       subscription has already seen and emits those not older than {@code now - lookback}, where
     *       {@code now} is the subscription time.</li>
     *   <li>The flux completes after {@code timeout}; {@link Duration#ZERO} means no deadline.
     *       Completion and cancellation both stop the populate task.</li>
     * </ul>
     *
     * @param topic canonical or agent-side topic name, or {@link EventTopic#ALL}
     */
    public Flux<DomainEvent> stream(String recipientId, String topic, Duration lookback, Duration timeout) {
        String wanted = EventTopic.isAll(topic) ? topic : EventTopic.normalize(topic);

        return Flux.defer(() -> {
            Instant since = clock.instant().minus(lookback);
            SeenEventLog seen = new SeenEventLog(props.getDedupLogSize());
            Sinks.Many<DomainEvent> clientQueue = Sinks.many().unicast().onBackpressureBuffer();
            AtomicBoolean stopped = new AtomicBoolean(false);

            Disposable populate = Flux.interval(Duration.ZERO, props.getClientPollPeriod())
                    .onBackpressureDrop()
                    .takeWhile(tick -> !stopped.get())
                    .subscribe(
                            tick -> drain(recipientId, wanted, since, seen, clientQueue),
                            err -> {
                                log.error("Populate task failed recipient={} topic={}: {}",
                                        recipientId, wanted, err.toString(), err);
                                clientQueue.tryEmitError(err);
                            });

            Flux<DomainEvent> events = clientQueue.asFlux();
            if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
                events = events.take(timeout);
            }
            return events.doFinally(signal -> {
                stopped.set(true);
                populate.dispose();
                log.debug("Subscription closed recipient={} topic={} signal={}", recipientId, wanted, signal);
            });
        });
    }

    private void drain(String recipientId, String topic, Instant since, SeenEventLog seen,
                       Sinks.Many<DomainEvent> clientQueue) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(props.getMaxEventAge());
        seen.expire(cutoff);

        for (TopicCache cache : entriesFor(recipientId, topic)) {
            List<TimestampedEvent> snapshot;
            cache.lock();
            try {
                if (cache.isEvicted()) {
                    continue;
                }
                cache.pruneOlderThan(cutoff);
                snapshot = cache.newestFirst();
            } finally {
                cache.unlock();
            }

            boolean foundUnseen = false;
            List<DomainEvent> deliverable = new ArrayList<>();
            for (TimestampedEvent entry : snapshot) {
                if (!seen.markSeen(entry.event(), entry.timestamp())) {
                    continue;
                }
                foundUnseen = true;
                if (!entry.isBefore(since)) {
                    deliverable.add(entry.event());
                }
            }
            if (foundUnseen) {
                cache.touch(now);
            }

            for (DomainEvent event : deliverable) {
                Sinks.EmitResult result = clientQueue.tryEmitNext(event);
                if (result.isFailure()) {
                    log.debug("Subscription recipient={} topic={} no longer accepts events: {}",
                            recipientId, topic, result);
                    return;
                }
            }
        }
    }

    private List<TopicCache> entriesFor(String recipientId, String topic) {
        if (!EventTopic.isAll(topic)) {
            TopicCache cache = caches.get(new TopicKey(recipientId, topic));
            return cache == null ? List.of() : List.of(cache);
        }
        List<TopicCache> out = new ArrayList<>();
        caches.forEach((key, cache) -> {
            if (key.recipientId().equals(recipientId)) {
                out.add(cache);
            }
        });
        return out;
    }

    // ------------------------------------------------------------------------------------------------
    // Introspection
    // ------------------------------------------------------------------------------------------------

    /**
     * Cached events of one entry, oldest first. Empty when the entry does not exist.
     */
    public List<TimestampedEvent> snapshot(String recipientId, String topic) {
        TopicCache cache = caches.get(new TopicKey(recipientId, topic));
        if (cache == null) {
            return List.of();
        }
        cache.lock();
        try {
            return cache.isEvicted() ? List.of() : cache.oldestFirst();
        } finally {
            cache.unlock();
        }
    }

    public Set<TopicKey> cachedKeys() {
        return Set.copyOf(caches.keySet());
    }

    private static Sinks.Many<DomainEvent> newIncomingQueue() {
        return Sinks.many().unicast().onBackpressureBuffer();
    }
}
