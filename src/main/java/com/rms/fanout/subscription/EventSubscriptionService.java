package com.rms.fanout.subscription;

import com.rms.fanout.cache.EventCacheManager;
import com.rms.fanout.core.model.DomainEvent;
import com.rms.fanout.core.store.RecentEventStore;
import com.rms.fanout.core.store.RecipientKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Subscribe-and-wait API used by the SSE handlers.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Streams from {@link EventCacheManager#stream} and applies {@link EventFilter}.</li>
 *   <li>With a desired state the flux completes after the first matching event.</li>
 *   <li>A timeout without a match completes the flux empty; it is not an error.</li>
 *   <li>With a group id the recipient must exist under that group in the recent-event store. The check is
 *       repeated a few times before failing with {@link RecipientNotInGroupException}.</li>
 * </ul>
 */
@Service
@EnableConfigurationProperties(SubscriptionProperties.class)
public class EventSubscriptionService {

    private static final Logger log = LoggerFactory.getLogger(EventSubscriptionService.class);

    private final EventCacheManager cache;
    private final RecentEventStore store;
    private final SubscriptionProperties props;

    public EventSubscriptionService(EventCacheManager cache, RecentEventStore store, SubscriptionProperties props) {
        this.cache = cache;
        this.store = store;
        this.props = props;
    }

    public Flux<DomainEvent> subscribe(SubscriptionRequest request) {
        EventFilter filter = EventFilter.of(request);

        Flux<DomainEvent> events = cache
                .stream(request.recipientId(), request.topic(), request.lookback(), request.timeout())
                .filter(filter);
        if (request.completesOnFirstMatch()) {
            events = events.take(1);
        }

        Flux<DomainEvent> logged = events
                .doOnSubscribe(s -> log.debug("Subscription opened: {}", request))
                .doOnComplete(() -> log.debug("Subscription completed: recipient={} topic={}",
                        request.recipientId(), request.topic()));

        if (request.groupId() == null) {
            return logged;
        }
        return verifyMembership(request.groupId(), request.recipientId()).thenMany(logged);
    }

    /**
     * Completes when the recipient has stored events under the group, errors with
     * {@link RecipientNotInGroupException} after {@code groupCheckAttempts} negative checks.
     */
    Mono<Void> verifyMembership(String groupId, String recipientId) {
        RecipientKey key = new RecipientKey(groupId, recipientId);
        int attempts = Math.max(1, props.getGroupCheckAttempts());

        return Flux.range(1, attempts)
                .concatMap(attempt -> attempt == 1
                        ? store.exists(key)
                        : Mono.delay(props.getGroupCheckDelay()).then(store.exists(key)))
                .filter(Boolean::booleanValue)
                .next()
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Refusing subscription: recipient={} not found in group={} after {} checks",
                            recipientId, groupId, attempts);
                    return Mono.error(new RecipientNotInGroupException(groupId, recipientId));
                }))
                .then();
    }
}
