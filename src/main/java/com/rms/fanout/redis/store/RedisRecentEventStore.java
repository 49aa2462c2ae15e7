package com.rms.fanout.redis.store;

import com.rms.fanout.core.store.NotificationMessage;
import com.rms.fanout.core.store.RecentEventStore;
import com.rms.fanout.core.store.RecipientKey;
import com.rms.fanout.redis.config.RecentEventStoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Redis implementation of {@link RecentEventStore}.
 *
 * <p>One sorted set per recipient key, members are event JSON documents scored by {@code timestamp_ns}.
 * Scores are doubles, so nanosecond timestamps lose sub-microsecond precision; writes and exact-score
 * reads round the same way and still meet, at worst returning a neighbour that the cache de-duplicates.</p>
 */
@Repository
public class RedisRecentEventStore implements RecentEventStore {

    private static final Logger log = LoggerFactory.getLogger(RedisRecentEventStore.class);

    private final ReactiveStringRedisTemplate redis;
    private final RecentEventStoreProperties props;

    public RedisRecentEventStore(ReactiveStringRedisTemplate redis, RecentEventStoreProperties props) {
        this.redis = redis;
        this.props = props;
    }

    @Override
    public Mono<Void> append(RecipientKey key, String eventJson, long timestampNs) {
        String storeKey = key.toStoreKey(props.getKeyPrefix());
        String notification = new NotificationMessage(key, timestampNs).format();

        return redis.opsForZSet().add(storeKey, eventJson, score(timestampNs))
                .then(Mono.defer(() -> redis.convertAndSend(props.getNotificationChannel(), notification)))
                .doOnNext(receivers -> log.debug("Stored event key={} ts={} notified={} listeners",
                        storeKey, timestampNs, receivers))
                .then();
    }

    @Override
    public Flux<String> queryRange(RecipientKey key, long startNs, long endNs) {
        return redis.opsForZSet().rangeByScore(key.toStoreKey(props.getKeyPrefix()),
                Range.closed(score(startNs), score(endNs)));
    }

    @Override
    public Flux<String> querySince(RecipientKey key, long startNs) {
        return redis.opsForZSet().rangeByScore(key.toStoreKey(props.getKeyPrefix()),
                Range.rightUnbounded(Range.Bound.inclusive(score(startNs))));
    }

    @Override
    public Flux<RecipientKey> listKnownRecipients() {
        String prefix = props.getKeyPrefix();
        ScanOptions options = ScanOptions.scanOptions()
                .match(prefix + ":*")
                .count(props.getScanCount())
                .build();

        return redis.scan(options)
                .map(storeKey -> RecipientKey.fromStoreKey(prefix, storeKey))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .distinct()
                .onErrorResume(e -> {
                    log.warn("Scan for recipient keys failed; continuing with what was found. err={}", e.toString());
                    return Flux.empty();
                });
    }

    @Override
    public Mono<Boolean> exists(RecipientKey key) {
        return redis.hasKey(key.toStoreKey(props.getKeyPrefix()));
    }

    @Override
    public Mono<Long> purgeOlderThan(RecipientKey key, long cutoffNs) {
        return redis.opsForZSet().removeRangeByScore(key.toStoreKey(props.getKeyPrefix()),
                Range.leftUnbounded(Range.Bound.exclusive(score(cutoffNs))));
    }

    @Override
    public Flux<String> notifications() {
        return redis.listenToChannel(props.getNotificationChannel())
                .map(message -> message.getMessage());
    }

    private static double score(long timestampNs) {
        return (double) timestampNs;
    }
}
