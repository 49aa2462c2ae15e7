package com.rms.fanout.jetstream.publisher;

import com.rms.fanout.core.codec.DomainEventCodec;
import com.rms.fanout.core.model.DomainEvent;
import com.rms.fanout.core.publisher.EventPublisher;
import com.rms.fanout.jetstream.BusConnectionException;
import com.rms.fanout.jetstream.config.JetStreamClientProperties;
import io.nats.client.AuthenticationException;
import io.nats.client.JetStream;
import io.nats.client.Message;
import io.nats.client.PublishOptions;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.concurrent.TimeoutException;

/**
 * Reactive JetStream publisher for {@link DomainEvent}s.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Publishes events to a JetStream subject with descriptive headers.</li>
 *   <li>Enforces de-duplication using JetStream message-id semantics.</li>
 *   <li>Retries transient connection errors with a fixed delay.</li>
 * </ul>
 *
 * <h2>De-duplication rule</h2>
 * <ul>
 *   <li>{@code Msg-Id == dedupKey} when the caller supplies one.</li>
 *   <li>Otherwise {@code Msg-Id == sha256(serialized event)}, so a redelivered event republished by the
 *       ingestion listener is recognised by the server within the stream's duplicate window.</li>
 * </ul>
 *
 * <h2>Retry policy</h2>
 * <ul>
 *   <li>I/O errors and timeouts are retried until {@code publishMaxAttempts} attempts were made, waiting
 *       {@code publishRetryDelay} in between; then the Mono fails with {@link BusConnectionException}.</li>
 *   <li>Authentication failures and JetStream API rejections are not retried.</li>
 *   <li>A duplicate acknowledgment is logged, not treated as an error.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * {@link JetStream#publish(Message, PublishOptions)} blocks for the server round trip, so it runs on
 * {@link Schedulers#boundedElastic()}.
 */
@Component
public class JetStreamEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(JetStreamEventPublisher.class);

    public static final String HEADER_TOPIC = "Event-Topic";
    public static final String HEADER_STATE = "Event-State";
    public static final String HEADER_ORIGIN = "Event-Origin";
    public static final String HEADER_RECIPIENT = "Event-Recipient";
    public static final String HEADER_GROUP = "Event-Group";
    public static final String HEADER_PUBLISHED_AT = "Event-Published-At";

    private final JetStream js;
    private final DomainEventCodec codec;
    private final JetStreamClientProperties props;
    private final Clock clock;

    public JetStreamEventPublisher(JetStream js, DomainEventCodec codec, JetStreamClientProperties props, Clock clock) {
        this.js = js;
        this.codec = codec;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public Mono<Void> publish(String subject, DomainEvent event, String dedupKey) {
        return Mono.defer(() -> {
            byte[] body = codec.encodeBytes(event);
            String msgId = (dedupKey == null || dedupKey.isBlank()) ? contentHash(body) : dedupKey;

            Message message = NatsMessage.builder()
                    .subject(subject)
                    .headers(headersFor(event))
                    .data(body)
                    .build();
            PublishOptions opts = PublishOptions.builder()
                    .messageId(msgId)
                    .build();

            int attempts = Math.max(1, props.getPublishMaxAttempts());

            return Mono.fromCallable(() -> js.publish(message, opts))
                    .subscribeOn(Schedulers.boundedElastic())
                    .retryWhen(Retry.fixedDelay(attempts - 1, props.getPublishRetryDelay())
                            .filter(JetStreamEventPublisher::isTransient)
                            .doBeforeRetry(sig -> log.warn("Publish attempt {}/{} failed: subject={} msgId={} err={}",
                                    sig.totalRetries() + 1, attempts, subject, msgId, sig.failure().toString()))
                            .onRetryExhaustedThrow((spec, sig) -> new BusConnectionException(
                                    "Failed to publish to " + subject + " after " + attempts + " attempts",
                                    sig.failure())))
                    .doOnNext(ack -> logAck(subject, msgId, ack))
                    .then();
        });
    }

    private void logAck(String subject, String msgId, PublishAck ack) {
        if (ack.isDuplicate()) {
            log.warn("Duplicate publish ignored by server: subject={} msgId={} stream={} seq={}",
                    subject, msgId, ack.getStream(), ack.getSeqno());
        } else {
            log.debug("Published subject={} msgId={} stream={} seq={}",
                    subject, msgId, ack.getStream(), ack.getSeqno());
        }
    }

    private Headers headersFor(DomainEvent event) {
        Headers headers = new Headers()
                .put(HEADER_TOPIC, event.topic())
                .put(HEADER_ORIGIN, event.origin())
                .put(HEADER_RECIPIENT, event.recipientId())
                .put(HEADER_PUBLISHED_AT, clock.instant().toString());
        event.state().ifPresent(state -> headers.put(HEADER_STATE, state));
        if (event.groupId() != null) {
            headers.put(HEADER_GROUP, event.groupId());
        }
        return headers;
    }

    static boolean isTransient(Throwable t) {
        if (t instanceof AuthenticationException) {
            return false;
        }
        return t instanceof IOException || t instanceof TimeoutException;
    }

    static String contentHash(byte[] body) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(body));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
