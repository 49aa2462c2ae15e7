package com.rms.fanout.jetstream.consumer;

import com.rms.fanout.jetstream.config.JetStreamClientProperties;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamStatusException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * A pull subscription that repairs itself when the server-side consumer stalls.
 *
 * <h2>Fetch semantics</h2>
 * <ul>
 *   <li>Each {@link #poll()} fetches up to {@code fetchBatchSize} messages, waiting at most
 *       {@code fetchTimeout}. An empty result is an ordinary quiet period.</li>
 *   <li>A {@link JetStreamStatusException} from fetch (missed heartbeats, consumer deleted or stalled)
 *       counts as a timeout error. A fetch that completes without one resets the count.</li>
 *   <li>Once {@code maxTimeoutErrors} consecutive errors were counted, the next one triggers exactly one
 *       unsubscribe + resubscribe, after which counting starts again.</li>
 * </ul>
 *
 * <h2>Replay</h2>
 * Consumers deliver {@link DeliverPolicy#ByStartTime} from the {@link ResumePoint}. Every fetched message
 * is recorded there as pending; a resubscription starts at the oldest message not yet settled by its
 * handler, so un-acked messages are delivered again.
 *
 * <h2>Threading</h2>
 * Not thread-safe; owned by a single pull loop. All calls block.
 */
public class ResilientPullSubscription implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilientPullSubscription.class);

    private final JetStream js;
    private final PullSpec spec;
    private final int batchSize;
    private final Duration fetchTimeout;
    private final int maxTimeoutErrors;

    /** Shared with the owning flux and the message handler. */
    private final ResumePoint resumePoint;

    private JetStreamSubscription sub;
    private int timeoutErrors;
    private int resubscriptions;

    public ResilientPullSubscription(JetStream js, PullSpec spec, JetStreamClientProperties props,
                                     ResumePoint resumePoint) {
        this.js = js;
        this.spec = spec;
        this.batchSize = props.getFetchBatchSize();
        this.fetchTimeout = props.getFetchTimeout();
        this.maxTimeoutErrors = props.getMaxTimeoutErrors();
        this.resumePoint = resumePoint;
    }

    /**
     * Fetches the next batch, subscribing first if needed.
     *
     * @return delivered messages, possibly empty
     * @throws IOException           subscribe failed on the connection
     * @throws JetStreamApiException subscribe rejected by the server (e.g. stream not found)
     */
    public List<Message> poll() throws IOException, JetStreamApiException {
        if (sub == null) {
            sub = subscribe();
        }
        try {
            List<Message> messages = sub.fetch(batchSize, fetchTimeout);
            timeoutErrors = 0;
            if (messages.isEmpty()) {
                log.trace("Fetch returned no messages: filter={}", spec.filterSubject());
            }
            messages.forEach(resumePoint::delivered);
            return messages;
        } catch (JetStreamStatusException e) {
            if (timeoutErrors >= maxTimeoutErrors) {
                log.warn("{} consecutive fetch errors on filter={}; resubscribing. err={}",
                        timeoutErrors + 1, spec.filterSubject(), e.getMessage());
                resubscribe();
                return List.of();
            }
            timeoutErrors++;
            log.warn("Fetch error {}/{} on filter={}: {}",
                    timeoutErrors, maxTimeoutErrors, spec.filterSubject(), e.getMessage());
            return List.of();
        }
    }

    /**
     * Drops the current subscription and creates a fresh consumer from the resume point.
     */
    void resubscribe() throws IOException, JetStreamApiException {
        unsubscribeQuietly();
        sub = subscribe();
        timeoutErrors = 0;
        resubscriptions++;
    }

    private JetStreamSubscription subscribe() throws IOException, JetStreamApiException {
        Instant start = resumePoint.current();
        ConsumerConfiguration cc = ConsumerConfiguration.builder()
                .deliverPolicy(DeliverPolicy.ByStartTime)
                .startTime(start.atZone(ZoneOffset.UTC))
                .ackPolicy(AckPolicy.Explicit)
                .filterSubject(spec.filterSubject())
                .build();

        PullSubscribeOptions pso = PullSubscribeOptions.builder()
                .stream(spec.stream())
                .configuration(cc)
                .build();

        JetStreamSubscription created = js.subscribe(spec.filterSubject(), pso);
        log.info("Subscribed: stream={} filter={} startTime={}", spec.stream(), spec.filterSubject(), start);
        return created;
    }

    private void unsubscribeQuietly() {
        if (sub == null) {
            return;
        }
        try {
            sub.unsubscribe();
        } catch (IllegalStateException e) {
            log.warn("Unsubscribe of a bad subscription ignored: filter={} err={}",
                    spec.filterSubject(), e.getMessage());
        } finally {
            sub = null;
        }
    }

    int timeoutErrors() {
        return timeoutErrors;
    }

    int resubscriptions() {
        return resubscriptions;
    }

    @Override
    public void close() {
        unsubscribeQuietly();
    }
}
