package com.rms.fanout.jetstream.consumer;

import com.rms.fanout.jetstream.config.JetStreamClientProperties;
import io.nats.client.AuthenticationException;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.util.List;
import java.util.function.Function;

/**
 * Exposes a JetStream pull consumer as a cold {@link Flux} of messages.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Subscription happens on subscribe to the flux, never in a constructor.</li>
 *   <li>The pull loop runs on {@link Schedulers#boundedElastic()}; every fetch blocks for at most the
 *       configured fetch timeout, which keeps cancellation responsive.</li>
 *   <li>Stalled consumers are repaired inside {@link ResilientPullSubscription}.</li>
 *   <li>Messages are emitted unacknowledged. The caller acks after successful handling and then settles
 *       the message on the {@link ResumePoint}.</li>
 * </ul>
 *
 * <h2>Error handling policy</h2>
 * <ul>
 *   <li>Stream not found (provisioning window) and connection I/O errors are retried with exponential
 *       backoff, resuming from the oldest message not yet settled.</li>
 *   <li>Authentication failures, a closed connection and any other error are fatal: the flux terminates
 *       with the error and the owning component decides what to do.</li>
 * </ul>
 */
@Component
public class JetStreamEventSource {

    private static final Logger log = LoggerFactory.getLogger(JetStreamEventSource.class);

    /**
     * JetStream API error code for "stream not found".
     */
    static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final JetStream js;
    private final JetStreamClientProperties props;

    public JetStreamEventSource(JetStream js, JetStreamClientProperties props) {
        this.js = js;
        this.props = props;
    }

    /**
     * @param resumePoint start of delivery, initially {@link PullSpec#startTime()}; the caller settles each
     *                    message on it once handled
     */
    public Flux<Message> subscribe(PullSpec spec, ResumePoint resumePoint) {
        return Flux.defer(() -> Flux.using(
                        () -> new ResilientPullSubscription(js, spec, props, resumePoint),
                        sub -> Flux.<List<Message>>generate(sink -> {
                            try {
                                sink.next(sub.poll());
                            } catch (Exception e) {
                                sink.error(e);
                            }
                        }).concatMapIterable(Function.identity()),
                        ResilientPullSubscription::close)
                .subscribeOn(Schedulers.boundedElastic())
                .retryWhen(Retry.backoff(Long.MAX_VALUE, props.getSubscribeRetryInterval())
                        .maxBackoff(props.getSubscribeMaxBackoff())
                        .filter(JetStreamEventSource::isRecoverable)
                        .doBeforeRetry(sig -> log.warn(
                                "Pull loop failed; retrying. stream={} filter={} attempt={} err={}",
                                spec.stream(), spec.filterSubject(), sig.totalRetries() + 1,
                                sig.failure().toString()))));
    }

    static boolean isRecoverable(Throwable t) {
        if (t instanceof JetStreamApiException jse) {
            return jse.getApiErrorCode() == JS_STREAM_NOT_FOUND_ERR;
        }
        if (t instanceof AuthenticationException) {
            return false;
        }
        return t instanceof IOException;
    }
}
