package com.rms.fanout.ingest;

import com.rms.fanout.core.codec.DomainEventCodec;
import com.rms.fanout.core.codec.InvalidEventException;
import com.rms.fanout.core.lifecycle.FatalErrorHandler;
import com.rms.fanout.core.lifecycle.TaskSupervisor;
import com.rms.fanout.core.model.DomainEvent;
import com.rms.fanout.core.publisher.EventPublisher;
import com.rms.fanout.core.store.EpochNanos;
import com.rms.fanout.core.store.RecentEventStore;
import com.rms.fanout.core.store.RecipientKey;
import com.rms.fanout.core.subject.StateSubject;
import com.rms.fanout.jetstream.bootstrap.JetStreamBootstrapCompleteEvent;
import com.rms.fanout.jetstream.consumer.JetStreamEventSource;
import com.rms.fanout.jetstream.consumer.PullSpec;
import com.rms.fanout.jetstream.consumer.ResumePoint;
import io.nats.client.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges agent events from the bus into the recent-event store.
 *
 * <h2>Per message</h2>
 * <ol>
 *   <li>Parse into a {@link DomainEvent} (topic normalized).</li>
 *   <li>Stamp {@code timestamp_ns} from the clock.</li>
 *   <li>Append to the {@link RecentEventStore}; the store's notification wakes every cache instance.</li>
 *   <li>Optionally republish on the event's {@link StateSubject}.</li>
 *   <li>ACK, then settle the message on the {@link ResumePoint}.</li>
 * </ol>
 *
 * <h2>Delivery guarantees</h2>
 * <ul>
 *   <li>At-least-once: the ACK follows a successful append, so a crash in between redelivers the message
 *       and appends a harmless duplicate.</li>
 *   <li>Unparseable messages are logged and ACKed (poison-message protection).</li>
 *   <li>A failed append or republish leaves the message un-ACKed and unsettled. It is redelivered by the
 *       current consumer, or by a replacement consumer that resumes at it.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * Starts on application ready (or on bootstrap completion, whichever comes first). Recoverable bus errors
 * are retried by {@link JetStreamEventSource}; anything that terminates the pull loop is fatal.
 */
@Component
@ConditionalOnProperty(prefix = "fanout.ingestion", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AgentEventListener implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(AgentEventListener.class);

    static final String TASK_NAME = "agent-event-listener";

    private final JetStreamEventSource source;
    private final AgentEventParser parser;
    private final DomainEventCodec codec;
    private final RecentEventStore store;
    private final EventPublisher publisher;
    private final IngestionProperties props;
    private final FatalErrorHandler fatalErrorHandler;
    private final Clock clock;

    private final TaskSupervisor tasks = new TaskSupervisor("ingestion");
    private final AtomicBoolean started = new AtomicBoolean(false);

    public AgentEventListener(JetStreamEventSource source, AgentEventParser parser, DomainEventCodec codec,
                              RecentEventStore store, EventPublisher publisher, IngestionProperties props,
                              FatalErrorHandler fatalErrorHandler, Clock clock) {
        this.source = source;
        this.parser = parser;
        this.codec = codec;
        this.store = store;
        this.publisher = publisher;
        this.props = props;
        this.fatalErrorHandler = fatalErrorHandler;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        start();
    }

    @EventListener(JetStreamBootstrapCompleteEvent.class)
    public void onBootstrapComplete() {
        start();
    }

    /**
     * Idempotently launches the pull loop.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        PullSpec spec = new PullSpec(props.getStream(), props.getFilterSubject(),
                clock.instant().minus(props.getReplayWindow()));
        log.info("Starting ingestion: stream={} filter={} replayFrom={} republishState={}",
                spec.stream(), spec.filterSubject(), spec.startTime(), props.isRepublishState());

        ResumePoint resumePoint = new ResumePoint(spec.startTime());
        tasks.launch(TASK_NAME, source.subscribe(spec, resumePoint)
                .concatMap(msg -> handle(msg, resumePoint))
                .doOnError(err -> fatalErrorHandler.onFatalError("AgentEventListener", err)));
    }

    Mono<Void> handle(Message msg, ResumePoint resumePoint) {
        DomainEvent event;
        try {
            event = parser.parse(msg.getData());
        } catch (InvalidEventException e) {
            log.warn("Discarding unparseable message subject={}: {}", msg.getSubject(), e.getMessage());
            msg.ack();
            resumePoint.settled(msg);
            return Mono.empty();
        }

        long timestampNs = EpochNanos.of(clock.instant());
        RecipientKey key = RecipientKey.of(event);

        return store.append(key, codec.encode(event), timestampNs)
                .then(Mono.defer(() -> republish(event)))
                .then(Mono.fromRunnable(() -> {
                    msg.ack();
                    resumePoint.settled(msg);
                }))
                .doOnSuccess(v -> log.debug("Ingested recipient={} topic={} ts={}",
                        event.recipientId(), event.topic(), timestampNs))
                .onErrorResume(e -> {
                    log.warn("Ingestion failed for recipient={} topic={}; leaving message for redelivery: {}",
                            event.recipientId(), event.topic(), e.toString());
                    return Mono.empty();
                })
                .then();
    }

    private Mono<Void> republish(DomainEvent event) {
        if (!props.isRepublishState()) {
            return Mono.empty();
        }
        String subject = StateSubject.of(props.getStateSubjectPrefix(), event).toSubject();
        return publisher.publish(subject, event, null);
    }

    public boolean isAlive() {
        return tasks.isAlive(TASK_NAME);
    }

    @Override
    public void destroy() {
        tasks.cancelAll();
    }
}
