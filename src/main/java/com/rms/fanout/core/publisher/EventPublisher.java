package com.rms.fanout.core.publisher;

import com.rms.fanout.core.model.DomainEvent;
import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * EventPublisher
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Transport-facing contract for publishing {@link DomainEvent}s onto the
 * durable bus.
 *
 * The primary implementation targets NATS JetStream. Callers only see
 * completion or failure.
 *
 * FAILURE SEMANTICS
 * -----------------
 * - Mono completes:
 *     → the bus persisted the message (or recognised it as a duplicate)
 * - Mono errors with BusConnectionException:
 *     → transient failures outlasted the retry budget
 * - Mono errors otherwise:
 *     → non-retryable rejection (e.g. no stream bound to the subject)
 *
 * IDENTITY & DEDUPLICATION
 * -----------------------
 * Implementations MUST set a transport-level message id:
 *  - {@code dedupKey} when supplied
 *  - otherwise a hash of the serialized event
 *
 * THREAD SAFETY
 * -------------
 * Implementations are stateless singletons.
 */
public interface EventPublisher {

    /**
     * Publishes {@code event} on {@code subject}.
     *
     * @param subject  concrete subject (no wildcards)
     * @param event    event to publish
     * @param dedupKey explicit de-duplication id, or {@code null} to derive one from the content
     * @return Mono completing when the bus acknowledged the message
     */
    Mono<Void> publish(String subject, DomainEvent event, String dedupKey);
}
