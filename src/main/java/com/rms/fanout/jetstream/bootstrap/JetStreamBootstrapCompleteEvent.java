package com.rms.fanout.jetstream.bootstrap;

/**
 * =====================================================================
 * JetStreamBootstrapCompleteEvent
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Signals that the events and state streams have been created or
 * validated by {@link JetStreamBootstrapper}.
 *
 *   ┌─────────────────────┐
 *   │ JetStream Bootstrap │
 *   └──────────┬──────────┘
 *              │ publishes
 *              ▼
 *   ┌─────────────────────┐
 *   │ Ingestion Listener  │
 *   └─────────────────────┘
 *
 * USAGE CONTRACT
 * --------------
 * - The ingestion listener starts on this event OR on application ready,
 *   whichever comes first; bootstrapping is optional per instance
 * - Delivered synchronously on the bootstrap thread
 * - No payload (presence == readiness)
 */
public record JetStreamBootstrapCompleteEvent() {
}
