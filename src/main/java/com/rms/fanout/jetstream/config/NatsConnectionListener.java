package com.rms.fanout.jetstream.config;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Consumer;
import io.nats.client.ErrorListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Logs NATS connection lifecycle and asynchronous errors.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Makes broker disconnects and reconnects visible as WARN/INFO lines.</li>
 *   <li>Keeps a disconnect counter and the last observed event for the health endpoint.</li>
 * </ul>
 *
 * <p>The jNATS client invokes these callbacks on its own threads; the listener only records state.</p>
 */
public class NatsConnectionListener implements ConnectionListener, ErrorListener {

    private static final Logger log = LoggerFactory.getLogger(NatsConnectionListener.class);

    private final AtomicLong disconnects = new AtomicLong();
    private final AtomicReference<Events> lastEvent = new AtomicReference<>();

    @Override
    public void connectionEvent(Connection conn, Events type) {
        lastEvent.set(type);
        switch (type) {
            case CONNECTED -> log.info("NATS connected: server={}", conn.getConnectedUrl());
            case RECONNECTED -> log.info("NATS reconnected: server={} after {} disconnects",
                    conn.getConnectedUrl(), disconnects.get());
            case DISCONNECTED -> log.warn("NATS disconnected (#{}).", disconnects.incrementAndGet());
            case CLOSED -> log.warn("NATS connection closed.");
            case LAME_DUCK -> log.warn("NATS server entered lame duck mode: server={}", conn.getConnectedUrl());
            default -> log.debug("NATS connection event: {}", type);
        }
    }

    @Override
    public void errorOccurred(Connection conn, String error) {
        log.error("NATS error: {}", error);
    }

    @Override
    public void exceptionOccurred(Connection conn, Exception exp) {
        log.error("NATS exception: {}", exp.toString(), exp);
    }

    @Override
    public void slowConsumerDetected(Connection conn, Consumer consumer) {
        log.warn("NATS slow consumer detected: pending={}", consumer.getPendingMessageCount());
    }

    public long getDisconnects() {
        return disconnects.get();
    }

    public Events getLastEvent() {
        return lastEvent.get();
    }
}
