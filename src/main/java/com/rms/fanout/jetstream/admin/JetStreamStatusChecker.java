package com.rms.fanout.jetstream.admin;

import com.rms.fanout.jetstream.config.NatsConnectionListener;
import io.nats.client.Connection;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.AccountStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cheap JetStream reachability check for the health endpoint.
 *
 * <p>Reads account statistics (one request/reply) and reports stream and consumer counts. Any failure is
 * reported as {@code working=false}, never thrown.</p>
 */
@Component
public class JetStreamStatusChecker {

    private static final Logger log = LoggerFactory.getLogger(JetStreamStatusChecker.class);

    private final Connection connection;
    private final JetStreamManagement jsm;
    private final NatsConnectionListener connectionListener;

    public JetStreamStatusChecker(Connection connection, JetStreamManagement jsm,
                                  NatsConnectionListener connectionListener) {
        this.connection = connection;
        this.jsm = jsm;
        this.connectionListener = connectionListener;
    }

    public JetStreamStatus check() {
        String connStatus = String.valueOf(connection.getStatus());
        try {
            AccountStatistics stats = jsm.getAccountStatistics();
            return new JetStreamStatus(true, connStatus, stats.getStreams(), stats.getConsumers(),
                    connectionListener.getDisconnects());
        } catch (Exception e) {
            log.warn("JetStream status check failed: {}", e.toString());
            return new JetStreamStatus(false, connStatus, 0, 0, connectionListener.getDisconnects());
        }
    }

    public record JetStreamStatus(boolean working, String connection, long streams, long consumers,
                                  long disconnects) {
    }
}
