package com.rms.fanout.jetstream.config;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.Nats;
import io.nats.client.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.List;

/**
 * Bus connection and the JetStream APIs built on it.
 *
 * <h2>Authentication</h2>
 * At most one mechanism is applied, in this order of precedence: creds file, token, user/password.
 * Without any of them the connection is anonymous.
 *
 * <h2>Failure behavior</h2>
 * The initial connect is synchronous. When no server is reachable or authorization is rejected,
 * {@link #natsConnection} throws and the application context fails to start; after that, reconnects are
 * handled by the client according to {@code nats-reconnect-wait} and {@code nats-max-reconnects}.
 */
@Configuration
@EnableConfigurationProperties({
        FanoutProperties.class,
        JetStreamBootstrapProperties.class,
        JetStreamStreamsProperties.class,
        JetStreamClientProperties.class
})
public class NatsJetStreamConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsJetStreamConfig.class);

    @Bean
    public NatsConnectionListener natsConnectionListener() {
        return new NatsConnectionListener();
    }

    @Bean(destroyMethod = "close")
    public Connection natsConnection(FanoutProperties props, NatsConnectionListener listener)
            throws IOException, InterruptedException {
        Options options = connectionOptions(props, listener);
        Connection connection = Nats.connect(options);
        log.info("Connected to NATS servers={} name={} auth={} tls={}",
                props.getNatsServers(), options.getConnectionName(), authMode(props), props.isNatsTls());
        return connection;
    }

    @Bean
    public JetStream jetStream(Connection connection) throws IOException {
        return connection.jetStream();
    }

    @Bean
    public JetStreamManagement jetStreamManagement(Connection connection) throws IOException {
        return connection.jetStreamManagement();
    }

    static Options connectionOptions(FanoutProperties props, NatsConnectionListener listener) {
        List<String> servers = props.getNatsServers();
        if (servers == null || servers.stream().allMatch(s -> s == null || s.isBlank())) {
            throw new IllegalStateException("fanout.nats-servers must list at least one server");
        }

        Options.Builder builder = new Options.Builder()
                .servers(servers.stream().filter(s -> s != null && !s.isBlank()).map(String::trim).toArray(String[]::new))
                .connectionName(props.getServiceName() + "-" + props.getNodeId())
                .connectionTimeout(props.getNatsConnectionTimeout())
                .reconnectWait(props.getNatsReconnectWait())
                .maxReconnects(props.getNatsMaxReconnects())
                .connectionListener(listener)
                .errorListener(listener);

        if (props.isNatsTls()) {
            try {
                builder.secure();
            } catch (Exception e) {
                throw new IllegalStateException("Unable to set up TLS for NATS", e);
            }
        }

        switch (authMode(props)) {
            case "creds" -> builder.authHandler(Nats.credentials(props.getNatsCreds()));
            case "token" -> builder.token(props.getNatsToken().toCharArray());
            case "user" -> builder.userInfo(props.getNatsUser(),
                    props.getNatsPassword() == null ? "" : props.getNatsPassword());
            default -> { }
        }
        return builder.build();
    }

    static String authMode(FanoutProperties props) {
        if (hasText(props.getNatsCreds())) {
            return "creds";
        }
        if (hasText(props.getNatsToken())) {
            return "token";
        }
        if (hasText(props.getNatsUser())) {
            return "user";
        }
        return "none";
    }

    private static boolean hasText(String v) {
        return v != null && !v.isBlank();
    }
}
