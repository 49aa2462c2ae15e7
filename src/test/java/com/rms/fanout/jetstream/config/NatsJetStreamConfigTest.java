package com.rms.fanout.jetstream.config;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Options;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@DisplayName("NatsJetStreamConfig")
class NatsJetStreamConfigTest {

    @Test
    @DisplayName("builds connection options from the fanout properties")
    void options() {
        // Given
        FanoutProperties props = new FanoutProperties();
        props.setServiceName("fanout");
        props.setNodeId("n1");
        props.setNatsServers(List.of("nats://a:4222", " ", "nats://b:4222"));
        props.setNatsReconnectWait(Duration.ofSeconds(3));
        props.setNatsMaxReconnects(7);

        // When
        Options options = NatsJetStreamConfig.connectionOptions(props, new NatsConnectionListener());

        // Then
        assertThat(options.getServers()).extracting(URI::getHost).containsExactly("a", "b");
        assertThat(options.getConnectionName()).isEqualTo("fanout-n1");
        assertThat(options.getReconnectWait()).isEqualTo(Duration.ofSeconds(3));
        assertThat(options.getMaxReconnect()).isEqualTo(7);
    }

    @Test
    @DisplayName("requires at least one server")
    void noServers() {
        FanoutProperties props = new FanoutProperties();
        props.setNatsServers(List.of(" "));

        assertThatThrownBy(() -> NatsJetStreamConfig.connectionOptions(props, new NatsConnectionListener()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("nats-servers");
    }

    @Test
    @DisplayName("applies one authentication mechanism, creds first")
    void authPrecedence() {
        FanoutProperties props = new FanoutProperties();
        assertThat(NatsJetStreamConfig.authMode(props)).isEqualTo("none");

        props.setNatsUser("svc");
        assertThat(NatsJetStreamConfig.authMode(props)).isEqualTo("user");

        props.setNatsToken("t0k3n");
        assertThat(NatsJetStreamConfig.authMode(props)).isEqualTo("token");

        props.setNatsCreds("/etc/nats/svc.creds");
        assertThat(NatsJetStreamConfig.authMode(props)).isEqualTo("creds");
    }

    @Test
    @DisplayName("connection listener counts disconnects and remembers the last event")
    void listenerCountsDisconnects() {
        NatsConnectionListener listener = new NatsConnectionListener();
        Connection conn = mock(Connection.class);

        listener.connectionEvent(conn, ConnectionListener.Events.DISCONNECTED);
        listener.connectionEvent(conn, ConnectionListener.Events.RECONNECTED);
        listener.connectionEvent(conn, ConnectionListener.Events.DISCONNECTED);

        assertThat(listener.getDisconnects()).isEqualTo(2);
        assertThat(listener.getLastEvent()).isEqualTo(ConnectionListener.Events.DISCONNECTED);
    }
}
