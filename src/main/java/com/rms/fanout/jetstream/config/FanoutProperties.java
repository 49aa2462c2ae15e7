package com.rms.fanout.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Application-level configuration that captures:
 * <ul>
 *   <li><b>Node identity</b> (service name + nodeId), reported to the server as the connection name.</li>
 *   <li><b>NATS connection settings</b> (servers, auth, TLS, reconnect policy) used to establish the
 *       single client connection.</li>
 * </ul>
 *
 * <h2>Binding</h2>
 * Properties are bound from Spring Boot config using the prefix {@code fanout}, e.g.:
 * <pre>
 * fanout:
 *   serviceName: fanout
 *   nodeId: node01
 *   natsServers: [nats://localhost:4222]
 *   natsUser: ...
 *   natsPassword: ...
 *   natsToken: ...
 *   natsCreds: /path/to/user.creds
 *   natsTls: false
 *   natsReconnectWait: 2s
 *   natsMaxReconnects: -1
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>Secrets (password/token) should be sourced from environment variables rather than committed
 *       config files.</li>
 *   <li>{@code natsMaxReconnects = -1} keeps reconnecting forever; the connection only closes on
 *       shutdown or on an authorization failure.</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "fanout")
public class FanoutProperties {

    // ---------------------------------------------------------------------
    // Node identity
    // ---------------------------------------------------------------------

    /**
     * Logical service name, first part of the NATS connection name.
     *
     * <p><b>Default</b>: {@code fanout}</p>
     */
    private String serviceName = "fanout";

    /**
     * Unique node identifier within the deployment.
     *
     * <p>Tells the connections of different instances apart in the server's monitoring endpoints.</p>
     *
     * <p><b>Default</b>: {@code node01}</p>
     */
    private String nodeId = "node01";

    // ---------------------------------------------------------------------
    // NATS connectivity
    // ---------------------------------------------------------------------

    /**
     * NATS server URLs. {@code tls://} URLs negotiate TLS on their own.
     */
    private List<String> natsServers = new ArrayList<>(List.of("nats://localhost:4222"));

    /** Optional username for user/password authentication. */
    private String natsUser;

    /** Optional password; ignored unless {@link #natsUser} is set. */
    private String natsPassword;

    /** Optional token authentication. */
    private String natsToken;

    /** Optional path to a {@code .creds} file (JWT + NKey). */
    private String natsCreds;

    /** Forces TLS even for {@code nats://} URLs. */
    private boolean natsTls = false;

    /** Timeout of the initial connect. */
    private Duration natsConnectionTimeout = Duration.ofSeconds(5);

    /** Wait between reconnect attempts. */
    private Duration natsReconnectWait = Duration.ofSeconds(2);

    /** Reconnect attempts before the connection is closed; {@code -1} is unlimited. */
    private int natsMaxReconnects = -1;

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }

    public List<String> getNatsServers() {
        return natsServers;
    }

    public void setNatsServers(List<String> natsServers) {
        this.natsServers = natsServers;
    }

    public String getNatsUser() {
        return natsUser;
    }

    public void setNatsUser(String natsUser) {
        this.natsUser = natsUser;
    }

    public String getNatsPassword() {
        return natsPassword;
    }

    public void setNatsPassword(String natsPassword) {
        this.natsPassword = natsPassword;
    }

    public String getNatsToken() {
        return natsToken;
    }

    public void setNatsToken(String natsToken) {
        this.natsToken = natsToken;
    }

    public String getNatsCreds() {
        return natsCreds;
    }

    public void setNatsCreds(String natsCreds) {
        this.natsCreds = natsCreds;
    }

    public boolean isNatsTls() {
        return natsTls;
    }

    public void setNatsTls(boolean natsTls) {
        this.natsTls = natsTls;
    }

    public Duration getNatsConnectionTimeout() {
        return natsConnectionTimeout;
    }

    public void setNatsConnectionTimeout(Duration natsConnectionTimeout) {
        this.natsConnectionTimeout = natsConnectionTimeout;
    }

    public Duration getNatsReconnectWait() {
        return natsReconnectWait;
    }

    public void setNatsReconnectWait(Duration natsReconnectWait) {
        this.natsReconnectWait = natsReconnectWait;
    }

    public int getNatsMaxReconnects() {
        return natsMaxReconnects;
    }

    public void setNatsMaxReconnects(int natsMaxReconnects) {
        this.natsMaxReconnects = natsMaxReconnects;
    }
}
