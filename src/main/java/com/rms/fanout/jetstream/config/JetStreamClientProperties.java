package com.rms.fanout.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning of the JetStream publish and pull paths.
 *
 * <p>Configuration prefix: {@code fanout.jetstream.client}</p>
 */
@ConfigurationProperties(prefix = "fanout.jetstream.client")
public class JetStreamClientProperties {

    /** Messages requested per fetch. */
    private int fetchBatchSize = 5;

    /**
     * Max wait of a single fetch. Kept sub-second so shutdown and resubscription stay responsive.
     */
    private Duration fetchTimeout = Duration.ofMillis(500);

    /**
     * Consecutive fetch errors tolerated before the next one triggers unsubscribe + resubscribe.
     */
    private int maxTimeoutErrors = 3;

    /** Initial delay between failed subscribe attempts; doubles up to {@link #subscribeMaxBackoff}. */
    private Duration subscribeRetryInterval = Duration.ofSeconds(1);

    private Duration subscribeMaxBackoff = Duration.ofSeconds(16);

    /** Total publish attempts for transient connection errors. */
    private int publishMaxAttempts = 3;

    /** Fixed delay between publish attempts. */
    private Duration publishRetryDelay = Duration.ofSeconds(5);

    public int getFetchBatchSize() {
        return fetchBatchSize;
    }

    public void setFetchBatchSize(int fetchBatchSize) {
        this.fetchBatchSize = fetchBatchSize;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    public int getMaxTimeoutErrors() {
        return maxTimeoutErrors;
    }

    public void setMaxTimeoutErrors(int maxTimeoutErrors) {
        this.maxTimeoutErrors = maxTimeoutErrors;
    }

    public Duration getSubscribeRetryInterval() {
        return subscribeRetryInterval;
    }

    public void setSubscribeRetryInterval(Duration subscribeRetryInterval) {
        this.subscribeRetryInterval = subscribeRetryInterval;
    }

    public Duration getSubscribeMaxBackoff() {
        return subscribeMaxBackoff;
    }

    public void setSubscribeMaxBackoff(Duration subscribeMaxBackoff) {
        this.subscribeMaxBackoff = subscribeMaxBackoff;
    }

    public int getPublishMaxAttempts() {
        return publishMaxAttempts;
    }

    public void setPublishMaxAttempts(int publishMaxAttempts) {
        this.publishMaxAttempts = publishMaxAttempts;
    }

    public Duration getPublishRetryDelay() {
        return publishRetryDelay;
    }

    public void setPublishRetryDelay(Duration publishRetryDelay) {
        this.publishRetryDelay = publishRetryDelay;
    }
}
