package com.rms.fanout.subscription;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Defaults of the subscription API.
 *
 * <p>Configuration prefix: {@code fanout.subscription}</p>
 */
@ConfigurationProperties(prefix = "fanout.subscription")
public class SubscriptionProperties {

    /** Lookback when the caller does not pass one. */
    private Duration defaultLookback = Duration.ofSeconds(60);

    /** Deadline of filtered subscriptions. */
    private Duration defaultTimeout = Duration.ofSeconds(30);

    /**
     * Membership checks before a group-scoped subscription is refused. The grace period covers clients
     * that connect before the recipient's first event was stored.
     */
    private int groupCheckAttempts = 10;

    private Duration groupCheckDelay = Duration.ofMillis(100);

    public Duration getDefaultLookback() {
        return defaultLookback;
    }

    public void setDefaultLookback(Duration defaultLookback) {
        this.defaultLookback = defaultLookback;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public int getGroupCheckAttempts() {
        return groupCheckAttempts;
    }

    public void setGroupCheckAttempts(int groupCheckAttempts) {
        this.groupCheckAttempts = groupCheckAttempts;
    }

    public Duration getGroupCheckDelay() {
        return groupCheckDelay;
    }

    public void setGroupCheckDelay(Duration groupCheckDelay) {
        this.groupCheckDelay = groupCheckDelay;
    }
}
