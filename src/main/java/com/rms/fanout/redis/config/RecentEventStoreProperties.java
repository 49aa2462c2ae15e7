package com.rms.fanout.redis.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Layout of the recent-event store in Redis. Connection settings stay under Spring Boot's own
 * {@code spring.data.redis.*}.
 *
 * <p>Configuration prefix: {@code fanout.store}</p>
 */
@ConfigurationProperties(prefix = "fanout.store")
public class RecentEventStoreProperties {

    /** First segment of every sorted-set key; also the SCAN pattern used for backfill. */
    private String keyPrefix = "fanout";

    /** Pub/sub channel carrying append notifications. */
    private String notificationChannel = "new_sse_event";

    /** COUNT hint for SCAN during backfill. */
    private long scanCount = 10_000;

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String getNotificationChannel() {
        return notificationChannel;
    }

    public void setNotificationChannel(String notificationChannel) {
        this.notificationChannel = notificationChannel;
    }

    public long getScanCount() {
        return scanCount;
    }

    public void setScanCount(long scanCount) {
        this.scanCount = scanCount;
    }
}
