package com.rms.fanout.cache;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tuning of the in-process event cache.
 *
 * <p>Configuration prefix: {@code fanout.cache}</p>
 */
@Validated
@ConfigurationProperties(prefix = "fanout.cache")
public class EventCacheProperties {

	/**
	 * Capacity of each (recipient, topic) cache. The oldest event is evicted when full.
	 */
	@Min(1)
	private int maxQueueSize = 200;

	/**
	 * Backfill window, age limit of cached events and idle threshold of the sweep.
	 */
	private Duration maxEventAge = Duration.ofSeconds(60);

	/** Period of the idle sweep. */
	private Duration cleanupPeriod = Duration.ofSeconds(60);

	/** How often a subscription drains its cache entries. */
	private Duration clientPollPeriod = Duration.ofMillis(200);

	/**
	 * Events remembered per subscription for de-duplication. Must cover at least one full cache entry.
	 */
	@Min(1)
	private int dedupLogSize = 2_000;

	/**
	 * Consecutive failures of the notification subscription tolerated before the process is terminated.
	 */
	private int notificationMaxRetries = 5;

	private Duration notificationRetryDelay = Duration.ofMillis(330);

	public int getMaxQueueSize() {
		return maxQueueSize;
	}

	public void setMaxQueueSize(int maxQueueSize) {
		this.maxQueueSize = maxQueueSize;
	}

	public Duration getMaxEventAge() {
		return maxEventAge;
	}

	public void setMaxEventAge(Duration maxEventAge) {
		this.maxEventAge = maxEventAge;
	}

	public Duration getCleanupPeriod() {
		return cleanupPeriod;
	}

	public void setCleanupPeriod(Duration cleanupPeriod) {
		this.cleanupPeriod = cleanupPeriod;
	}

	public Duration getClientPollPeriod() {
		return clientPollPeriod;
	}

	public void setClientPollPeriod(Duration clientPollPeriod) {
		this.clientPollPeriod = clientPollPeriod;
	}

	public int getDedupLogSize() {
		return dedupLogSize;
	}

	public void setDedupLogSize(int dedupLogSize) {
		this.dedupLogSize = dedupLogSize;
	}

	public int getNotificationMaxRetries() {
		return notificationMaxRetries;
	}

	public void setNotificationMaxRetries(int notificationMaxRetries) {
		this.notificationMaxRetries = notificationMaxRetries;
	}

	public Duration getNotificationRetryDelay() {
		return notificationRetryDelay;
	}

	public void setNotificationRetryDelay(Duration notificationRetryDelay) {
		this.notificationRetryDelay = notificationRetryDelay;
	}

	@AssertTrue(message = "fanout.cache.dedup-log-size must be >= fanout.cache.max-queue-size")
	public boolean isDedupLogCoveringQueue() {
		return dedupLogSize >= maxQueueSize;
	}
}
