package com.rms.fanout.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Switches for {@link com.rms.fanout.jetstream.bootstrap.JetStreamBootstrapper}.
 *
 * CONFIGURATION PREFIX -------------------- fanout.bootstrap.*
 */
@ConfigurationProperties(prefix = "fanout.bootstrap")
public class JetStreamBootstrapProperties {

	/** Provision streams on this instance. Off unless asked for. */
	private boolean enabled = false;

	/**
	 * Reaction to an existing stream that differs from its declaration: fail startup when true, warn when false.
	 * Existing streams are never altered either way.
	 */
	private boolean failOnMismatch = false;

	/** Logical keys ({@code events}, {@code state}) to provision; empty means every enabled stream. */
	private List<String> streamKeys = new ArrayList<>();

	public boolean isEnabled() { return enabled; }
	public void setEnabled(boolean enabled) { this.enabled = enabled; }

	public boolean isFailOnMismatch() { return failOnMismatch; }
	public void setFailOnMismatch(boolean failOnMismatch) { this.failOnMismatch = failOnMismatch; }

	public List<String> getStreamKeys() { return streamKeys; }
	public void setStreamKeys(List<String> streamKeys) {
		this.streamKeys = streamKeys == null ? new ArrayList<>() : streamKeys;
	}
}
