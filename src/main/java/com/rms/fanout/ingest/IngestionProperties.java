package com.rms.fanout.ingest;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration for the agent event ingestion listener.
 *
 * The listener:
 * - pulls agent events from the events stream, replaying {@code replayWindow} on start
 * - appends them to the recent-event store
 * - optionally republishes them on state-monitoring subjects
 * - ACKs only after both succeeded
 */
@ConfigurationProperties(prefix = "fanout.ingestion")
public class IngestionProperties {

    /** Enable/disable the listener. */
    private boolean enabled = true;

    /** Stream holding the raw agent events. */
    private String stream = "agent_events";

    /** Subject filter of the pull consumer. */
    private String filterSubject = "agent.events.>";

    /** How far back a starting listener replays; the longest tolerated downtime. */
    private Duration replayWindow = Duration.ofMinutes(5);

    /** Republish each ingested event on its state-monitoring subject. */
    private boolean republishState = true;

    /** First tokens of the state-monitoring subjects. */
    private String stateSubjectPrefix = "agent.state";

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getStream() { return stream; }
    public void setStream(String stream) { this.stream = stream; }

    public String getFilterSubject() { return filterSubject; }
    public void setFilterSubject(String filterSubject) { this.filterSubject = filterSubject; }

    public Duration getReplayWindow() { return replayWindow; }
    public void setReplayWindow(Duration replayWindow) { this.replayWindow = replayWindow; }

    public boolean isRepublishState() { return republishState; }
    public void setRepublishState(boolean republishState) { this.republishState = republishState; }

    public String getStateSubjectPrefix() { return stateSubjectPrefix; }
    public void setStateSubjectPrefix(String stateSubjectPrefix) { this.stateSubjectPrefix = stateSubjectPrefix; }
}
