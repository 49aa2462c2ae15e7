package com.rms.fanout.jetstream.bootstrap;

import com.rms.fanout.jetstream.config.JetStreamBootstrapProperties;
import com.rms.fanout.jetstream.config.JetStreamStreamsProperties;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JetStreamBootstrapper")
class JetStreamBootstrapperTest {

    @Mock
    private JetStreamManagement jsm;

    @Mock
    private ApplicationEventPublisher events;

    private JetStreamStreamsProperties streams;
    private JetStreamBootstrapProperties bootstrap;
    private JetStreamBootstrapper bootstrapper;

    @BeforeEach
    void setUp() {
        streams = new JetStreamStreamsProperties();
        bootstrap = new JetStreamBootstrapProperties();
        bootstrapper = new JetStreamBootstrapper(jsm, streams, bootstrap, events);
    }

    private static JetStreamApiException notFound() {
        JetStreamApiException e = mock(JetStreamApiException.class);
        when(e.getApiErrorCode()).thenReturn(10059);
        return e;
    }

    @Test
    @DisplayName("creates missing streams and announces completion")
    void createsMissingStreams() throws Exception {
        // Given
        JetStreamApiException missing = notFound();
        when(jsm.getStreamInfo(anyString())).thenThrow(missing);

        // When
        bootstrapper.run(null);

        // Then
        ArgumentCaptor<StreamConfiguration> created = ArgumentCaptor.forClass(StreamConfiguration.class);
        verify(jsm, times(2)).addStream(created.capture());
        assertThat(created.getAllValues()).extracting(StreamConfiguration::getName)
                .containsExactly("agent_events", "agent_state_monitoring");
        assertThat(created.getAllValues().get(0).getSubjects()).containsExactly("agent.events.>");
        verify(events).publishEvent(any(JetStreamBootstrapCompleteEvent.class));
    }

    @Test
    @DisplayName("bootstraps only the selected stream keys")
    void selectedKeys() throws Exception {
        // Given
        bootstrap.setStreamKeys(List.of("events"));
        JetStreamApiException missing = notFound();
        when(jsm.getStreamInfo("agent_events")).thenThrow(missing);

        // When
        bootstrapper.run(null);

        // Then
        verify(jsm, times(1)).addStream(any(StreamConfiguration.class));
        verify(jsm, never()).getStreamInfo("agent_state_monitoring");
    }

    @Test
    @DisplayName("leaves a matching stream untouched")
    void matchingStream() throws Exception {
        // Given
        JetStreamStreamsProperties.StreamSpec spec = streams.getEvents();
        StreamInfo info = mock(StreamInfo.class);
        when(info.getConfiguration()).thenReturn(JetStreamBootstrapper.toStreamConfig(spec));
        when(jsm.getStreamInfo("agent_events")).thenReturn(info);

        // When
        JetStreamBootstrapper.Outcome outcome = bootstrapper.ensureStream(spec);

        // Then
        assertThat(outcome).isEqualTo(JetStreamBootstrapper.Outcome.MATCHED);
        verify(jsm, never()).addStream(any(StreamConfiguration.class));
    }

    @Test
    @DisplayName("only warns about drift by default")
    void warnsOnDrift() throws Exception {
        // Given
        JetStreamStreamsProperties.StreamSpec spec = streams.getEvents();
        StreamConfiguration drifted = StreamConfiguration.builder(JetStreamBootstrapper.toStreamConfig(spec))
                .replicas(3)
                .build();
        StreamInfo info = mock(StreamInfo.class);
        when(info.getConfiguration()).thenReturn(drifted);
        when(jsm.getStreamInfo("agent_events")).thenReturn(info);

        // When
        JetStreamBootstrapper.Outcome outcome = bootstrapper.ensureStream(spec);

        // Then
        assertThat(outcome).isEqualTo(JetStreamBootstrapper.Outcome.DRIFTED);
        assertThat(JetStreamBootstrapper.drift(JetStreamBootstrapper.toStreamConfig(spec), drifted))
                .singleElement().asString().startsWith("replicas");
        verify(jsm, never()).addStream(any(StreamConfiguration.class));
    }

    @Test
    @DisplayName("fails on drift when configured to")
    void failsOnDrift() throws Exception {
        // Given
        bootstrap.setFailOnMismatch(true);
        JetStreamStreamsProperties.StreamSpec spec = streams.getEvents();
        StreamConfiguration drifted = StreamConfiguration.builder()
                .name("agent_events")
                .subjects("agent.events.>")
                .retentionPolicy(RetentionPolicy.Limits)
                .storageType(StorageType.Memory)
                .maxAge(Duration.ofDays(1))
                .duplicateWindow(Duration.ofMinutes(2))
                .build();
        StreamInfo info = mock(StreamInfo.class);
        when(info.getConfiguration()).thenReturn(drifted);
        when(jsm.getStreamInfo("agent_events")).thenReturn(info);

        // When / Then
        assertThatThrownBy(() -> bootstrapper.ensureStream(spec))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("storageType");
        verify(jsm, never()).addStream(any(StreamConfiguration.class));
    }

    @Test
    @DisplayName("propagates API errors other than a missing stream")
    void propagatesOtherErrors() throws Exception {
        // Given
        JetStreamApiException denied = mock(JetStreamApiException.class);
        when(denied.getApiErrorCode()).thenReturn(10100);
        when(jsm.getStreamInfo("agent_events")).thenThrow(denied);

        // When / Then
        assertThatThrownBy(() -> bootstrapper.ensureStream(streams.getEvents()))
                .isSameAs(denied);
        verify(jsm, never()).addStream(any(StreamConfiguration.class));
    }

    @Test
    @DisplayName("rejects unsupported storage types")
    void invalidSpec() {
        JetStreamStreamsProperties.StreamSpec spec = streams.getEvents();
        spec.setStorageType("tape");

        assertThatThrownBy(() -> JetStreamBootstrapper.toStreamConfig(spec))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tape");
    }
}
