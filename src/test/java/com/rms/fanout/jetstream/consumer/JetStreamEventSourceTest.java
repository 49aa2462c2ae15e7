package com.rms.fanout.jetstream.consumer;

import com.rms.fanout.jetstream.config.JetStreamClientProperties;
import io.nats.client.AuthenticationException;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamStatusException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.impl.NatsJetStreamMetaData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JetStreamEventSource")
class JetStreamEventSourceTest {

    private static final PullSpec SPEC =
            new PullSpec("agent_events", "agent.events.>", Instant.parse("2024-05-01T10:00:00Z"));

    @Mock
    private JetStream js;

    @Mock
    private JetStreamSubscription subscription;

    private JetStreamEventSource source;

    @BeforeEach
    void setUp() {
        JetStreamClientProperties props = new JetStreamClientProperties();
        props.setFetchTimeout(Duration.ofMillis(10));
        props.setSubscribeRetryInterval(Duration.ofMillis(10));
        props.setSubscribeMaxBackoff(Duration.ofMillis(20));
        source = new JetStreamEventSource(js, props);
    }

    @Nested
    @DisplayName("Recoverable errors")
    class Recoverable {

        @Test
        @DisplayName("stream not found and I/O errors are retried")
        void retried() {
            JetStreamApiException notFound = mock(JetStreamApiException.class);
            when(notFound.getApiErrorCode()).thenReturn(JetStreamEventSource.JS_STREAM_NOT_FOUND_ERR);

            assertThat(JetStreamEventSource.isRecoverable(notFound)).isTrue();
            assertThat(JetStreamEventSource.isRecoverable(new IOException("reset"))).isTrue();
        }

        @Test
        @DisplayName("authentication, other API errors and unknown failures are fatal")
        void fatal() {
            JetStreamApiException denied = mock(JetStreamApiException.class);
            when(denied.getApiErrorCode()).thenReturn(10100);

            assertThat(JetStreamEventSource.isRecoverable(denied)).isFalse();
            assertThat(JetStreamEventSource.isRecoverable(new AuthenticationException("bad creds"))).isFalse();
            assertThat(JetStreamEventSource.isRecoverable(new IllegalStateException("closed"))).isFalse();
        }
    }

    @Test
    @DisplayName("emits fetched messages without acknowledging them")
    void emitsMessages() throws Exception {
        // Given
        Message message = mock(Message.class);
        when(js.subscribe(anyString(), any(PullSubscribeOptions.class))).thenReturn(subscription);
        when(subscription.fetch(anyInt(), any(Duration.class))).thenReturn(List.of(message), List.of());

        // When / Then
        StepVerifier.create(source.subscribe(SPEC, new ResumePoint(SPEC.startTime())).take(1))
                .expectNext(message)
                .verifyComplete();

        verify(message, times(0)).ack();
        verify(subscription, atLeastOnce()).unsubscribe();
    }

    @Test
    @DisplayName("keeps retrying while the stream is not provisioned yet")
    void retriesMissingStream() throws Exception {
        // Given
        JetStreamApiException notFound = mock(JetStreamApiException.class);
        when(notFound.getApiErrorCode()).thenReturn(JetStreamEventSource.JS_STREAM_NOT_FOUND_ERR);
        Message message = mock(Message.class);
        when(js.subscribe(anyString(), any(PullSubscribeOptions.class)))
                .thenThrow(notFound)
                .thenThrow(notFound)
                .thenReturn(subscription);
        when(subscription.fetch(anyInt(), any(Duration.class))).thenReturn(List.of(message), List.of());

        // When / Then
        StepVerifier.create(source.subscribe(SPEC, new ResumePoint(SPEC.startTime())).take(1))
                .expectNext(message)
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        verify(js, times(3)).subscribe(anyString(), any(PullSubscribeOptions.class));
    }

    @Test
    @DisplayName("after a failed resubscribe, retries from the oldest message that was never handled")
    void retryResumesAtUnhandledMessage() throws Exception {
        // Given
        Instant fetchedAt = SPEC.startTime().plusSeconds(10);
        Message unhandled = mock(Message.class);
        NatsJetStreamMetaData meta = mock(NatsJetStreamMetaData.class);
        when(unhandled.isJetStream()).thenReturn(true);
        when(unhandled.metaData()).thenReturn(meta);
        when(meta.streamSequence()).thenReturn(7L);
        when(meta.timestamp()).thenReturn(fetchedAt.atZone(ZoneOffset.UTC));
        JetStreamStatusException stalled = mock(JetStreamStatusException.class);
        JetStreamSubscription replacement = mock(JetStreamSubscription.class);
        when(js.subscribe(anyString(), any(PullSubscribeOptions.class)))
                .thenReturn(subscription)
                .thenThrow(new IOException("connection reset"))
                .thenReturn(replacement);
        when(subscription.fetch(anyInt(), any(Duration.class)))
                .thenReturn(List.of(unhandled))
                .thenThrow(stalled);
        when(replacement.fetch(anyInt(), any(Duration.class))).thenReturn(List.of(unhandled));
        ResumePoint resumePoint = new ResumePoint(SPEC.startTime());

        // When
        StepVerifier.create(source.subscribe(SPEC, resumePoint).take(2))
                .expectNext(unhandled, unhandled)
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        // Then
        ArgumentCaptor<PullSubscribeOptions> options = ArgumentCaptor.forClass(PullSubscribeOptions.class);
        verify(js, times(3)).subscribe(anyString(), options.capture());
        assertThat(options.getAllValues().get(2).getConsumerConfiguration().getStartTime().toInstant())
                .isEqualTo(fetchedAt);
    }

    @Test
    @DisplayName("terminates on failures it cannot recover from")
    void failsOnFatalError() throws Exception {
        // Given
        when(js.subscribe(anyString(), any(PullSubscribeOptions.class)))
                .thenThrow(new IllegalStateException("connection closed"));

        // When / Then
        StepVerifier.create(source.subscribe(SPEC, new ResumePoint(SPEC.startTime())))
                .expectError(IllegalStateException.class)
                .verify(Duration.ofSeconds(5));
    }
}
