package com.rms.fanout.jetstream.publisher;

import com.rms.fanout.core.codec.DomainEventCodec;
import com.rms.fanout.core.model.DomainEvent;
import com.rms.fanout.jetstream.BusConnectionException;
import com.rms.fanout.jetstream.config.JetStreamClientProperties;
import com.rms.fanout.support.TestEvents;
import io.nats.client.AuthenticationException;
import io.nats.client.JetStream;
import io.nats.client.Message;
import io.nats.client.PublishOptions;
import io.nats.client.api.PublishAck;
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
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JetStreamEventPublisher")
class JetStreamEventPublisherTest {

    private static final String SUBJECT = "agent.state.G1.W1.proofs.done";

    @Mock
    private JetStream js;

    @Mock
    private PublishAck ack;

    private final DomainEventCodec codec = TestEvents.codec();
    private JetStreamEventPublisher publisher;

    @BeforeEach
    void setUp() {
        JetStreamClientProperties props = new JetStreamClientProperties();
        props.setPublishMaxAttempts(3);
        props.setPublishRetryDelay(Duration.ofMillis(5));
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        publisher = new JetStreamEventPublisher(js, codec, props, clock);
    }

    private static DomainEvent event() {
        return new DomainEvent("W1", "G1", "proofs", "tenant", Map.of("state", "done"));
    }

    @Nested
    @DisplayName("Message layout")
    class Layout {

        @Test
        @DisplayName("sends the JSON body with descriptive headers")
        void headersAndBody() throws Exception {
            // Given
            when(js.publish(any(Message.class), any(PublishOptions.class))).thenReturn(ack);

            // When
            StepVerifier.create(publisher.publish(SUBJECT, event(), "key-1")).verifyComplete();

            // Then
            ArgumentCaptor<Message> message = ArgumentCaptor.forClass(Message.class);
            verify(js).publish(message.capture(), any(PublishOptions.class));
            Message sent = message.getValue();
            assertThat(sent.getSubject()).isEqualTo(SUBJECT);
            assertThat(codec.decode(sent.getData())).isEqualTo(event());
            assertThat(sent.getHeaders().getFirst(JetStreamEventPublisher.HEADER_TOPIC)).isEqualTo("proofs");
            assertThat(sent.getHeaders().getFirst(JetStreamEventPublisher.HEADER_STATE)).isEqualTo("done");
            assertThat(sent.getHeaders().getFirst(JetStreamEventPublisher.HEADER_RECIPIENT)).isEqualTo("W1");
            assertThat(sent.getHeaders().getFirst(JetStreamEventPublisher.HEADER_GROUP)).isEqualTo("G1");
            assertThat(sent.getHeaders().getFirst(JetStreamEventPublisher.HEADER_PUBLISHED_AT))
                    .isEqualTo("2024-05-01T10:00:00Z");
        }

        @Test
        @DisplayName("uses the explicit de-duplication key as message id")
        void explicitMessageId() throws Exception {
            // Given
            when(js.publish(any(Message.class), any(PublishOptions.class))).thenReturn(ack);

            // When
            StepVerifier.create(publisher.publish(SUBJECT, event(), "key-1")).verifyComplete();

            // Then
            ArgumentCaptor<PublishOptions> options = ArgumentCaptor.forClass(PublishOptions.class);
            verify(js).publish(any(Message.class), options.capture());
            assertThat(options.getValue().getMessageId()).isEqualTo("key-1");
        }

        @Test
        @DisplayName("derives a stable message id from the content when no key is given")
        void contentMessageId() throws Exception {
            // Given
            when(js.publish(any(Message.class), any(PublishOptions.class))).thenReturn(ack);

            // When
            StepVerifier.create(publisher.publish(SUBJECT, event(), null)).verifyComplete();
            StepVerifier.create(publisher.publish(SUBJECT, event(), " ")).verifyComplete();

            // Then
            ArgumentCaptor<PublishOptions> options = ArgumentCaptor.forClass(PublishOptions.class);
            verify(js, times(2)).publish(any(Message.class), options.capture());
            String expected = JetStreamEventPublisher.contentHash(codec.encodeBytes(event()));
            assertThat(options.getAllValues()).extracting(PublishOptions::getMessageId)
                    .containsExactly(expected, expected);
            assertThat(expected).hasSize(64);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("retries I/O errors and gives up with a bus connection error")
        void retriesThenFails() throws Exception {
            // Given
            when(js.publish(any(Message.class), any(PublishOptions.class))).thenThrow(new IOException("down"));

            // When / Then
            StepVerifier.create(publisher.publish(SUBJECT, event(), "key-1"))
                    .expectErrorSatisfies(err -> assertThat(err)
                            .isInstanceOf(BusConnectionException.class)
                            .hasRootCauseMessage("down"))
                    .verify(Duration.ofSeconds(5));
            verify(js, times(3)).publish(any(Message.class), any(PublishOptions.class));
        }

        @Test
        @DisplayName("recovers when a retry succeeds")
        void recovers() throws Exception {
            // Given
            when(js.publish(any(Message.class), any(PublishOptions.class)))
                    .thenThrow(new IOException("blip"))
                    .thenReturn(ack);

            // When / Then
            StepVerifier.create(publisher.publish(SUBJECT, event(), "key-1"))
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));
            verify(js, times(2)).publish(any(Message.class), any(PublishOptions.class));
        }

        @Test
        @DisplayName("does not retry authentication failures")
        void authenticationNotRetried() throws Exception {
            // Given
            when(js.publish(any(Message.class), any(PublishOptions.class)))
                    .thenThrow(new AuthenticationException("bad creds"));

            // When / Then
            StepVerifier.create(publisher.publish(SUBJECT, event(), "key-1"))
                    .expectError(AuthenticationException.class)
                    .verify(Duration.ofSeconds(5));
            verify(js, times(1)).publish(any(Message.class), any(PublishOptions.class));
        }

        @Test
        @DisplayName("treats a duplicate acknowledgment as success")
        void duplicateAck() throws Exception {
            // Given
            when(ack.isDuplicate()).thenReturn(true);
            when(js.publish(any(Message.class), any(PublishOptions.class))).thenReturn(ack);

            // When / Then
            StepVerifier.create(publisher.publish(SUBJECT, event(), "key-1")).verifyComplete();
        }
    }
}
