package com.rms.fanout.core.codec;

import com.rms.fanout.core.model.DomainEvent;
import com.rms.fanout.support.TestEvents;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DomainEventCodec")
class DomainEventCodecTest {

    private final DomainEventCodec codec = TestEvents.codec();

    @Test
    @DisplayName("writes the wire field names")
    void wireNames() {
        String json = codec.encode(TestEvents.event("W1", "proofs", "done", "t1"));

        assertThat(json)
                .contains("\"wallet_id\":\"W1\"")
                .contains("\"group_id\":null")
                .contains("\"topic\":\"proofs\"")
                .contains("\"origin\":\"tenant\"")
                .contains("\"state\":\"done\"");
    }

    @Test
    @DisplayName("accepts recipient_id as an alias and ignores unknown fields")
    void lenientInput() {
        String json = """
                {"recipient_id":"W2","group_id":"G1","topic":"credentials","origin":"governance",
                 "payload":{"state":"offer-sent"},"extra":42}
                """;

        DomainEvent event = codec.decode(json);

        assertThat(event.recipientId()).isEqualTo("W2");
        assertThat(event.groupId()).isEqualTo("G1");
        assertThat(event.state()).contains("offer-sent");
    }

    @Test
    @DisplayName("decodes bytes the same as text")
    void bytes() {
        DomainEvent event = TestEvents.event("W1", "proofs", "done", "t1");

        assertThat(codec.decode(codec.encodeBytes(event))).isEqualTo(event);
    }

    @Test
    @DisplayName("rejects malformed, empty and incomplete documents")
    void invalid() {
        assertThatThrownBy(() -> codec.decode("{not json")).isInstanceOf(InvalidEventException.class);
        assertThatThrownBy(() -> codec.decode("")).isInstanceOf(InvalidEventException.class);
        assertThatThrownBy(() -> codec.decode(new byte[0])).isInstanceOf(InvalidEventException.class);
        assertThatThrownBy(() -> codec.decode("{\"topic\":\"proofs\",\"origin\":\"tenant\",\"payload\":{}}"))
                .isInstanceOf(InvalidEventException.class);
        assertThatThrownBy(() -> codec.decode("[1,2]".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(InvalidEventException.class);
    }
}
