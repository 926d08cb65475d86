package com.myorg.mbus.contracts.core.envelope;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.mbus.contracts.core.conventions.CoreHeaders;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeBuilderTest {

    @Test
    void buildGeneratesEventIdAndTimestampHeader() {
        Envelope env = Envelope.builder()
                .key("order-1")
                .payload("{\"a\":1}".getBytes(StandardCharsets.UTF_8))
                .timestamp(Instant.parse("2024-05-01T10:15:30.123Z"))
                .build();

        assertThat(env.eventId()).isNotBlank();
        assertThat(env.getHeaders().get(CoreHeaders.TIMESTAMP)).isEqualTo("2024-05-01T10:15:30Z");
        assertThat(env.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:15:30.123Z"));
    }

    @Test
    void existingEventIdIsNeverOverwritten() {
        Envelope env = Envelope.builder()
                .key("k")
                .eventId("E-42")
                .build();

        assertThat(env.eventId()).isEqualTo("E-42");
    }

    @Test
    void blankEventIdIsReplacedWithGeneratedOne() {
        Envelope env = Envelope.builder().eventId("  ").build();

        assertThat(env.eventId()).isNotBlank().isNotEqualTo("  ");
    }

    @Test
    void eachBuildGetsDistinctEventId() {
        Envelope a = Envelope.builder().key("k").build();
        Envelope b = Envelope.builder().key("k").build();

        assertThat(a.eventId()).isNotEqualTo(b.eventId());
    }

    @Test
    void wellKnownHeadersAreSet() {
        Envelope env = Envelope.builder()
                .key("booking-7")
                .eventType("booking.created")
                .correlationId("corr-1")
                .conversationId("conv-1")
                .schemaVersion("2")
                .source("bookings")
                .header("x-tenant", "t1")
                .build();

        assertThat(env.getHeaders()).containsAllEntriesOf(Map.of(
                CoreHeaders.EVENT_TYPE, "booking.created",
                CoreHeaders.CORRELATION_ID, "corr-1",
                CoreHeaders.CONVERSATION_ID, "conv-1",
                CoreHeaders.SCHEMA_VERSION, "2",
                CoreHeaders.SOURCE, "bookings",
                "x-tenant", "t1"));
        assertThat(env.eventType()).isEqualTo("booking.created");
        assertThat(env.correlationId()).isEqualTo("corr-1");
        assertThat(env.conversationId()).isEqualTo("conv-1");
    }

    @Test
    void valueIsSerializedAsJson() {
        Envelope env = Envelope.builder()
                .key("order-1")
                .value(Map.of("a", 1))
                .build();

        assertThat(new String(env.getPayload(), StandardCharsets.UTF_8)).isEqualTo("{\"a\":1}");
    }

    @Test
    void serializationFailureSurfacesAtBuild() {
        EnvelopeBuilder builder = Envelope.builder()
                .key("k")
                .value(new ObjectMapper(), new Unserializable());

        assertThatThrownBy(builder::build)
                .isInstanceOf(EnvelopeBuildException.class)
                .hasMessageContaining("payload serialization failed");
    }

    @Test
    void wrapFillsStandardMetadata() {
        Envelope env = EnvelopeBuilder.wrap(new ObjectMapper(), "bu-1", "business-unit.created", "corr-9", "business-units",
                Map.of("name", "Salon"));

        assertThat(env.getKey()).isEqualTo("bu-1");
        assertThat(env.eventType()).isEqualTo("business-unit.created");
        assertThat(env.correlationId()).isEqualTo("corr-9");
        assertThat(env.header(CoreHeaders.SOURCE)).contains("business-units");
        assertThat(env.hasPayload()).isTrue();
    }

    /** Jackson refuses beans without properties. */
    static class Unserializable {
        private final Object self = this;
    }
}
