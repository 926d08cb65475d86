package com.myorg.mbus.contracts.core.envelope;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.mbus.contracts.core.conventions.CoreHeaders;
import com.myorg.mbus.contracts.core.exception.ErrorKind;
import com.myorg.mbus.contracts.core.exception.MbusNonRetryableException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeTest {

    @Test
    void retryCountDefaultsToZero() {
        Envelope env = Envelope.builder().key("k").build();

        assertThat(env.retryCount()).isZero();
    }

    @Test
    void retryCountIsDecimalTextBeyondNine() {
        Envelope env = Envelope.builder().key("k").header(CoreHeaders.RETRY_COUNT, "9").build();

        env.incrementRetryCount();
        env.incrementRetryCount();

        assertThat(env.getHeaders().get(CoreHeaders.RETRY_COUNT)).isEqualTo("11");
        assertThat(env.retryCount()).isEqualTo(11);
    }

    @Test
    void unparseableRetryCountReadsAsZero() {
        Envelope env = Envelope.builder().key("k").header(CoreHeaders.RETRY_COUNT, ":").build();

        assertThat(env.retryCount()).isZero();
        assertThat(env.incrementRetryCount()).isEqualTo(1);
    }

    @Test
    void copyHasIndependentHeaders() {
        Envelope env = Envelope.builder().key("k").header("a", "1").build();
        env.setTopic("orders");
        env.setPartition(3);
        env.setOffset(17L);

        Envelope copy = env.copy();
        copy.putHeader("a", "2");

        assertThat(env.header("a")).contains("1");
        assertThat(copy.header("a")).contains("2");
        assertThat(copy.getTopic()).isEqualTo("orders");
        assertThat(copy.getPartition()).isEqualTo(3);
        assertThat(copy.getOffset()).isEqualTo(17L);
    }

    @Test
    void nullHeadersBecomeEmptyMap() {
        Envelope env = new Envelope("k", new byte[]{1}, null);

        assertThat(env.getHeaders()).isEmpty();
        assertThat(env.header("missing")).isEmpty();
    }

    @Test
    void keyAndPayloadPresence() {
        assertThat(new Envelope("", new byte[]{1}, Map.of()).hasKey()).isFalse();
        assertThat(new Envelope("k", new byte[0], Map.of()).hasPayload()).isFalse();
        assertThat(new Envelope("k", null, Map.of()).hasPayload()).isFalse();
        assertThat(new Envelope("k", new byte[]{1}, Map.of()).hasPayload()).isTrue();
    }

    @Test
    void decodePayloadReadsJson() {
        Envelope env = new Envelope("k", "{\"name\":\"Salon\"}".getBytes(StandardCharsets.UTF_8), Map.of());

        Unit unit = env.decodePayload(new ObjectMapper(), Unit.class);

        assertThat(unit.name).isEqualTo("Salon");
    }

    @Test
    void decodeFailureIsPermanent() {
        Envelope env = new Envelope("k", "not-json".getBytes(StandardCharsets.UTF_8), Map.of());

        assertThatThrownBy(() -> env.decodePayload(new ObjectMapper(), Unit.class))
                .isInstanceOfSatisfying(MbusNonRetryableException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.PERMANENT);
                    assertThat(e.getReason()).isEqualTo("DESERIALIZATION");
                })
                .hasMessageContaining("deserialization failed");
    }

    static class Unit {
        public String name;
    }
}
