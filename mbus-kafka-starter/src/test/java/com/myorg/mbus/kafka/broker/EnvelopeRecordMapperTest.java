package com.myorg.mbus.kafka.broker;

import com.myorg.mbus.contracts.core.envelope.Envelope;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.record.RecordBatch;
import org.apache.kafka.common.record.TimestampType;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EnvelopeRecordMapperTest {

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void toRecordCarriesKeyPayloadHeadersAndTimestamp() {
        Map<String, String> headers = new HashMap<>();
        headers.put("event-id", "e-1");
        headers.put("retry-count", "12");
        Envelope env = new Envelope("k", utf8("{}"), headers);
        env.setTimestamp(Instant.ofEpochMilli(1_700_000_000_123L));

        ProducerRecord<String, byte[]> r = EnvelopeRecordMapper.toRecord("orders", 2, env);

        assertThat(r.topic()).isEqualTo("orders");
        assertThat(r.partition()).isEqualTo(2);
        assertThat(r.key()).isEqualTo("k");
        assertThat(r.timestamp()).isEqualTo(1_700_000_000_123L);
        assertThat(new String(r.headers().lastHeader("retry-count").value(), StandardCharsets.UTF_8)).isEqualTo("12");
        assertThat(r.headers().toArray()).hasSize(2);
    }

    @Test
    void toRecordLeavesPartitionAndTimestampToClientWhenUnset() {
        ProducerRecord<String, byte[]> r = EnvelopeRecordMapper.toRecord("orders", null, new Envelope("k", utf8("x"), null));

        assertThat(r.partition()).isNull();
        assertThat(r.timestamp()).isNull();
    }

    @Test
    void fromRecordKeepsLastDuplicateHeader() {
        RecordHeaders h = new RecordHeaders();
        h.add("correlation-id", utf8("first"));
        h.add("correlation-id", utf8("second"));
        h.add("empty", null);
        ConsumerRecord<String, byte[]> record = new ConsumerRecord<>("orders", 1, 99L, 1_700_000_000_000L,
                TimestampType.CREATE_TIME, 1, 2, "k", utf8("{}"), h, Optional.empty());

        Envelope env = EnvelopeRecordMapper.fromRecord(record);

        assertThat(env.correlationId()).isEqualTo("second");
        assertThat(env.getHeaders()).containsEntry("empty", "");
        assertThat(env.getTopic()).isEqualTo("orders");
        assertThat(env.getPartition()).isEqualTo(1);
        assertThat(env.getOffset()).isEqualTo(99L);
        assertThat(env.getTimestamp()).isEqualTo(Instant.ofEpochMilli(1_700_000_000_000L));
    }

    @Test
    void fromRecordWithoutTimestamp() {
        ConsumerRecord<String, byte[]> record = new ConsumerRecord<>("orders", 0, 0L, RecordBatch.NO_TIMESTAMP,
                TimestampType.NO_TIMESTAMP_TYPE, 1, 1, "k", utf8("x"), new RecordHeaders(), Optional.empty());

        assertThat(EnvelopeRecordMapper.fromRecord(record).getTimestamp()).isNull();
    }
}
