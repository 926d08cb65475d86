package com.myorg.mbus.kafka.broker;

import com.myorg.mbus.contracts.core.envelope.Envelope;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.record.RecordBatch;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public final class EnvelopeRecordMapper {
    private EnvelopeRecordMapper() {}

    public static ProducerRecord<String, byte[]> toRecord(String topic, Integer partition, Envelope env) {
        RecordHeaders headers = new RecordHeaders();
        env.getHeaders().forEach((k, v) -> {
            if (v != null) headers.add(k, v.getBytes(StandardCharsets.UTF_8));
        });
        Long ts = env.getTimestamp() == null ? null : env.getTimestamp().toEpochMilli();
        return new ProducerRecord<>(topic, partition, ts, env.getKey(), env.getPayload(), headers);
    }

    /** Duplicate header keys collapse to the last value. */
    public static Envelope fromRecord(ConsumerRecord<String, byte[]> record) {
        Map<String, String> headers = new HashMap<>();
        for (Header h : record.headers()) {
            headers.put(h.key(), h.value() == null ? "" : new String(h.value(), StandardCharsets.UTF_8));
        }
        Envelope env = new Envelope(record.key(), record.value(), headers);
        env.setTopic(record.topic());
        env.setPartition(record.partition());
        env.setOffset(record.offset());
        if (record.timestamp() != RecordBatch.NO_TIMESTAMP) {
            env.setTimestamp(Instant.ofEpochMilli(record.timestamp()));
        }
        return env;
    }
}
