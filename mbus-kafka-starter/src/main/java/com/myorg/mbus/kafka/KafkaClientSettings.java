package com.myorg.mbus.kafka;

import com.myorg.mbus.kafka.broker.StartOffset;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.util.HashMap;
import java.util.Map;

/** Translates {@link MbusKafkaProperties} into Kafka client configuration maps. */
public final class KafkaClientSettings {
    private KafkaClientSettings() {}

    static final int DLQ_MAX_ATTEMPTS = 3;

    public static Map<String, Object> producer(MbusKafkaProperties props) {
        MbusKafkaProperties.Producer p = props.getProducer();
        Map<String, Object> c = base(props, p.getAcks(), p.getMaxAttempts());
        c.put(ProducerConfig.LINGER_MS_CONFIG, (int) p.getBatchTimeout().toMillis());
        return c;
    }

    /** Dead-letter writes always wait for all replicas. */
    public static Map<String, Object> deadLetterProducer(MbusKafkaProperties props) {
        return base(props, MbusKafkaProperties.Acks.ALL, DLQ_MAX_ATTEMPTS);
    }

    private static Map<String, Object> base(MbusKafkaProperties props, MbusKafkaProperties.Acks acks, int maxAttempts) {
        Map<String, Object> c = new HashMap<>();
        c.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, String.join(",", props.getBrokers()));
        c.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        c.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        c.put(ProducerConfig.ACKS_CONFIG, acks.code());
        c.put(ProducerConfig.RETRIES_CONFIG, Math.max(maxAttempts - 1, 0));
        // idempotence needs acks=all and at least one retry
        c.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, acks == MbusKafkaProperties.Acks.ALL && maxAttempts > 1);
        c.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, props.getProducer().getCompression().code());
        return c;
    }

    public static Map<String, Object> consumer(MbusKafkaProperties props, String groupId) {
        MbusKafkaProperties.Consumer k = props.getConsumer();
        Map<String, Object> c = new HashMap<>();
        c.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, String.join(",", props.getBrokers()));
        c.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        c.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        c.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        // offsets are committed by the consume loop after processing
        c.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        c.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, StartOffset.parse(k.getStartOffset()).autoOffsetReset());
        c.put(ConsumerConfig.FETCH_MIN_BYTES_CONFIG, k.getMinBytes());
        c.put(ConsumerConfig.FETCH_MAX_BYTES_CONFIG, k.getMaxBytes());
        c.put(ConsumerConfig.MAX_PARTITION_FETCH_BYTES_CONFIG, k.getMaxBytes());
        c.put(ConsumerConfig.FETCH_MAX_WAIT_MS_CONFIG, (int) k.getMaxWait().toMillis());
        c.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, (int) k.getHeartbeatInterval().toMillis());
        c.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, (int) k.getSessionTimeout().toMillis());
        c.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, (int) k.getRebalanceTimeout().toMillis());
        return c;
    }
}
