package com.myorg.mbus.kafka.broker;

import org.apache.kafka.clients.producer.internals.BuiltInPartitioner;
import org.apache.kafka.common.utils.Utils;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyPartitionerTest {

    @Test
    void sameKeyAlwaysMapsToSamePartition() {
        int first = KeyPartitioner.partition("order-1", 12);
        for (int i = 0; i < 100; i++) {
            assertThat(KeyPartitioner.partition("order-1", 12)).isEqualTo(first);
        }
    }

    @Test
    void agreesWithKafkaDefaultKeyHash() {
        for (String key : new String[]{"a", "order-1", "user:42", "ü-key"}) {
            int expected = Utils.toPositive(Utils.murmur2(key.getBytes(StandardCharsets.UTF_8))) % 7;
            assertThat(KeyPartitioner.partition(key, 7)).isEqualTo(expected).isBetween(0, 6);
        }
    }

    @Test
    void agreesWithProducerBuiltInPartitioner() {
        for (String key : new String[]{"a", "order-1", "booking-7f3c", "user:42", "ü-key"}) {
            for (int partitions : new int[]{1, 3, 6, 50}) {
                assertThat(KeyPartitioner.partition(key, partitions))
                        .as("key=%s partitions=%d", key, partitions)
                        .isEqualTo(BuiltInPartitioner.partitionForKey(key.getBytes(StandardCharsets.UTF_8), partitions));
            }
        }
    }

    @Test
    void rejectsNonPositivePartitionCount() {
        assertThatThrownBy(() -> KeyPartitioner.partition("k", 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
