package com.myorg.mbus.kafka.broker;

import org.apache.kafka.common.utils.Utils;

import java.nio.charset.StandardCharsets;

/**
 * Key to partition mapping. Same function as the Kafka client's built-in partitioner for
 * keyed records, so explicit and implicit routing agree.
 */
public final class KeyPartitioner {
    private KeyPartitioner() {}

    public static int partition(String key, int partitionCount) {
        if (partitionCount <= 0) {
            throw new IllegalArgumentException("partitionCount must be positive, got: " + partitionCount);
        }
        byte[] bytes = key.getBytes(StandardCharsets.UTF_8);
        return Utils.toPositive(Utils.murmur2(bytes)) % partitionCount;
    }
}
