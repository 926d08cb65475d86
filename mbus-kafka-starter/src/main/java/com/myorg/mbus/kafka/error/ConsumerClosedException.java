package com.myorg.mbus.kafka.error;

public class ConsumerClosedException extends RuntimeException {
    public ConsumerClosedException(String topic, String groupId) {
        super("consumer is closed: topic=" + topic + " group=" + groupId);
    }
}
