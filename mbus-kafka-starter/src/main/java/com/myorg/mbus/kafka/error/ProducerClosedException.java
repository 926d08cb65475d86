package com.myorg.mbus.kafka.error;

public class ProducerClosedException extends RuntimeException {
    public ProducerClosedException(String topic) {
        super("producer is closed: topic=" + topic);
    }
}
