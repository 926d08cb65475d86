package com.myorg.mbus.kafka.pipeline;

/** Which client an interceptor is wrapped around. */
public enum Side {
    PRODUCER,
    CONSUMER
}
