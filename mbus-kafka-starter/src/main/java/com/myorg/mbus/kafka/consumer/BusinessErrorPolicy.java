package com.myorg.mbus.kafka.consumer;

public enum BusinessErrorPolicy {
    DEAD_LETTER,
    DROP
}
