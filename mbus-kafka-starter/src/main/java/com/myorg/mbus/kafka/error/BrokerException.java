package com.myorg.mbus.kafka.error;

/** A write, fetch or commit against the broker failed. */
public class BrokerException extends RuntimeException {
    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
