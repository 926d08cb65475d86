package com.myorg.mbus.kafka.error;

public class InvalidBatchException extends RuntimeException {
    public InvalidBatchException(int submitted) {
        super("invalid batch: none of " + submitted + " message(s) had both key and payload");
    }
}
