package com.myorg.mbus.kafka.error;

import lombok.Getter;

@Getter
public class InvalidEnvelopeException extends RuntimeException {

    public enum Reason { EMPTY_KEY, EMPTY_PAYLOAD }

    private final Reason reason;

    public InvalidEnvelopeException(Reason reason) {
        super(reason == Reason.EMPTY_KEY ? "invalid message: key is required" : "invalid message: payload is required");
        this.reason = reason;
    }
}
