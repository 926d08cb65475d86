package com.myorg.mbus.contracts.core.exception;

public class MbusNonRetryableException extends MbusProcessingException {

    private final String reason;

    public MbusNonRetryableException(String message) {
        this("NON_RETRYABLE", message, null);
    }

    public MbusNonRetryableException(String reason, String message) {
        this(reason, message, null);
    }

    public MbusNonRetryableException(String reason, String message, Throwable cause) {
        super(ErrorKind.PERMANENT, message, cause);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public String getReason() {
        return reason;
    }
}
