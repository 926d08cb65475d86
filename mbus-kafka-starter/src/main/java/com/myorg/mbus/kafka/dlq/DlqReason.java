package com.myorg.mbus.kafka.dlq;

// Value of the dlq-reason header.
public enum DlqReason {
    RETRY_EXHAUSTED("RETRY_EXHAUSTED"),
    NON_RETRYABLE("NON_RETRYABLE"),
    BUSINESS_REJECTED("BUSINESS_REJECTED"),
    PUBLISH_FAILED("PUBLISH_FAILED");

    private final String code;

    DlqReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
