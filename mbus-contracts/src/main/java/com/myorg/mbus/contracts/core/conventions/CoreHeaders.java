package com.myorg.mbus.contracts.core.conventions;

/**
 * Header keys carried on every message. Downstream services read these from the wire,
 * so the values must not change.
 */
public final class CoreHeaders {
    private CoreHeaders() {}

    public static final String EVENT_ID = "event-id";
    public static final String EVENT_TYPE = "event-type";
    public static final String CORRELATION_ID = "correlation-id";
    public static final String CONVERSATION_ID = "conversation-id";
    public static final String SCHEMA_VERSION = "schema-version";
    public static final String SOURCE = "source";
    public static final String TIMESTAMP = "timestamp";
    public static final String RETRY_COUNT = "retry-count";
    public static final String ORIGINAL_TOPIC = "original-topic";
}
