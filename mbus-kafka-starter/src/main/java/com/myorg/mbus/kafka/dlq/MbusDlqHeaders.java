package com.myorg.mbus.kafka.dlq;

/** Headers added to a dead-lettered copy, on top of {@code original-topic}. */
public final class MbusDlqHeaders {
    private MbusDlqHeaders() {}

    public static final String ERROR = "dlq-error";
    public static final String TIMESTAMP = "dlq-timestamp";
    public static final String CONSUMER_GROUP = "dlq-consumer-group";

    public static final String REASON = "dlq-reason";
    public static final String EXCEPTION_CLASS = "dlq-exception-class";
}
