package com.myorg.mbus.kafka.error;

/**
 * The broker write failed and so did the dead-letter copy. The cause is the dead-letter
 * failure; the original write failure is attached as suppressed.
 */
public class DeadLetterPublishException extends RuntimeException {

    private final Throwable original;

    public DeadLetterPublishException(Throwable dlqFailure, Throwable original) {
        super("failed to send to DLQ: " + dlqFailure.getMessage() + " (original error: " + original.getMessage() + ")",
                dlqFailure);
        this.original = original;
        addSuppressed(original);
    }

    public Throwable getOriginal() {
        return original;
    }
}
