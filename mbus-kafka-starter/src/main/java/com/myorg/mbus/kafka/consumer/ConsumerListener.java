package com.myorg.mbus.kafka.consumer;

import com.myorg.mbus.contracts.core.envelope.Envelope;
import com.myorg.mbus.kafka.dlq.DlqReason;

/**
 * Callbacks from the consume loop's failure path. Called on the loop thread; exceptions
 * thrown here are logged and ignored.
 */
public interface ConsumerListener {

    /** {@code attempt} is the retry-count value after the increment. */
    default void onRetry(Envelope envelope, int attempt, Throwable error) {}

    default void onDeadLettered(Envelope envelope, DlqReason reason, Throwable error) {}

    default void onDeadLetterFailed(Envelope envelope, Throwable error, Throwable dlqError) {}

    default void onDropped(Envelope envelope, Throwable error) {}

    default void onUnrouted(Envelope envelope, Throwable error) {}
}
