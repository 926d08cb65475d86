package com.myorg.mbus.observability;

import com.myorg.mbus.contracts.core.envelope.Envelope;
import com.myorg.mbus.kafka.consumer.ConsumerListener;
import com.myorg.mbus.kafka.dlq.DlqReason;
import lombok.RequiredArgsConstructor;

/** Counts the consume loop's retry and dead-letter decisions. */
@RequiredArgsConstructor
public class MetricsConsumerListener implements ConsumerListener {

    private final MbusMetrics metrics;

    @Override
    public void onRetry(Envelope envelope, int attempt, Throwable error) {
        metrics.incRetry();
    }

    @Override
    public void onDeadLettered(Envelope envelope, DlqReason reason, Throwable error) {
        metrics.incDlq();
    }

    @Override
    public void onDeadLetterFailed(Envelope envelope, Throwable error, Throwable dlqError) {
        metrics.incDlqFailed();
    }

    @Override
    public void onDropped(Envelope envelope, Throwable error) {
        metrics.incDropped();
    }

    @Override
    public void onUnrouted(Envelope envelope, Throwable error) {
        metrics.incUnrouted();
    }
}
