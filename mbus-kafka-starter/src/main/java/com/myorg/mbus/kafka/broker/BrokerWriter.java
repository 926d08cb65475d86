package com.myorg.mbus.kafka.broker;

import com.myorg.mbus.contracts.core.context.BusContext;
import com.myorg.mbus.contracts.core.envelope.Envelope;

import java.util.List;

/** Writes envelopes to one topic. Thread-safe. */
public interface BrokerWriter extends AutoCloseable {

    String topic();

    /**
     * @throws com.myorg.mbus.kafka.error.BrokerException if the broker rejects or fails the write
     */
    void write(BusContext ctx, List<Envelope> envelopes);

    @Override
    void close();
}
