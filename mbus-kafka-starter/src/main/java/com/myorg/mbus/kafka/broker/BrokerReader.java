package com.myorg.mbus.kafka.broker;

import com.myorg.mbus.contracts.core.context.BusContext;
import org.apache.kafka.clients.consumer.ConsumerRecord;

/**
 * Pulls records for one consumer group. Confined to the thread running the consume loop,
 * except {@link #wakeup()}.
 */
public interface BrokerReader extends AutoCloseable {

    /**
     * Blocks until a record is available.
     *
     * @throws com.myorg.mbus.contracts.core.context.ContextDoneException when {@code ctx} finishes first
     * @throws com.myorg.mbus.kafka.error.BrokerException on a fetch failure
     */
    ConsumerRecord<String, byte[]> fetch(BusContext ctx);

    /** Marks the record consumed for the group. */
    void commit(ConsumerRecord<String, byte[]> record);

    /** Redeliver the record (and everything after it on its partition) on a later fetch. */
    void rewind(ConsumerRecord<String, byte[]> record);

    /** Interrupts a blocked fetch. Safe from any thread. */
    default void wakeup() {}

    @Override
    void close();
}
