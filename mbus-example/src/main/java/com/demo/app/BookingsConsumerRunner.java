package com.demo.app;

import com.myorg.mbus.contracts.core.context.BusContext;
import com.myorg.mbus.contracts.core.context.ContextDoneException;
import com.myorg.mbus.kafka.MbusClientFactory;
import com.myorg.mbus.kafka.consumer.MbusConsumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/** Runs the commands consumer on its own thread for the lifetime of the application. */
@Slf4j
@Component
public class BookingsConsumerRunner implements SmartLifecycle {

    private final MbusClientFactory factory;
    private final BookingCommandHandler handler;
    private final String topic;
    private final String groupId;

    private volatile MbusConsumer consumer;
    private volatile Thread thread;

    public BookingsConsumerRunner(MbusClientFactory factory,
                                  BookingCommandHandler handler,
                                  @Value("${bookings.topics.commands}") String topic,
                                  @Value("${bookings.consumer-group}") String groupId) {
        this.factory = factory;
        this.handler = handler;
        this.topic = topic;
        this.groupId = groupId;
    }

    @Override
    public void start() {
        MbusConsumer c = factory.consumer(topic, groupId, handler);
        consumer = c;
        thread = new Thread(() -> {
            try {
                c.start(BusContext.background());
            } catch (ContextDoneException e) {
                log.info("Consumer stopped: {}", e.getMessage());
            } catch (RuntimeException e) {
                log.error("Consumer loop failed topic={} group={}", topic, groupId, e);
            }
        }, "mbus-consumer-" + topic);
        thread.start();
    }

    @Override
    public void stop() {
        MbusConsumer c = consumer;
        if (c != null) {
            c.close();
        }
        Thread t = thread;
        if (t != null) {
            try {
                t.join(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        consumer = null;
        thread = null;
    }

    @Override
    public boolean isRunning() {
        return consumer != null;
    }
}
