package com.myorg.mbus.kafka.dlq;

import com.myorg.mbus.contracts.core.context.BusContext;
import com.myorg.mbus.contracts.core.conventions.CoreHeaders;
import com.myorg.mbus.contracts.core.conventions.HeaderTimestamps;
import com.myorg.mbus.contracts.core.envelope.Envelope;
import com.myorg.mbus.kafka.broker.BrokerWriter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Annotates a failed envelope and writes it to a side topic. One router per producer or
 * consumer; the router owns its writer.
 */
@Slf4j
public class DeadLetterRouter implements AutoCloseable {

    static final int MAX_ERROR_LENGTH = 2000;

    private final BrokerWriter writer;
    private final String consumerGroup;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param consumerGroup group id stamped as {@code dlq-consumer-group}; null on the producer side
     */
    public DeadLetterRouter(BrokerWriter writer, String consumerGroup, Clock clock) {
        this.writer = writer;
        this.consumerGroup = consumerGroup;
        this.clock = clock;
    }

    public DeadLetterRouter(BrokerWriter writer, String consumerGroup) {
        this(writer, consumerGroup, Clock.systemUTC());
    }

    public String topic() {
        return writer.topic();
    }

    /**
     * Writes an annotated copy of {@code failed}; the argument itself is not modified.
     *
     * @return the copy that was written
     * @throws com.myorg.mbus.kafka.error.BrokerException if the dead-letter write fails
     */
    public Envelope route(BusContext ctx, Envelope failed, String originalTopic, Throwable error, DlqReason reason) {
        Envelope dead = annotate(failed, originalTopic, error, reason);
        writer.write(ctx, List.of(dead));
        log.debug("Dead-lettered eventId={} from={} to={} reason={}",
                dead.eventId(), originalTopic, writer.topic(), reason.code());
        return dead;
    }

    Envelope annotate(Envelope failed, String originalTopic, Throwable error, DlqReason reason) {
        Envelope dead = failed.copy();
        dead.putHeader(CoreHeaders.ORIGINAL_TOPIC, originalTopic);
        dead.putHeader(MbusDlqHeaders.ERROR, safeMsg(describe(error)));
        dead.putHeader(MbusDlqHeaders.TIMESTAMP, HeaderTimestamps.format(clock.instant()));
        dead.putHeader(MbusDlqHeaders.REASON, reason.code());
        if (error != null) {
            dead.putHeader(MbusDlqHeaders.EXCEPTION_CLASS, error.getClass().getName());
        }
        if (consumerGroup != null) {
            dead.putHeader(MbusDlqHeaders.CONSUMER_GROUP, consumerGroup);
        }
        return dead;
    }

    private static String describe(Throwable error) {
        if (error == null) return "";
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    private static String safeMsg(String msg) {
        if (msg.length() <= MAX_ERROR_LENGTH) return msg;
        return msg.substring(0, MAX_ERROR_LENGTH);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            writer.close();
        }
    }
}
