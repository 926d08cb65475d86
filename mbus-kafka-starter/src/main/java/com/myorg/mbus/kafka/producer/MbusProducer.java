package com.myorg.mbus.kafka.producer;

import com.myorg.mbus.contracts.core.context.BusContext;
import com.myorg.mbus.contracts.core.envelope.Envelope;
import com.myorg.mbus.contracts.core.exception.ErrorKind;
import com.myorg.mbus.contracts.core.exception.MbusProcessingException;
import com.myorg.mbus.contracts.core.handler.MessageHandler;
import com.myorg.mbus.kafka.broker.BrokerWriter;
import com.myorg.mbus.kafka.dlq.DeadLetterRouter;
import com.myorg.mbus.kafka.dlq.DlqReason;
import com.myorg.mbus.kafka.error.BrokerException;
import com.myorg.mbus.kafka.error.DeadLetterPublishException;
import com.myorg.mbus.kafka.error.InvalidBatchException;
import com.myorg.mbus.kafka.error.InvalidEnvelopeException;
import com.myorg.mbus.kafka.error.ProducerClosedException;
import com.myorg.mbus.kafka.pipeline.InterceptorChain;
import com.myorg.mbus.kafka.pipeline.MessageInterceptor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Publishes envelopes to a single topic.
 * <p>
 * Safe for concurrent use. {@link #close()} waits for in-flight publishes and any publish
 * after it fails with {@link ProducerClosedException} without touching the broker.
 */
@Slf4j
public class MbusProducer implements AutoCloseable {

    private final BrokerWriter writer;
    private final DeadLetterRouter deadLetters;
    private final List<MessageInterceptor> interceptors = new CopyOnWriteArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private boolean closed;

    /**
     * @param deadLetters router for failed writes, or null when no dead-letter topic is configured
     */
    public MbusProducer(BrokerWriter writer, DeadLetterRouter deadLetters) {
        this.writer = writer;
        this.deadLetters = deadLetters;
    }

    public String topic() {
        return writer.topic();
    }

    /** Registers an interceptor; the first one registered runs outermost. */
    public MbusProducer use(MessageInterceptor interceptor) {
        interceptors.add(interceptor);
        return this;
    }

    public MbusProducer useAll(Collection<? extends MessageInterceptor> all) {
        interceptors.addAll(all);
        return this;
    }

    /**
     * @throws ProducerClosedException after {@link #close()}
     * @throws InvalidEnvelopeException on an empty key or payload; the broker is not contacted
     * @throws BrokerException when the write fails (a dead-letter copy was attempted if configured)
     * @throws DeadLetterPublishException when both the write and the dead-letter copy failed
     */
    public void publish(BusContext ctx, Envelope envelope) {
        lock.readLock().lock();
        try {
            if (closed) {
                throw new ProducerClosedException(writer.topic());
            }
            validate(envelope);

            // interceptors see the target topic; the caller's envelope stays untouched
            Envelope outgoing = envelope.copy();
            outgoing.setTopic(writer.topic());

            MessageHandler chain = InterceptorChain.compose(List.copyOf(interceptors), this::publishInternal);
            try {
                chain.handle(ctx, outgoing);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new MbusProcessingException(ErrorKind.UNKNOWN, "publish to " + writer.topic() + " failed", e);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    private void publishInternal(BusContext ctx, Envelope envelope) {
        try {
            writer.write(ctx, List.of(envelope));
        } catch (BrokerException err) {
            if (deadLetters != null) {
                try {
                    deadLetters.route(ctx, envelope, writer.topic(), err, DlqReason.PUBLISH_FAILED);
                    log.error("Publish failed; copy sent to DLQ topic={} dlq={} eventId={} error={}",
                            writer.topic(), deadLetters.topic(), envelope.eventId(), err.getMessage());
                } catch (RuntimeException dlqErr) {
                    log.error("Publish failed and DLQ write failed topic={} eventId={} error={} dlqError={}",
                            writer.topic(), envelope.eventId(), err.getMessage(), dlqErr.getMessage());
                    throw new DeadLetterPublishException(dlqErr, err);
                }
            }
            throw err;
        }
    }

    /**
     * Writes the valid envelopes in one call. Invalid ones are dropped; interceptors and
     * dead-lettering do not apply to batches.
     *
     * @return number of envelopes written
     * @throws InvalidBatchException when no envelope in the batch is valid
     */
    public int publishBatch(BusContext ctx, List<Envelope> envelopes) {
        lock.readLock().lock();
        try {
            if (closed) {
                throw new ProducerClosedException(writer.topic());
            }
            List<Envelope> valid = new ArrayList<>(envelopes.size());
            for (Envelope env : envelopes) {
                if (env != null && env.hasKey() && env.hasPayload()) {
                    valid.add(env);
                } else {
                    log.debug("Dropping invalid envelope from batch topic={} eventId={}",
                            writer.topic(), env == null ? null : env.eventId());
                }
            }
            if (valid.isEmpty()) {
                throw new InvalidBatchException(envelopes.size());
            }
            writer.write(ctx, valid);
            return valid.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isClosed() {
        lock.readLock().lock();
        try {
            return closed;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Idempotent. Closes the writer, then the dead-letter router. */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (closed) return;
            closed = true;

            RuntimeException first = null;
            try {
                writer.close();
            } catch (RuntimeException e) {
                first = e;
            }
            if (deadLetters != null) {
                try {
                    deadLetters.close();
                } catch (RuntimeException e) {
                    if (first == null) first = e;
                    else first.addSuppressed(e);
                }
            }
            if (first != null) throw first;
            log.info("Producer closed topic={}", writer.topic());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void validate(Envelope envelope) {
        if (!envelope.hasKey()) {
            throw new InvalidEnvelopeException(InvalidEnvelopeException.Reason.EMPTY_KEY);
        }
        if (!envelope.hasPayload()) {
            throw new InvalidEnvelopeException(InvalidEnvelopeException.Reason.EMPTY_PAYLOAD);
        }
    }
}
