package com.myorg.mbus.kafka.consumer;

import com.myorg.mbus.contracts.core.context.BusContext;
import com.myorg.mbus.contracts.core.context.ContextDoneException;
import com.myorg.mbus.contracts.core.envelope.Envelope;
import com.myorg.mbus.contracts.core.exception.ErrorKind;
import com.myorg.mbus.contracts.core.handler.MessageHandler;
import com.myorg.mbus.kafka.broker.BrokerReader;
import com.myorg.mbus.kafka.broker.EnvelopeRecordMapper;
import com.myorg.mbus.kafka.dlq.DeadLetterRouter;
import com.myorg.mbus.kafka.dlq.DlqReason;
import com.myorg.mbus.kafka.error.ConsumerClosedException;
import com.myorg.mbus.kafka.error.RetryPolicy;
import com.myorg.mbus.kafka.pipeline.InterceptorChain;
import com.myorg.mbus.kafka.pipeline.MessageInterceptor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Fetch / process / commit loop for one topic and consumer group.
 * <p>
 * {@link #start} blocks the calling thread. Records are processed one at a time; a failing
 * handler is retried in place, so a slow or failing message holds back everything behind it.
 * Lifecycle: {@code IDLE -> RUNNING -> DRAINING -> CLOSED}.
 */
@Slf4j
public class MbusConsumer implements AutoCloseable {

    public enum State { IDLE, RUNNING, DRAINING, CLOSED }

    private final String topic;
    private final String groupId;
    private final BrokerReader reader;
    private final DeadLetterRouter deadLetters;
    private final MessageHandler handler;
    private final RetryPolicy retryPolicy;
    private final ConsumerOptions options;

    private final List<MessageInterceptor> interceptors = new CopyOnWriteArrayList<>();
    private final List<ConsumerListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lifecycleLock = new Object();
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicBoolean released = new AtomicBoolean(false);
    private final CountDownLatch exited = new CountDownLatch(1);
    private volatile BusContext loopCtx;
    private volatile Thread loopThread;
    private volatile boolean releaseOnExit;

    /**
     * @param deadLetters router for terminal failures, or null when no dead-letter topic is configured
     */
    public MbusConsumer(String topic,
                        String groupId,
                        BrokerReader reader,
                        DeadLetterRouter deadLetters,
                        MessageHandler handler,
                        RetryPolicy retryPolicy,
                        ConsumerOptions options) {
        this.topic = topic;
        this.groupId = groupId;
        this.reader = reader;
        this.deadLetters = deadLetters;
        this.handler = handler;
        this.retryPolicy = retryPolicy;
        this.options = options;
    }

    public String topic() { return topic; }

    public String groupId() { return groupId; }

    public State state() { return state.get(); }

    /** Registers an interceptor; the first one registered runs outermost. */
    public MbusConsumer use(MessageInterceptor interceptor) {
        interceptors.add(interceptor);
        return this;
    }

    public MbusConsumer useAll(Collection<? extends MessageInterceptor> all) {
        interceptors.addAll(all);
        return this;
    }

    public MbusConsumer addListener(ConsumerListener listener) {
        listeners.add(listener);
        return this;
    }

    /**
     * Runs the consume loop until {@code ctx} finishes or {@link #close()} is called.
     * Returns normally after {@code close()}.
     *
     * @throws ContextDoneException when {@code ctx} was cancelled or its deadline passed; the consumer is then closed
     * @throws ConsumerClosedException if the consumer was already closed
     * @throws IllegalStateException if another thread is already running the loop
     */
    public void start(BusContext ctx) {
        BusContext loop;
        synchronized (lifecycleLock) {
            State s = state.get();
            if (s == State.DRAINING || s == State.CLOSED) {
                throw new ConsumerClosedException(topic, groupId);
            }
            if (s != State.IDLE) {
                throw new IllegalStateException("consumer already running: topic=" + topic + " group=" + groupId);
            }
            loop = ctx.withCancel();
            loopCtx = loop;
            loopThread = Thread.currentThread();
            state.set(State.RUNNING);
        }

        log.info("Consumer started topic={} group={} maxRetries={} dlq={}",
                topic, groupId, options.maxRetries(), deadLetters == null ? "-" : deadLetters.topic());
        try {
            run(loop);
        } finally {
            loopThread = null;
            exited.countDown();
        }

        if (releaseOnExit) {
            finishClose();
            return;
        }
        if (ctx.isDone()) {
            synchronized (lifecycleLock) {
                if (state.get() != State.CLOSED) {
                    state.set(State.DRAINING);
                    finishClose();
                }
            }
            log.info("Consumer stopped by context topic={} group={} reason={}", topic, groupId, ctx.doneReason());
            throw new ContextDoneException(ctx.doneReason());
        }
    }

    private void run(BusContext loop) {
        while (!loop.isDone()) {
            ConsumerRecord<String, byte[]> record;
            try {
                record = reader.fetch(loop);
            } catch (ContextDoneException e) {
                return;
            } catch (RuntimeException e) {
                if (loop.isDone()) return;
                log.error("Fetch failed topic={} group={} error={}; retrying in {}",
                        topic, groupId, e.getMessage(), options.fetchErrorBackoff());
                loop.sleep(options.fetchErrorBackoff());
                continue;
            }

            Envelope env = EnvelopeRecordMapper.fromRecord(record);
            ProcessingOutcome outcome = process(loop, env);
            settle(loop, record, outcome);
        }
    }

    private void settle(BusContext loop, ConsumerRecord<String, byte[]> record, ProcessingOutcome outcome) {
        boolean hold = options.commitPolicy() == CommitPolicy.ON_TERMINAL_SUCCESS
                && outcome == ProcessingOutcome.DEAD_LETTER_FAILED;
        if (!hold) {
            try {
                reader.commit(record);
            } catch (RuntimeException e) {
                log.error("Commit failed topic={} partition={} offset={} error={}",
                        record.topic(), record.partition(), record.offset(), e.getMessage());
            }
            return;
        }

        try {
            reader.rewind(record);
            log.warn("Offset held after DLQ failure topic={} partition={} offset={}; redelivering in {}",
                    record.topic(), record.partition(), record.offset(), options.fetchErrorBackoff());
        } catch (RuntimeException e) {
            log.error("Rewind failed topic={} partition={} offset={} error={}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
        }
        loop.sleep(options.fetchErrorBackoff());
    }

    /**
     * Runs one envelope through the interceptors and handler, retrying transient failures in
     * place up to {@code maxRetries}, then dead-letters whatever is left. Never throws for a
     * handler failure.
     */
    public ProcessingOutcome process(BusContext ctx, Envelope env) {
        MessageHandler chain = InterceptorChain.compose(List.copyOf(interceptors), handler);
        while (true) {
            int retries = env.retryCount();
            Exception err;
            try {
                chain.handle(ctx, env);
                return ProcessingOutcome.SUCCEEDED;
            } catch (Exception e) {
                err = e;
            }

            if (retryPolicy.shouldRetry(err, retries, options.maxRetries())) {
                int attempt = env.incrementRetryCount();
                log.warn("Retrying message topic={} eventId={} attempt={}/{} error={}",
                        topic, env.eventId(), attempt, options.maxRetries(), err.getMessage());
                Exception failure = err;
                notifyListeners(l -> l.onRetry(env, attempt, failure));
                continue;
            }
            return terminal(ctx, env, err, retries);
        }
    }

    private ProcessingOutcome terminal(BusContext ctx, Envelope env, Exception err, int retries) {
        ErrorKind kind = retryPolicy.getClassifier().classify(err);

        if (kind == ErrorKind.BUSINESS && options.businessErrorPolicy() == BusinessErrorPolicy.DROP) {
            log.warn("Dropping business-rejected message topic={} eventId={} error={}",
                    topic, env.eventId(), err.getMessage());
            notifyListeners(l -> l.onDropped(env, err));
            return ProcessingOutcome.DROPPED;
        }

        if (deadLetters == null) {
            log.error("Message failed with no DLQ configured topic={} partition={} offset={} eventId={} kind={} error={}",
                    topic, env.getPartition(), env.getOffset(), env.eventId(), kind, err.getMessage());
            notifyListeners(l -> l.onUnrouted(env, err));
            return ProcessingOutcome.UNROUTED;
        }

        DlqReason reason = switch (kind) {
            case TRANSIENT -> DlqReason.RETRY_EXHAUSTED;
            case BUSINESS -> DlqReason.BUSINESS_REJECTED;
            default -> DlqReason.NON_RETRYABLE;
        };
        try {
            deadLetters.route(ctx, env, topic, err, reason);
            log.error("Message sent to DLQ after {} retries topic={} dlq={} eventId={} reason={} error={}",
                    retries, topic, deadLetters.topic(), env.eventId(), reason.code(), err.getMessage());
            notifyListeners(l -> l.onDeadLettered(env, reason, err));
            return ProcessingOutcome.DEAD_LETTERED;
        } catch (RuntimeException dlqErr) {
            log.error("Failed to send message to DLQ topic={} dlq={} eventId={} error={} (original error: {})",
                    topic, deadLetters.topic(), env.eventId(), dlqErr.getMessage(), err.getMessage());
            notifyListeners(l -> l.onDeadLetterFailed(env, err, dlqErr));
            return ProcessingOutcome.DEAD_LETTER_FAILED;
        }
    }

    private void notifyListeners(Consumer<ConsumerListener> call) {
        for (ConsumerListener l : listeners) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                log.warn("Consumer listener {} failed: {}", l.getClass().getName(), e.toString());
            }
        }
    }

    /**
     * Stops the loop, waits for the record in flight to settle, then closes the reader and
     * the dead-letter router. Idempotent. Called from a handler, it only requests the stop and
     * the loop thread releases the resources on its way out.
     */
    @Override
    public void close() {
        boolean wait;
        synchronized (lifecycleLock) {
            State prev = state.get();
            if (prev == State.CLOSED || prev == State.DRAINING) return;
            state.set(State.DRAINING);
            wait = prev == State.RUNNING;
            BusContext loop = loopCtx;
            if (loop != null) loop.cancel();
            if (wait && Thread.currentThread() == loopThread) {
                releaseOnExit = true;
                return;
            }
        }

        if (wait) {
            reader.wakeup();
            try {
                exited.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for consumer loop to exit topic={} group={}", topic, groupId);
            }
        }
        finishClose();
    }

    private void finishClose() {
        if (!released.compareAndSet(false, true)) return;
        RuntimeException first = null;
        try {
            reader.close();
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
        state.set(State.CLOSED);
        log.info("Consumer closed topic={} group={}", topic, groupId);
        if (first != null) throw first;
    }
}
