package com.myorg.mbus.kafka.broker;

import com.myorg.mbus.contracts.core.context.BusContext;
import com.myorg.mbus.kafka.error.BrokerException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link BrokerReader} over a subscribed Kafka {@link Consumer}. Auto-commit is off; offsets
 * passed to {@link #commit} are flushed with {@code commitSync} every {@code commitInterval}
 * (every call when the interval is zero), on revocation and on close.
 */
@Slf4j
public class KafkaBrokerReader implements BrokerReader {

    private final Consumer<String, byte[]> consumer;
    private final String topic;
    private final StartOffset startOffset;
    private final Duration pollTimeout;
    private final Duration commitInterval;
    private final Clock clock;

    private final Deque<ConsumerRecord<String, byte[]>> buffer = new ArrayDeque<>();
    private final Map<TopicPartition, OffsetAndMetadata> pending = new HashMap<>();
    private final RebalanceListener rebalanceListener = new RebalanceListener();
    private Instant lastFlush;
    private boolean closed;

    public KafkaBrokerReader(Consumer<String, byte[]> consumer,
                             String topic,
                             StartOffset startOffset,
                             Duration pollTimeout,
                             Duration commitInterval,
                             Clock clock) {
        this.consumer = consumer;
        this.topic = topic;
        this.startOffset = startOffset;
        this.pollTimeout = pollTimeout;
        this.commitInterval = commitInterval;
        this.clock = clock;
        this.lastFlush = clock.instant();
        consumer.subscribe(List.of(topic), rebalanceListener);
    }

    public KafkaBrokerReader(Consumer<String, byte[]> consumer, String topic, StartOffset startOffset,
                             Duration pollTimeout, Duration commitInterval) {
        this(consumer, topic, startOffset, pollTimeout, commitInterval, Clock.systemUTC());
    }

    @Override
    public ConsumerRecord<String, byte[]> fetch(BusContext ctx) {
        while (true) {
            ctx.throwIfDone();
            ConsumerRecord<String, byte[]> next = buffer.pollFirst();
            if (next != null) return next;

            try {
                flushIfDue();
            } catch (BrokerException e) {
                log.warn("Deferred commit failed topic={} error={}", topic, e.getMessage());
            }

            ConsumerRecords<String, byte[]> polled;
            try {
                polled = consumer.poll(slice(ctx));
            } catch (WakeupException e) {
                continue;
            } catch (KafkaException e) {
                throw new BrokerException("fetch from topic " + topic + " failed: " + e.getMessage(), e);
            }
            for (ConsumerRecord<String, byte[]> r : polled) {
                buffer.addLast(r);
            }
        }
    }

    private Duration slice(BusContext ctx) {
        Optional<Duration> left = ctx.remaining();
        if (left.isPresent() && left.get().compareTo(pollTimeout) < 0) {
            return left.get();
        }
        return pollTimeout;
    }

    @Override
    public void commit(ConsumerRecord<String, byte[]> record) {
        pending.put(new TopicPartition(record.topic(), record.partition()), new OffsetAndMetadata(record.offset() + 1));
        flushIfDue();
    }

    @Override
    public void rewind(ConsumerRecord<String, byte[]> record) {
        TopicPartition tp = new TopicPartition(record.topic(), record.partition());
        buffer.removeIf(r -> r.partition() == record.partition() && r.topic().equals(record.topic()));
        try {
            consumer.seek(tp, record.offset());
        } catch (KafkaException | IllegalStateException e) {
            throw new BrokerException("rewind " + tp + " to offset " + record.offset() + " failed", e);
        }
    }

    @Override
    public void wakeup() {
        consumer.wakeup();
    }

    private void flushIfDue() {
        if (pending.isEmpty()) return;
        Instant now = clock.instant();
        if (!commitInterval.isZero() && Duration.between(lastFlush, now).compareTo(commitInterval) < 0) return;
        lastFlush = now;
        flush(new HashMap<>(pending));
    }

    private void flush(Map<TopicPartition, OffsetAndMetadata> offsets) {
        if (offsets.isEmpty()) return;
        offsets.keySet().forEach(pending::remove);
        try {
            try {
                consumer.commitSync(offsets);
            } catch (WakeupException e) {
                // a wakeup aimed at poll() can land here instead; the flag is cleared now
                consumer.commitSync(offsets);
            }
        } catch (KafkaException e) {
            throw new BrokerException("commit " + offsets + " failed: " + e.getMessage(), e);
        }
    }

    RebalanceListener rebalanceListener() {
        return rebalanceListener;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            flush(new HashMap<>(pending));
        } catch (BrokerException e) {
            log.warn("Final commit failed topic={} error={}", topic, e.getMessage());
        } finally {
            buffer.clear();
            consumer.close();
        }
    }

    class RebalanceListener implements ConsumerRebalanceListener {

        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            Map<TopicPartition, OffsetAndMetadata> revoked = new HashMap<>();
            for (TopicPartition tp : partitions) {
                OffsetAndMetadata o = pending.get(tp);
                if (o != null) revoked.put(tp, o);
            }
            dropBuffered(partitions);
            try {
                flush(revoked);
            } catch (BrokerException e) {
                log.warn("Commit on revoke failed topic={} partitions={} error={}", topic, partitions, e.getMessage());
            }
            log.info("Partitions revoked topic={} partitions={}", topic, partitions);
        }

        @Override
        public void onPartitionsLost(Collection<TopicPartition> partitions) {
            dropBuffered(partitions);
            partitions.forEach(pending::remove);
            log.warn("Partitions lost topic={} partitions={}", topic, partitions);
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            log.info("Partitions assigned topic={} partitions={}", topic, partitions);
            if (startOffset.kind() != StartOffset.Kind.EXPLICIT || partitions.isEmpty()) return;

            Map<TopicPartition, OffsetAndMetadata> committed = consumer.committed(new HashSet<>(partitions));
            for (TopicPartition tp : partitions) {
                if (committed == null || committed.get(tp) == null) {
                    log.info("No committed offset for {}; seeking to {}", tp, startOffset.offset());
                    consumer.seek(tp, startOffset.offset());
                }
            }
        }

        private void dropBuffered(Collection<TopicPartition> partitions) {
            buffer.removeIf(r -> partitions.contains(new TopicPartition(r.topic(), r.partition())));
        }
    }
}
