package com.myorg.mbus.kafka.broker;

import com.myorg.mbus.contracts.core.context.BusContext;
import com.myorg.mbus.contracts.core.envelope.Envelope;
import com.myorg.mbus.kafka.error.BrokerException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link BrokerWriter} over a {@link KafkaTemplate}. Records are routed by key hash.
 * In sync mode {@link #write} returns once every record is acknowledged; in async mode it
 * returns after the records are handed to the client and failures are only logged.
 */
@Slf4j
public class KafkaBrokerWriter implements BrokerWriter {

    private final KafkaTemplate<String, byte[]> template;
    private final String topic;
    private final boolean async;
    private final boolean ownsFactory;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public KafkaBrokerWriter(KafkaTemplate<String, byte[]> template, String topic, boolean async, boolean ownsFactory) {
        this.template = template;
        this.topic = topic;
        this.async = async;
        this.ownsFactory = ownsFactory;
    }

    public KafkaBrokerWriter(KafkaTemplate<String, byte[]> template, String topic, boolean async) {
        this(template, topic, async, false);
    }

    @Override
    public String topic() {
        return topic;
    }

    @Override
    public void write(BusContext ctx, List<Envelope> envelopes) {
        List<CompletableFuture<SendResult<String, byte[]>>> futures = new ArrayList<>(envelopes.size());
        try {
            for (Envelope env : envelopes) {
                futures.add(template.send(EnvelopeRecordMapper.toRecord(topic, partitionFor(env.getKey()), env)));
            }
        } catch (KafkaException e) {
            throw new BrokerException("write to topic " + topic + " failed", e);
        }

        if (async) {
            for (CompletableFuture<SendResult<String, byte[]>> f : futures) {
                f.whenComplete((res, ex) -> {
                    if (ex != null) {
                        log.error("Async write failed topic={} error={}", topic, ex.toString());
                    }
                });
            }
            return;
        }

        for (CompletableFuture<SendResult<String, byte[]>> f : futures) {
            await(ctx, f);
        }
    }

    private void await(BusContext ctx, CompletableFuture<SendResult<String, byte[]>> f) {
        try {
            Optional<Duration> left = ctx.remaining();
            if (left.isPresent()) {
                f.get(left.get().toNanos(), TimeUnit.NANOSECONDS);
            } else {
                f.get();
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new BrokerException("write to topic " + topic + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new BrokerException("write to topic " + topic + " failed: context deadline exceeded", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException("write to topic " + topic + " interrupted", e);
        }
    }

    private Integer partitionFor(String key) {
        if (key == null) return null;
        List<PartitionInfo> partitions = template.partitionsFor(topic);
        if (partitions == null || partitions.isEmpty()) {
            // client partitioner hashes the key the same way
            return null;
        }
        return KeyPartitioner.partition(key, partitions.size());
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            template.flush();
        } finally {
            if (ownsFactory) {
                ProducerFactory<String, byte[]> pf = template.getProducerFactory();
                pf.reset();
            }
        }
    }
}
