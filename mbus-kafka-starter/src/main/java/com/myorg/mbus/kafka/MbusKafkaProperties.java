package com.myorg.mbus.kafka;

import com.myorg.mbus.kafka.broker.StartOffset;
import com.myorg.mbus.kafka.consumer.BusinessErrorPolicy;
import com.myorg.mbus.kafka.consumer.CommitPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Bound from {@code mbus.kafka.*}. Defaults are the values used across services; most
 * deployments only set {@code brokers} and the dead-letter topics.
 */
@Data
@ConfigurationProperties(prefix = "mbus.kafka")
public class MbusKafkaProperties {
    private List<String> brokers = new ArrayList<>(List.of("localhost:9092"));
    private final Producer producer = new Producer();
    private final Consumer consumer = new Consumer();
    private final Interceptors interceptors = new Interceptors();

    @Data
    public static class Producer {
        /** Total write attempts, the first one included. */
        private int maxAttempts = 3;
        private Duration batchTimeout = Duration.ofMillis(10);
        private Acks acks = Acks.ALL;
        private Compression compression = Compression.SNAPPY;
        private boolean async = false;
        /** Empty disables dead-lettering of failed writes. */
        private String dlqTopic = "";
    }

    @Data
    public static class Consumer {
        /** newest, oldest or an offset >= 0. */
        private String startOffset = "newest";
        private int minBytes = 1;
        private int maxBytes = 10 * 1024 * 1024;
        private Duration maxWait = Duration.ofMillis(500);
        /** How often committed offsets are flushed to the broker. Zero flushes on every record. */
        private Duration commitInterval = Duration.ofSeconds(1);
        private Duration heartbeatInterval = Duration.ofSeconds(3);
        private Duration sessionTimeout = Duration.ofSeconds(10);
        private Duration rebalanceTimeout = Duration.ofSeconds(60);
        private int maxRetries = 3;
        private Duration fetchErrorBackoff = Duration.ofSeconds(1);
        private CommitPolicy commitPolicy = CommitPolicy.ALWAYS;
        private BusinessErrorPolicy businessErrorPolicy = BusinessErrorPolicy.DEAD_LETTER;
        private String dlqTopic = "";
    }

    @Data
    public static class Interceptors {
        private boolean enabled = true;
    }

    public enum Acks {
        ALL("all"),
        NONE("0"),
        LEADER("1");

        private final String code;

        Acks(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    public enum Compression {
        NONE("none"),
        GZIP("gzip"),
        SNAPPY("snappy"),
        LZ4("lz4"),
        ZSTD("zstd");

        private final String code;

        Compression(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    /** Every violation, in declaration order. Empty when the configuration is usable. */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        if (brokers == null || brokers.isEmpty()) {
            errors.add("At least one Kafka broker is required");
        } else {
            for (int i = 0; i < brokers.size(); i++) {
                if (brokers.get(i) == null || brokers.get(i).isBlank()) {
                    errors.add("Broker " + i + " cannot be empty");
                }
            }
        }

        if (producer.maxAttempts <= 0) {
            errors.add("producer.max-attempts must be positive, got: " + producer.maxAttempts);
        }
        requirePositive(errors, "producer.batch-timeout", producer.batchTimeout);
        if (producer.acks == null) errors.add("producer.acks is required (all, none, leader)");
        if (producer.compression == null) errors.add("producer.compression is required (none, gzip, snappy, lz4, zstd)");

        try {
            StartOffset.parse(consumer.startOffset);
        } catch (IllegalArgumentException e) {
            errors.add("consumer." + e.getMessage());
        }
        if (consumer.minBytes <= 0) {
            errors.add("consumer.min-bytes must be positive, got: " + consumer.minBytes);
        }
        if (consumer.maxBytes <= 0) {
            errors.add("consumer.max-bytes must be positive, got: " + consumer.maxBytes);
        } else if (consumer.minBytes > consumer.maxBytes) {
            errors.add("consumer.min-bytes (" + consumer.minBytes + ") cannot exceed consumer.max-bytes (" + consumer.maxBytes + ")");
        }
        requirePositive(errors, "consumer.max-wait", consumer.maxWait);
        if (consumer.commitInterval == null || consumer.commitInterval.isNegative()) {
            errors.add("consumer.commit-interval cannot be negative, got: " + consumer.commitInterval);
        }
        requirePositive(errors, "consumer.heartbeat-interval", consumer.heartbeatInterval);
        requirePositive(errors, "consumer.session-timeout", consumer.sessionTimeout);
        requirePositive(errors, "consumer.rebalance-timeout", consumer.rebalanceTimeout);
        if (consumer.heartbeatInterval != null && consumer.sessionTimeout != null
                && consumer.heartbeatInterval.compareTo(consumer.sessionTimeout) >= 0) {
            errors.add("consumer.heartbeat-interval must be lower than consumer.session-timeout");
        }
        if (consumer.maxRetries < 0) {
            errors.add("consumer.max-retries cannot be negative, got: " + consumer.maxRetries);
        }
        // the fetch loop sleeps this long after every failure
        requirePositive(errors, "consumer.fetch-error-backoff", consumer.fetchErrorBackoff);
        if (consumer.commitPolicy == null) errors.add("consumer.commit-policy is required");
        if (consumer.businessErrorPolicy == null) errors.add("consumer.business-error-policy is required");

        return errors;
    }

    /** @throws IllegalStateException listing every violation */
    public void validateOrThrow() {
        List<String> errors = validate();
        if (errors.isEmpty()) return;

        StringBuilder sb = new StringBuilder("Configuration validation failed:\n");
        for (int i = 0; i < errors.size(); i++) {
            sb.append("  ").append(i + 1).append(". ").append(errors.get(i)).append('\n');
        }
        throw new IllegalStateException(sb.toString());
    }

    private static void requirePositive(List<String> errors, String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            errors.add(name + " must be positive, got: " + d);
        }
    }
}
