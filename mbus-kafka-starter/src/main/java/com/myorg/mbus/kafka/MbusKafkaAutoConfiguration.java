package com.myorg.mbus.kafka;

import com.myorg.mbus.kafka.consumer.ConsumerListener;
import com.myorg.mbus.kafka.error.DefaultErrorClassifier;
import com.myorg.mbus.kafka.error.ErrorClassifier;
import com.myorg.mbus.kafka.error.RetryPolicy;
import com.myorg.mbus.kafka.pipeline.MessageInterceptor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

// Wires the classifier, retry policy and client factory from mbus.kafka.*.
// Every bean backs off when the application defines its own.
@Slf4j
@AutoConfiguration(before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class)
@ConditionalOnClass(KafkaTemplate.class)
@EnableConfigurationProperties(MbusKafkaProperties.class)
public class MbusKafkaAutoConfiguration {

    /** Lets tests and health checks see which brokers the starter bound. */
    public record MbusKafkaMarker(List<String> brokers) {}

    @Bean
    @ConditionalOnMissingBean
    public MbusKafkaMarker mbusKafkaMarker(MbusKafkaProperties props) {
        return new MbusKafkaMarker(List.copyOf(props.getBrokers()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier mbusErrorClassifier() {
        return new DefaultErrorClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy mbusRetryPolicy(ErrorClassifier classifier) {
        return new RetryPolicy(classifier);
    }

    @Bean
    @ConditionalOnMissingBean
    public MbusClientFactory mbusClientFactory(MbusKafkaProperties props,
                                               RetryPolicy retryPolicy,
                                               ObjectProvider<MessageInterceptor> interceptors,
                                               ObjectProvider<ConsumerListener> listeners) {
        props.validateOrThrow();
        logConfiguration(props);
        return new MbusClientFactory(props, retryPolicy,
                interceptors.orderedStream().toList(),
                listeners.orderedStream().toList());
    }

    /**
     * KafkaAdmin on mbus.kafka.brokers so NewTopic beans are applied
     * (Boot's own admin reads spring.kafka.bootstrap-servers).
     */
    @Bean
    @ConditionalOnMissingBean
    public KafkaAdmin kafkaAdmin(MbusKafkaProperties props) {
        Map<String, Object> cfg = new HashMap<>();
        cfg.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, String.join(",", props.getBrokers()));
        return new KafkaAdmin(cfg);
    }

    private static void logConfiguration(MbusKafkaProperties props) {
        MbusKafkaProperties.Producer p = props.getProducer();
        MbusKafkaProperties.Consumer c = props.getConsumer();
        log.info("Kafka configuration loaded brokers={} producer[maxAttempts={} batchTimeout={} acks={} compression={} async={} dlq={}] "
                        + "consumer[startOffset={} minBytes={} maxBytes={} maxWait={} commitInterval={} heartbeat={} session={} "
                        + "rebalance={} maxRetries={} commitPolicy={} businessErrorPolicy={} dlq={}] interceptors={}",
                props.getBrokers(), p.getMaxAttempts(), p.getBatchTimeout(), p.getAcks(), p.getCompression(), p.isAsync(),
                p.getDlqTopic(), c.getStartOffset(), c.getMinBytes(), c.getMaxBytes(), c.getMaxWait(), c.getCommitInterval(),
                c.getHeartbeatInterval(), c.getSessionTimeout(), c.getRebalanceTimeout(), c.getMaxRetries(),
                c.getCommitPolicy(), c.getBusinessErrorPolicy(), c.getDlqTopic(), props.getInterceptors().isEnabled());
    }
}
