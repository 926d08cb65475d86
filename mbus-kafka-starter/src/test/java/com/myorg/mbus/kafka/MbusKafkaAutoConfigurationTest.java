package com.myorg.mbus.kafka;

import com.myorg.mbus.contracts.core.exception.ErrorKind;
import com.myorg.mbus.kafka.consumer.BusinessErrorPolicy;
import com.myorg.mbus.kafka.consumer.CommitPolicy;
import com.myorg.mbus.kafka.error.DefaultErrorClassifier;
import com.myorg.mbus.kafka.error.ErrorClassifier;
import com.myorg.mbus.kafka.error.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaAdmin;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MbusKafkaAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(MbusKafkaAutoConfiguration.class));

    @Test
    void registersDefaultBeans() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(MbusClientFactory.class);
            assertThat(ctx).hasSingleBean(KafkaAdmin.class);
            assertThat(ctx.getBean(ErrorClassifier.class)).isInstanceOf(DefaultErrorClassifier.class);
            assertThat(ctx.getBean(MbusKafkaAutoConfiguration.MbusKafkaMarker.class).brokers())
                    .containsExactly("localhost:9092");
        });
    }

    @Test
    void bindsRelaxedPropertyNames() {
        runner.withPropertyValues(
                "mbus.kafka.brokers=k1:9092,k2:9092",
                "mbus.kafka.producer.acks=leader",
                "mbus.kafka.producer.dlq-topic=orders.dlq",
                "mbus.kafka.consumer.commit-interval=0s",
                "mbus.kafka.consumer.commit-policy=on-terminal-success",
                "mbus.kafka.consumer.business-error-policy=drop").run(ctx -> {
            MbusKafkaProperties props = ctx.getBean(MbusKafkaProperties.class);
            assertThat(props.getBrokers()).containsExactly("k1:9092", "k2:9092");
            assertThat(props.getProducer().getAcks()).isEqualTo(MbusKafkaProperties.Acks.LEADER);
            assertThat(props.getProducer().getDlqTopic()).isEqualTo("orders.dlq");
            assertThat(props.getConsumer().getCommitInterval()).isEqualTo(Duration.ZERO);
            assertThat(props.getConsumer().getCommitPolicy()).isEqualTo(CommitPolicy.ON_TERMINAL_SUCCESS);
            assertThat(props.getConsumer().getBusinessErrorPolicy()).isEqualTo(BusinessErrorPolicy.DROP);
        });
    }

    @Test
    void applicationClassifierReplacesDefault() {
        runner.withUserConfiguration(CustomClassifierConfig.class).run(ctx -> {
            assertThat(ctx).hasSingleBean(ErrorClassifier.class);
            RetryPolicy policy = ctx.getBean(RetryPolicy.class);
            assertThat(policy.shouldRetry(new IllegalStateException("anything"), 0, 3)).isTrue();
        });
    }

    @Test
    void invalidConfigurationFailsStartup() {
        runner.withPropertyValues(
                "mbus.kafka.consumer.min-bytes=0",
                "mbus.kafka.consumer.session-timeout=2s").run(ctx -> {
            assertThat(ctx).hasFailed();
            assertThat(ctx.getStartupFailure())
                    .rootCause()
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("1. consumer.min-bytes must be positive")
                    .hasMessageContaining("2. consumer.heartbeat-interval must be lower than consumer.session-timeout");
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomClassifierConfig {
        @Bean
        ErrorClassifier everythingTransient() {
            return error -> ErrorKind.TRANSIENT;
        }
    }
}
