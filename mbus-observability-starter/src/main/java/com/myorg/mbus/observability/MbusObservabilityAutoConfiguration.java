package com.myorg.mbus.observability;

import com.myorg.mbus.kafka.MbusKafkaAutoConfiguration;
import com.myorg.mbus.kafka.pipeline.Side;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

@AutoConfiguration(
        before = MbusKafkaAutoConfiguration.class,
        afterName = {
                "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
                "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
                "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
        })
@ConditionalOnClass(MbusKafkaAutoConfiguration.class)
@ConditionalOnProperty(prefix = "mbus.observability", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(MbusObservabilityProperties.class)
public class MbusObservabilityAutoConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "mbus.observability", name = "logging-enabled", matchIfMissing = true)
    public LoggingInterceptor mbusProducerLoggingInterceptor(MbusObservabilityProperties props) {
        return new LoggingInterceptor(Side.PRODUCER, props);
    }

    @Bean
    @ConditionalOnProperty(prefix = "mbus.observability", name = "logging-enabled", matchIfMissing = true)
    public LoggingInterceptor mbusConsumerLoggingInterceptor(MbusObservabilityProperties props) {
        return new LoggingInterceptor(Side.CONSUMER, props);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "mbus.observability", name = "metrics-enabled", matchIfMissing = true)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public MbusMetrics mbusMetrics(MeterRegistry registry, Environment env, MbusObservabilityProperties props) {
            String app = env.getProperty("spring.application.name", "unknown-service");
            return new MbusMetrics(registry, app, props);
        }

        @Bean
        public MetricsInterceptor mbusProducerMetricsInterceptor(MbusMetrics metrics) {
            return new MetricsInterceptor(metrics, Side.PRODUCER);
        }

        @Bean
        public MetricsInterceptor mbusConsumerMetricsInterceptor(MbusMetrics metrics) {
            return new MetricsInterceptor(metrics, Side.CONSUMER);
        }

        @Bean
        public MetricsConsumerListener mbusMetricsConsumerListener(MbusMetrics metrics) {
            return new MetricsConsumerListener(metrics);
        }

        /**
         * Pre-register meters at startup so /actuator/metrics/<name> never returns 404.
         */
        @Bean
        public SmartLifecycle mbusMetricsPreRegisterLifecycle(ObjectProvider<MbusMetrics> metricsProvider) {
            return new SmartLifecycle() {
                private boolean running = false;

                @Override public void start() {
                    MbusMetrics m = metricsProvider.getIfAvailable();
                    if (m != null) m.preRegisterBaseMeters();
                    running = true;
                }

                @Override public void stop() { running = false; }
                @Override public boolean isRunning() { return running; }
                @Override public int getPhase() { return Integer.MIN_VALUE; } // start very early
            };
        }
    }
}
