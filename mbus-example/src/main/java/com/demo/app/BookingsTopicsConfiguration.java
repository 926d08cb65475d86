package com.demo.app;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Ensure demo topics exist (useful when the broker disables auto topic creation).
 * Applied by the KafkaAdmin bean from mbus-kafka-starter.
 */
@Configuration
public class BookingsTopicsConfiguration {

    @Bean
    public NewTopic bookingsCommandsTopic(@Value("${bookings.topics.commands}") String name) {
        return TopicBuilder.name(name).partitions(3).replicas(1).build();
    }

    @Bean
    public NewTopic bookingsResultsTopic(@Value("${bookings.topics.results}") String name) {
        return TopicBuilder.name(name).partitions(3).replicas(1).build();
    }

    @Bean
    public NewTopic bookingsDlqTopic(@Value("${mbus.kafka.consumer.dlq-topic}") String name) {
        return TopicBuilder.name(name).partitions(1).replicas(1).build();
    }
}
