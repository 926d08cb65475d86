package com.demo.app;

import com.myorg.mbus.kafka.MbusClientFactory;
import com.myorg.mbus.kafka.producer.MbusProducer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BookingsMessagingConfiguration {

    @Bean(destroyMethod = "close")
    @Qualifier("commands")
    public MbusProducer commandsProducer(MbusClientFactory factory, @Value("${bookings.topics.commands}") String topic) {
        return factory.producer(topic);
    }

    // results are fire-and-forget for this service: no dead-letter copy
    @Bean(destroyMethod = "close")
    @Qualifier("results")
    public MbusProducer resultsProducer(MbusClientFactory factory, @Value("${bookings.topics.results}") String topic) {
        return factory.producer(topic, "");
    }
}
