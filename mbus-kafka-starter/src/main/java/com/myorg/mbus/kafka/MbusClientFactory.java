package com.myorg.mbus.kafka;

import com.myorg.mbus.contracts.core.handler.MessageHandler;
import com.myorg.mbus.kafka.broker.BrokerReader;
import com.myorg.mbus.kafka.broker.BrokerWriter;
import com.myorg.mbus.kafka.broker.KafkaBrokerReader;
import com.myorg.mbus.kafka.broker.KafkaBrokerWriter;
import com.myorg.mbus.kafka.broker.StartOffset;
import com.myorg.mbus.kafka.consumer.ConsumerListener;
import com.myorg.mbus.kafka.consumer.ConsumerOptions;
import com.myorg.mbus.kafka.consumer.MbusConsumer;
import com.myorg.mbus.kafka.dlq.DeadLetterRouter;
import com.myorg.mbus.kafka.error.RetryPolicy;
import com.myorg.mbus.kafka.pipeline.MessageInterceptor;
import com.myorg.mbus.kafka.pipeline.Side;
import com.myorg.mbus.kafka.producer.MbusProducer;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.List;

/**
 * Builds producers and consumers from {@code mbus.kafka.*}. Interceptor and listener beans
 * known at construction time are attached to every client created here.
 */
@Slf4j
public class MbusClientFactory {

    private final MbusKafkaProperties props;
    private final RetryPolicy retryPolicy;
    private final List<MessageInterceptor> interceptors;
    private final List<ConsumerListener> listeners;

    public MbusClientFactory(MbusKafkaProperties props,
                             RetryPolicy retryPolicy,
                             List<MessageInterceptor> interceptors,
                             List<ConsumerListener> listeners) {
        this.props = props;
        this.retryPolicy = retryPolicy;
        this.interceptors = List.copyOf(interceptors);
        this.listeners = List.copyOf(listeners);
    }

    /** Producer for {@code topic}, dead-lettering to {@code mbus.kafka.producer.dlq-topic} when set. */
    public MbusProducer producer(String topic) {
        return producer(topic, props.getProducer().getDlqTopic());
    }

    public MbusProducer producer(String topic, String dlqTopic) {
        requireText(topic, "topic");

        BrokerWriter writer = createWriter(topic, false);
        DeadLetterRouter dlq = hasText(dlqTopic) ? new DeadLetterRouter(createWriter(dlqTopic, true), null) : null;

        MbusProducer producer = new MbusProducer(writer, dlq);
        if (props.getInterceptors().isEnabled()) {
            producer.useAll(forSide(Side.PRODUCER));
        }
        log.info("Producer created topic={} dlq={} async={}", topic, hasText(dlqTopic) ? dlqTopic : "-",
                props.getProducer().isAsync());
        return producer;
    }

    /** Consumer for {@code topic}, dead-lettering to {@code mbus.kafka.consumer.dlq-topic} when set. */
    public MbusConsumer consumer(String topic, String groupId, MessageHandler handler) {
        return consumer(topic, groupId, props.getConsumer().getDlqTopic(), handler);
    }

    public MbusConsumer consumer(String topic, String groupId, String dlqTopic, MessageHandler handler) {
        requireText(topic, "topic");
        requireText(groupId, "groupId");
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }

        BrokerReader reader = createReader(topic, groupId);
        DeadLetterRouter dlq = hasText(dlqTopic) ? new DeadLetterRouter(createWriter(dlqTopic, true), groupId) : null;

        MbusKafkaProperties.Consumer c = props.getConsumer();
        ConsumerOptions options = new ConsumerOptions(c.getMaxRetries(), c.getFetchErrorBackoff(),
                c.getCommitPolicy(), c.getBusinessErrorPolicy());

        MbusConsumer consumer = new MbusConsumer(topic, groupId, reader, dlq, handler, retryPolicy, options);
        if (props.getInterceptors().isEnabled()) {
            consumer.useAll(forSide(Side.CONSUMER));
        }
        listeners.forEach(consumer::addListener);
        log.info("Consumer created topic={} group={} dlq={}", topic, groupId, hasText(dlqTopic) ? dlqTopic : "-");
        return consumer;
    }

    protected BrokerWriter createWriter(String topic, boolean deadLetter) {
        DefaultKafkaProducerFactory<String, byte[]> pf = new DefaultKafkaProducerFactory<>(
                deadLetter ? KafkaClientSettings.deadLetterProducer(props) : KafkaClientSettings.producer(props));
        boolean async = !deadLetter && props.getProducer().isAsync();
        return new KafkaBrokerWriter(new KafkaTemplate<>(pf), topic, async, true);
    }

    protected BrokerReader createReader(String topic, String groupId) {
        MbusKafkaProperties.Consumer c = props.getConsumer();
        DefaultKafkaConsumerFactory<String, byte[]> cf =
                new DefaultKafkaConsumerFactory<>(KafkaClientSettings.consumer(props, groupId));
        Consumer<String, byte[]> kafkaConsumer = cf.createConsumer();
        return new KafkaBrokerReader(kafkaConsumer, topic, StartOffset.parse(c.getStartOffset()),
                c.getMaxWait(), c.getCommitInterval());
    }

    private List<MessageInterceptor> forSide(Side side) {
        return interceptors.stream().filter(i -> i.appliesTo(side)).toList();
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    private static void requireText(String value, String name) {
        if (!hasText(value)) {
            throw new IllegalArgumentException(name + " cannot be empty");
        }
    }
}
