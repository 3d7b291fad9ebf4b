package com.orderguard.kafka;

import com.orderguard.consumer.SubscriptionConfig;
import com.orderguard.consumer.abstraction.BrokerConsumer;
import com.orderguard.consumer.abstraction.BrokerConsumerFactory;
import com.orderguard.kafkaconfig.KafkaConfig;
import org.apache.kafka.clients.consumer.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/** The subscription name is the consumer group and the consumer name its client id. */
public final class KafkaBrokerConsumerFactory<T> implements BrokerConsumerFactory<T> {
    private static final Logger LOG = LoggerFactory.getLogger(KafkaBrokerConsumerFactory.class);

    private final KafkaConfig kafkaConfig;
    private final Function<Properties, Consumer<String, T>> consumers;

    public KafkaBrokerConsumerFactory(KafkaConfig kafkaConfig, Function<Properties, Consumer<String, T>> consumers) {
        this.kafkaConfig = Objects.requireNonNull(kafkaConfig, "kafkaConfig");
        this.consumers = Objects.requireNonNull(consumers, "consumers");
    }

    @Override
    public BrokerConsumer<T> subscribe(SubscriptionConfig config, String consumerName) {
        Properties props = KafkaClientProperties.groupConsumer(kafkaConfig, config.subscriptionName(), consumerName, config.batchSize());
        Consumer<String, T> consumer = consumers.apply(props);
        LOG.info("{} joining group {} on {}", consumerName, config.subscriptionName(), config.topics());
        return KafkaBrokerConsumer.subscribe(consumer, consumerName, config.topics());
    }
}
