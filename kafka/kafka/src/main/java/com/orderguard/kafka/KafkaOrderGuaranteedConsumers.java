package com.orderguard.kafka;

import com.orderguard.common.ITimeService;
import com.orderguard.common.metrics.Metrics;
import com.orderguard.consumer.SubscriptionConfig;
import com.orderguard.consumer.abstraction.BrokerBindings;
import com.orderguard.consumer.ordered.DeadLetterSink;
import com.orderguard.consumer.ordered.OrderGuaranteedConsumer;
import com.orderguard.kafkaconfig.KafkaConfig;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.common.serialization.Deserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/** Wires an {@link OrderGuaranteedConsumer} to a Kafka cluster. */
public final class KafkaOrderGuaranteedConsumers {
    private static final Logger LOG = LoggerFactory.getLogger(KafkaOrderGuaranteedConsumers.class);

    private KafkaOrderGuaranteedConsumers() {
    }

    /**
     * Creates the control topic if missing and builds every Kafka client the consumer needs. The admin client
     * and the reader's consumer are returned as resources, closed with the consumer.
     */
    public static <T> BrokerBindings<T> bindings(KafkaConfig kafkaConfig,
                                                 SubscriptionConfig config,
                                                 String consumerName,
                                                 Deserializer<T> valueDeserializer,
                                                 ITimeService time) {
        List<AutoCloseable> resources = new ArrayList<>();
        Admin admin = Admin.create(KafkaClientProperties.admin(kafkaConfig));
        resources.add(admin);
        try {
            KafkaTopicAdmin topicAdmin = new KafkaTopicAdmin(admin, kafkaConfig.partitions(),
                    kafkaConfig.replicationFactor(), kafkaConfig.requestTimeout());
            topicAdmin.ensureCompactedTopicExists(config.failureStateTopic());

            KafkaTopicReaderFactory<T> readers = new KafkaTopicReaderFactory<>(new KafkaConsumer<>(
                    KafkaClientProperties.reader(kafkaConfig, consumerName + "-reader"), new StringDeserializer(), valueDeserializer));
            resources.add(readers);

            KafkaControlTopic controlTopic = new KafkaControlTopic(
                    config.failureStateTopic(),
                    new KafkaProducer<>(KafkaClientProperties.producer(kafkaConfig, consumerName + "-state"),
                            new StringSerializer(), new StringSerializer()),
                    new KafkaConsumer<>(KafkaClientProperties.reader(kafkaConfig, consumerName + "-state"),
                            new StringDeserializer(), new StringDeserializer()),
                    kafkaConfig.requestTimeout(),
                    config.readTimeout(),
                    time);

            return new BrokerBindings<>(
                    new KafkaBrokerConsumerFactory<>(kafkaConfig,
                            props -> new KafkaConsumer<>(props, new StringDeserializer(), valueDeserializer)),
                    topicAdmin,
                    readers,
                    new KafkaKeyHashRangeProvider(admin, kafkaConfig.requestTimeout()),
                    controlTopic,
                    resources);
        } catch (RuntimeException e) {
            closeQuietly(resources, e);
            throw e;
        }
    }

    public static <T> OrderGuaranteedConsumer<T> create(KafkaConfig kafkaConfig,
                                                        SubscriptionConfig config,
                                                        String consumerName,
                                                        Deserializer<T> valueDeserializer,
                                                        ITimeService time,
                                                        Metrics metrics,
                                                        DeadLetterSink<T> deadLetterSink) {
        BrokerBindings<T> bindings = bindings(kafkaConfig, config, consumerName, valueDeserializer, time);
        LOG.info("{} consuming {} as {} from {}", consumerName, config.topics(), config.subscriptionName(), kafkaConfig.bootstrapServer());
        return OrderGuaranteedConsumer.create(config, consumerName, bindings, time, metrics, deadLetterSink);
    }

    public static OrderGuaranteedConsumer<String> create(KafkaConfig kafkaConfig, SubscriptionConfig config, String consumerName) {
        return create(kafkaConfig, config, consumerName, new StringDeserializer(), ITimeService.real,
                Metrics.nullMetrics, DeadLetterSink.logging());
    }

    private static void closeQuietly(List<AutoCloseable> resources, RuntimeException failure) {
        for (AutoCloseable c : resources) {
            try {
                c.close();
            } catch (Exception e) {
                failure.addSuppressed(e);
            }
        }
    }
}
