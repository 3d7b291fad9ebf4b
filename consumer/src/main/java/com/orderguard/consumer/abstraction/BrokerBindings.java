package com.orderguard.consumer.abstraction;

import com.orderguard.consumer.failurestate.ControlTopic;

import java.util.List;
import java.util.Objects;

/**
 * One broker's implementations of everything the order-guaranteed consumer talks to.
 *
 * @param resources shared clients the bindings were built on, closed with the consumer that uses them
 */
public record BrokerBindings<T>(
        BrokerConsumerFactory<T> consumerFactory,
        TopicAdmin topicAdmin,
        TopicReaderFactory<T> readerFactory,
        KeyHashRangeProvider keyHashRangeProvider,
        ControlTopic controlTopic,
        List<AutoCloseable> resources
) {
    public BrokerBindings {
        Objects.requireNonNull(consumerFactory, "consumerFactory");
        Objects.requireNonNull(topicAdmin, "topicAdmin");
        Objects.requireNonNull(readerFactory, "readerFactory");
        Objects.requireNonNull(keyHashRangeProvider, "keyHashRangeProvider");
        Objects.requireNonNull(controlTopic, "controlTopic");
        resources = resources == null ? List.of() : List.copyOf(resources);
    }
}
