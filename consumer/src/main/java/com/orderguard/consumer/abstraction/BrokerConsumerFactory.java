package com.orderguard.consumer.abstraction;

import com.orderguard.consumer.SubscriptionConfig;

@FunctionalInterface
public interface BrokerConsumerFactory<T> {
    /** Subscribe to every topic in the config under its subscription name. Failure to reach the broker throws. */
    BrokerConsumer<T> subscribe(SubscriptionConfig config, String consumerName);
}
