package com.orderguard.inmemory;

import com.orderguard.consumer.abstraction.KeyHashRangeProvider;
import com.orderguard.consumer.abstraction.KeyHashRanges;

/** Ranges are per subscription; the topic is not consulted. */
public final class InMemoryKeyHashRangeProvider implements KeyHashRangeProvider {
    private final InMemoryBroker<?> broker;

    public InMemoryKeyHashRangeProvider(InMemoryBroker<?> broker) {
        this.broker = broker;
    }

    @Override
    public KeyHashRanges getOwnedRanges(String topic, String subscriptionName, String consumerName) {
        return broker.ownedRanges(subscriptionName, consumerName);
    }
}
