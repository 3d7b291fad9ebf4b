package com.orderguard.inmemory;

import com.orderguard.consumer.abstraction.TopicAdmin;

public final class InMemoryTopicAdmin implements TopicAdmin {
    private final InMemoryBroker<?> broker;

    public InMemoryTopicAdmin(InMemoryBroker<?> broker) {
        this.broker = broker;
    }

    @Override
    public void ensureTopicExists(String topic) {
        broker.createTopic(topic);
    }

    @Override
    public void deleteTopic(String topic) {
        broker.deleteTopic(topic);
    }
}
