package com.orderguard.inmemory;

import com.orderguard.consumer.failurestate.ControlTopic;
import com.orderguard.consumer.failurestate.StreamState;

import java.util.List;
import java.util.Objects;

/** Control topic backed by a broker log; every instance keeps its own read cursor. */
public final class InMemoryControlTopic implements ControlTopic {
    private final InMemoryBroker<?> broker;
    private final String topic;
    private int cursor;

    public InMemoryControlTopic(InMemoryBroker<?> broker, String topic) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.topic = Objects.requireNonNull(topic, "topic");
    }

    @Override
    public void publish(StreamState state) {
        broker.publishControl(topic, state);
    }

    @Override
    public List<StreamState> replayToHead() {
        List<StreamState> states = broker.readControl(topic, cursor);
        cursor += states.size();
        return states;
    }

    @Override
    public void close() {
    }
}
