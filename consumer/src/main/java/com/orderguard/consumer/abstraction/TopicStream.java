package com.orderguard.consumer.abstraction;

import java.util.Objects;

/** A (topic, stream key) pair: the unit that ordering and failure state are tracked for. */
public record TopicStream(String topic, String streamId) {
    public TopicStream {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(streamId, "streamId");
    }
}
