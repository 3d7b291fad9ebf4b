package com.orderguard.consumer.abstraction;

import java.util.Objects;

/**
 * One message as seen by the consumption layer.
 *
 * @param topic       source topic
 * @param partition   shard within the topic that {@code sequenceId} is scoped to (0 for single-shard brokers)
 * @param key         partitioning key (stream id); ordering is guaranteed per key
 * @param sequenceId  position of the message in its shard, strictly increasing
 * @param publishTime broker publish timestamp, epoch millis
 * @param payload     message body
 */
public record MessageContext<T>(String topic, int partition, String key, long sequenceId, long publishTime, T payload) {

    public MessageContext {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(key, "key");
    }

    public TopicStream topicStream() {
        return new TopicStream(topic, key);
    }

    @Override
    public String toString() {
        return topic + "/" + partition + "@" + sequenceId + "[" + key + "]";
    }
}
