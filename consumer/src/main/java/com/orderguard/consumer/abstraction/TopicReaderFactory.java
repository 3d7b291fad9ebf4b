package com.orderguard.consumer.abstraction;

@FunctionalInterface
public interface TopicReaderFactory<T> {
    /**
     * Open a reader positioned for the history of {@code key} on {@code topic}. The key is a hint:
     * brokers that shard by key may narrow the read to the key's shard, but readers can still
     * return messages of other keys.
     */
    TopicReader<T> createReader(String topic, String key);
}
