package com.orderguard.inmemory;

import com.orderguard.consumer.abstraction.KeyHashRange;
import com.orderguard.consumer.abstraction.KeyHasher;
import com.orderguard.consumer.abstraction.MessageContext;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Key-shared subscription: the hash space is split evenly between the connected consumers (sorted by
 * name) and each consumer receives only the keys in its slice. Unacknowledged messages stay deliverable
 * until acked; a nacked message becomes deliverable again.
 * <p>
 * Guarded by the owning broker's lock.
 */
final class InMemorySubscription {

    private static final class TopicCursor {
        final BitSet acked = new BitSet();
        final Map<Integer, String> inFlight = new HashMap<>();
        int firstUnacked;

        void ack(int index) {
            acked.set(index);
            inFlight.remove(index);
            firstUnacked = acked.nextClearBit(firstUnacked);
        }
    }

    private final String name;
    private final List<String> topics;
    private final int hashSpace;
    private final KeyHasher hasher;
    private final TreeSet<String> consumers = new TreeSet<>();
    private final Map<String, TopicCursor> cursors = new HashMap<>();

    InMemorySubscription(String name, List<String> topics, int hashSpace, KeyHasher hasher) {
        this.name = name;
        this.topics = List.copyOf(topics);
        this.hashSpace = hashSpace;
        this.hasher = hasher;
        for (String t : topics) cursors.put(t, new TopicCursor());
    }

    String name() {
        return name;
    }

    List<String> topics() {
        return topics;
    }

    void connect(String consumerName) {
        consumers.add(consumerName);
    }

    /** Removes the consumer; whatever it had in flight becomes deliverable to the others. */
    void disconnect(String consumerName) {
        consumers.remove(consumerName);
        for (TopicCursor c : cursors.values()) c.inFlight.values().removeIf(consumerName::equals);
    }

    boolean isConnected(String consumerName) {
        return consumers.contains(consumerName);
    }

    Optional<KeyHashRange> rangeOf(String consumerName) {
        if (!consumers.contains(consumerName)) return Optional.empty();
        int n = consumers.size();
        int i = consumers.headSet(consumerName).size();
        int start = (int) ((long) i * hashSpace / n);
        int end = (int) ((long) (i + 1) * hashSpace / n);
        return end > start ? Optional.of(new KeyHashRange(start, end)) : Optional.empty();
    }

    <T> List<MessageContext<T>> take(String consumerName, Function<String, InMemoryTopic<T>> topicLookup, int max) {
        Optional<KeyHashRange> range = rangeOf(consumerName);
        if (range.isEmpty()) return List.of();
        List<MessageContext<T>> out = new ArrayList<>();
        for (String topicName : topics) {
            InMemoryTopic<T> topic = topicLookup.apply(topicName);
            if (topic == null) continue;
            TopicCursor cursor = cursors.get(topicName);
            for (int i = cursor.firstUnacked; i < topic.size() && out.size() < max; i++) {
                if (cursor.acked.get(i) || cursor.inFlight.containsKey(i)) continue;
                MessageContext<T> m = topic.get(i);
                if (!range.get().contains(hasher.hash(m.key()))) continue;
                cursor.inFlight.put(i, consumerName);
                out.add(m);
            }
        }
        return out;
    }

    void ack(MessageContext<?> message) {
        TopicCursor cursor = cursors.get(message.topic());
        if (cursor != null) cursor.ack(InMemoryTopic.indexOf(message.sequenceId()));
    }

    void release(MessageContext<?> message) {
        TopicCursor cursor = cursors.get(message.topic());
        if (cursor != null) cursor.inFlight.remove(InMemoryTopic.indexOf(message.sequenceId()));
    }

    /** Messages not yet acknowledged on {@code topic}. */
    int backlog(String topic, int topicSize) {
        TopicCursor cursor = Objects.requireNonNull(cursors.get(topic), topic);
        return topicSize - cursor.acked.cardinality();
    }
}
