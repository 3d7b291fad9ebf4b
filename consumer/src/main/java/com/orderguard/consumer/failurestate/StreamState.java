package com.orderguard.consumer.failurestate;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Everything known about one failing key, per topic. This is the value written to the control topic;
 * a state with no topics is the tombstone that removes the key.
 */
public record StreamState(String streamId, Map<String, TopicState> topics) {

    public StreamState {
        Objects.requireNonNull(streamId, "streamId");
        topics = topics == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(topics));
    }

    public static StreamState tombstone(String streamId) {
        return new StreamState(streamId, Map.of());
    }

    public boolean tracksNothing() {
        return topics.isEmpty();
    }

    public Optional<TopicState> topic(String topicName) {
        return Optional.ofNullable(topics.get(topicName));
    }

    public StreamState withTopic(TopicState state) {
        Map<String, TopicState> copy = new LinkedHashMap<>(topics);
        copy.put(state.topicName(), state);
        return new StreamState(streamId, copy);
    }

    public StreamState withoutTopics(Collection<String> topicNames) {
        Map<String, TopicState> copy = new LinkedHashMap<>(topics);
        copy.keySet().removeAll(topicNames);
        return new StreamState(streamId, copy);
    }

    /** Same key, only the topics matching {@code filter}. */
    public StreamState restrictTo(Predicate<TopicState> filter) {
        Map<String, TopicState> copy = new LinkedHashMap<>();
        topics.forEach((name, ts) -> {
            if (filter.test(ts)) copy.put(name, ts);
        });
        return new StreamState(streamId, copy);
    }
}
