package com.orderguard.inmemory;

import com.orderguard.consumer.abstraction.MessageContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only log of one topic. Sequence ids start at 1 and are contiguous, so the message with
 * sequence id {@code s} sits at index {@code s - 1}.
 * <p>
 * Guarded by the owning broker's lock.
 */
final class InMemoryTopic<T> {
    private final String name;
    private final List<MessageContext<T>> messages = new ArrayList<>();

    InMemoryTopic(String name) {
        this.name = name;
    }

    String name() {
        return name;
    }

    MessageContext<T> append(String key, T payload, long publishTime) {
        MessageContext<T> m = new MessageContext<>(name, 0, key, messages.size() + 1L, publishTime, payload);
        messages.add(m);
        return m;
    }

    MessageContext<T> get(int index) {
        return messages.get(index);
    }

    int size() {
        return messages.size();
    }

    static int indexOf(long sequenceId) {
        return (int) Math.max(0, sequenceId - 1);
    }

    List<MessageContext<T>> snapshot() {
        return List.copyOf(messages);
    }
}
