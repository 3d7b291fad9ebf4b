package com.orderguard.consumer.subscription;

import com.orderguard.consumer.abstraction.MessageContext;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class SubscriptionContext<T> {
    private final List<MessageContext<T>> messages;
    private final Map<MessageContext<T>, Boolean> nacked = new IdentityHashMap<>();

    public SubscriptionContext(List<MessageContext<T>> messages) {
        this.messages = List.copyOf(Objects.requireNonNull(messages, "messages"));
    }

    public List<MessageContext<T>> messages() {
        return messages;
    }

    public void nack(MessageContext<T> message) {
        Objects.requireNonNull(message, "message");
        if (!messages.contains(message))
            throw new IllegalArgumentException(message + " is not part of this batch");
        for (MessageContext<T> m : messages) {
            if (m.equals(message)) nacked.put(m, Boolean.TRUE);
        }
    }

    public void nackAll() {
        for (MessageContext<T> m : messages) nacked.put(m, Boolean.TRUE);
    }

    public List<MessageContext<T>> acks() {
        List<MessageContext<T>> out = new ArrayList<>();
        for (MessageContext<T> m : messages) {
            if (!nacked.containsKey(m)) out.add(m);
        }
        return out;
    }

    public List<MessageContext<T>> nacks() {
        List<MessageContext<T>> out = new ArrayList<>();
        for (MessageContext<T> m : messages) {
            if (nacked.containsKey(m)) out.add(m);
        }
        return out;
    }
}
