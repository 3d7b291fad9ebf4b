package com.orderguard.inmemory;

import com.orderguard.consumer.abstraction.AlreadyClosedException;
import com.orderguard.consumer.abstraction.BrokerConsumer;
import com.orderguard.consumer.abstraction.Cancellation;
import com.orderguard.consumer.abstraction.MessageContext;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

public final class InMemoryBrokerConsumer<T> implements BrokerConsumer<T> {
    private final InMemoryBroker<T> broker;
    private final InMemorySubscription subscription;
    private final String consumerName;
    private final int maxBatch;
    private volatile boolean closed;

    InMemoryBrokerConsumer(InMemoryBroker<T> broker, InMemorySubscription subscription, String consumerName, int maxBatch) {
        this.broker = broker;
        this.subscription = subscription;
        this.consumerName = consumerName;
        this.maxBatch = maxBatch;
    }

    public String consumerName() {
        return consumerName;
    }

    @Override
    public List<MessageContext<T>> batchReceive(Duration timeout, Cancellation cancellation) {
        checkOpen();
        return broker.receive(subscription, consumerName, maxBatch, timeout, cancellation);
    }

    @Override
    public void acknowledge(Collection<MessageContext<T>> messages) {
        checkOpen();
        broker.acknowledge(subscription, messages);
    }

    @Override
    public void negativeAcknowledge(Collection<MessageContext<T>> messages) {
        checkOpen();
        broker.release(subscription, messages);
    }

    private void checkOpen() {
        if (closed) throw new AlreadyClosedException(consumerName + " is closed");
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        broker.disconnect(subscription, consumerName);
    }
}
