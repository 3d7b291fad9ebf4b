package com.orderguard.inmemory;

import com.orderguard.common.ITimeService;
import com.orderguard.consumer.SubscriptionConfig;
import com.orderguard.consumer.abstraction.BrokerBindings;
import com.orderguard.consumer.abstraction.BrokerException;
import com.orderguard.consumer.abstraction.Cancellation;
import com.orderguard.consumer.abstraction.KeyHashRange;
import com.orderguard.consumer.abstraction.KeyHashRanges;
import com.orderguard.consumer.abstraction.KeyHasher;
import com.orderguard.consumer.abstraction.MessageContext;
import com.orderguard.consumer.failurestate.StreamState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * A single-process broker with key-shared subscriptions, positional readers and control topics.
 * Used for local runs and for end-to-end tests of the ordered consumer.
 * <p>
 * Thread safe: every operation runs under one lock, and waiting receivers are woken on publish.
 */
public final class InMemoryBroker<T> {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryBroker.class);

    public static final int DEFAULT_HASH_SPACE = 65536;

    private final ITimeService time;
    private final int hashSpace;
    private final KeyHasher hasher;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition published = lock.newCondition();
    private final Map<String, InMemoryTopic<T>> topics = new HashMap<>();
    private final Map<String, InMemoryTopic<StreamState>> controlTopics = new HashMap<>();
    private final Map<String, InMemorySubscription> subscriptions = new HashMap<>();

    public InMemoryBroker(ITimeService time) {
        this(time, DEFAULT_HASH_SPACE, defaultHasher(DEFAULT_HASH_SPACE));
    }

    public InMemoryBroker(ITimeService time, int hashSpace, KeyHasher hasher) {
        if (hashSpace < 1) throw new IllegalArgumentException("hashSpace must be >= 1 but was " + hashSpace);
        this.time = Objects.requireNonNull(time, "time");
        this.hashSpace = hashSpace;
        this.hasher = Objects.requireNonNull(hasher, "hasher");
    }

    public static KeyHasher defaultHasher(int hashSpace) {
        return key -> Math.floorMod(key.hashCode(), hashSpace);
    }

    public KeyHasher hasher() {
        return hasher;
    }

    public int hashSpace() {
        return hashSpace;
    }

    // ---- topics ----

    public void createTopic(String topic) {
        locked(() -> topics.computeIfAbsent(topic, InMemoryTopic::new));
    }

    public void deleteTopic(String topic) {
        locked(() -> topics.remove(topic));
    }

    public boolean topicExists(String topic) {
        return locked(() -> topics.containsKey(topic));
    }

    /** Appends to the topic, creating it if needed. */
    public MessageContext<T> publish(String topic, String key, T payload) {
        Objects.requireNonNull(key, "key");
        return locked(() -> {
            MessageContext<T> m = topics.computeIfAbsent(topic, InMemoryTopic::new).append(key, payload, time.currentTimeMillis());
            published.signalAll();
            return m;
        });
    }

    public List<MessageContext<T>> messages(String topic) {
        return locked(() -> {
            InMemoryTopic<T> t = topics.get(topic);
            return t == null ? List.<MessageContext<T>>of() : t.snapshot();
        });
    }

    // ---- subscriptions ----

    public InMemoryBrokerConsumer<T> subscribe(SubscriptionConfig config, String consumerName) {
        return locked(() -> {
            for (String t : config.topics()) {
                if (!topics.containsKey(t)) throw new BrokerException("Topic " + t + " does not exist");
            }
            InMemorySubscription sub = subscriptions.computeIfAbsent(config.subscriptionName(),
                    name -> new InMemorySubscription(name, config.topics(), hashSpace, hasher));
            if (!sub.topics().equals(config.topics()))
                throw new BrokerException("Subscription " + sub.name() + " is on " + sub.topics() + ", not " + config.topics());
            if (sub.isConnected(consumerName))
                throw new BrokerException("Consumer " + consumerName + " is already connected to " + sub.name());
            sub.connect(consumerName);
            LOG.debug("{} joined subscription {}", consumerName, sub.name());
            return new InMemoryBrokerConsumer<>(this, sub, consumerName, config.batchSize());
        });
    }

    public KeyHashRanges ownedRanges(String subscriptionName, String consumerName) {
        return locked(() -> {
            InMemorySubscription sub = subscriptions.get(subscriptionName);
            Optional<KeyHashRange> range = sub == null ? Optional.empty() : sub.rangeOf(consumerName);
            return new KeyHashRanges(range.map(Set::of).orElse(Set.of()), hasher);
        });
    }

    /** Unacknowledged messages of the subscription on {@code topic}. */
    public int backlog(String subscriptionName, String topic) {
        return locked(() -> {
            InMemorySubscription sub = subscriptions.get(subscriptionName);
            InMemoryTopic<T> t = topics.get(topic);
            if (sub == null || t == null) return 0;
            return sub.backlog(topic, t.size());
        });
    }

    List<MessageContext<T>> receive(InMemorySubscription sub, String consumerName, int max,
                                    Duration timeout, Cancellation cancellation) {
        long deadline = System.nanoTime() + timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                List<MessageContext<T>> batch = sub.take(consumerName, topics::get, max);
                if (!batch.isEmpty() || cancellation.isCancelled()) return batch;
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) return List.of();
                awaitPublish(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(50)));
            }
        } finally {
            lock.unlock();
        }
    }

    void acknowledge(InMemorySubscription sub, Collection<MessageContext<T>> messages) {
        locked(() -> {
            messages.forEach(sub::ack);
            return null;
        });
    }

    void release(InMemorySubscription sub, Collection<MessageContext<T>> messages) {
        locked(() -> {
            messages.forEach(sub::release);
            published.signalAll();
            return null;
        });
    }

    void disconnect(InMemorySubscription sub, String consumerName) {
        locked(() -> {
            sub.disconnect(consumerName);
            published.signalAll();
            return null;
        });
    }

    // ---- positional reads ----

    int size(String topic) {
        return locked(() -> {
            InMemoryTopic<T> t = topics.get(topic);
            if (t == null) throw new BrokerException("Topic " + topic + " does not exist");
            return t.size();
        });
    }

    Optional<MessageContext<T>> read(String topic, int index, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                InMemoryTopic<T> t = topics.get(topic);
                if (t == null) throw new BrokerException("Topic " + topic + " does not exist");
                if (index < t.size()) return Optional.of(t.get(index));
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) return Optional.empty();
                awaitPublish(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(50)));
            }
        } finally {
            lock.unlock();
        }
    }

    // ---- control topics ----

    void publishControl(String topic, StreamState state) {
        locked(() -> controlTopics.computeIfAbsent(topic, InMemoryTopic::new)
                .append(state.streamId(), state, time.currentTimeMillis()));
    }

    List<StreamState> readControl(String topic, int fromIndex) {
        return locked(() -> {
            InMemoryTopic<StreamState> t = controlTopics.get(topic);
            if (t == null) return List.<StreamState>of();
            return t.snapshot().subList(fromIndex, t.size()).stream().map(MessageContext::payload).toList();
        });
    }

    /** Wires every collaborator of the ordered consumer to this broker. */
    public BrokerBindings<T> bindings(SubscriptionConfig config) {
        return new BrokerBindings<>(
                this::subscribe,
                new InMemoryTopicAdmin(this),
                new InMemoryTopicReaderFactory<>(this),
                new InMemoryKeyHashRangeProvider(this),
                new InMemoryControlTopic(this, config.failureStateTopic()),
                List.of());
    }

    private void awaitPublish(long nanos) {
        try {
            published.awaitNanos(nanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException("Interrupted while waiting for messages", e);
        }
    }

    private <R> R locked(Supplier<R> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
