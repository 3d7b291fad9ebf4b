package com.orderguard.inmemory;

import com.orderguard.common.ITimeService;
import com.orderguard.common.metrics.Metrics;
import com.orderguard.consumer.SubscriptionConfig;
import com.orderguard.consumer.abstraction.Cancellation;
import com.orderguard.consumer.abstraction.KeyHasher;
import com.orderguard.consumer.abstraction.MessageContext;
import com.orderguard.consumer.abstraction.TopicStream;
import com.orderguard.consumer.failurestate.FailureStateTopic;
import com.orderguard.consumer.failurestate.StreamFailureState;
import com.orderguard.consumer.failurestate.TopicState;
import com.orderguard.consumer.ordered.DeadLetterSink;
import com.orderguard.consumer.ordered.OrderGuaranteedConsumer;
import com.orderguard.consumer.subscription.StreamConsumer;
import com.orderguard.consumer.subscription.Subscription;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

import static org.junit.jupiter.api.Assertions.*;

class OrderGuaranteedConsumerScenarioTest {

    static final class FakeTime implements ITimeService {
        private long now;
        FakeTime(long start) { this.now = start; }
        @Override public long currentTimeMillis() { return now; }
        void set(long t) { this.now = t; }
        void advance(long d) { this.now += d; }
    }

    private static final String TOPIC = "accounts";

    private FakeTime time;
    private InMemoryBroker<String> broker;
    private SubscriptionConfig config;
    private final List<OrderGuaranteedConsumer<String>> opened = new ArrayList<>();

    @BeforeEach
    void setUp() {
        time = new FakeTime(1_000);
        broker = new InMemoryBroker<>(time);
        config = SubscriptionConfig.defaults(List.of(TOPIC), "billing").withoutWaits();
    }

    @AfterEach
    void tearDown() {
        opened.forEach(OrderGuaranteedConsumer::close);
    }

    private OrderGuaranteedConsumer<String> consumer(InMemoryBroker<String> b, String name) {
        OrderGuaranteedConsumer<String> c = OrderGuaranteedConsumer.create(config, name, b.bindings(config), time,
                Metrics.nullMetrics, DeadLetterSink.logging());
        opened.add(c);
        return c;
    }

    /** Independent view of the persisted failure state, as another process would see it. */
    private TopicState persisted(InMemoryBroker<String> b, String key) {
        StreamFailureState view = new StreamFailureState(
                new FailureStateTopic(new InMemoryControlTopic(b, config.failureStateTopic())),
                config.retrySchedule(), time, Metrics.nullMetrics);
        view.initialize();
        return view.find(new TopicStream(TOPIC, key)).orElse(null);
    }

    @Test
    @DisplayName("nacked key is held back, replayed from the failure after backoff, then flows and resolves")
    void nack_then_replay_then_resolve() {
        OrderGuaranteedConsumer<String> c = consumer(broker, "c1");
        MessageContext<String> a1 = broker.publish(TOPIC, "acct-1", "a1");
        MessageContext<String> b2 = broker.publish(TOPIC, "acct-2", "b2");

        assertEquals(List.of(a1, b2), c.nextBatch(Cancellation.NONE));
        c.finalizeBatch(List.of(b2), List.of(a1));

        TopicState failed = persisted(broker, "acct-1");
        assertEquals(0, failed.timesRetried());
        assertEquals(a1.publishTime() + 5_000, failed.nextRetry());
        assertNull(persisted(broker, "acct-2"));

        MessageContext<String> a3 = broker.publish(TOPIC, "acct-1", "a3");
        MessageContext<String> b4 = broker.publish(TOPIC, "acct-2", "b4");
        assertEquals(List.of(b4), c.nextBatch(Cancellation.NONE));
        c.finalizeBatch(List.of(b4), List.of());

        assertTrue(c.nextBatch(Cancellation.NONE).isEmpty());

        time.set(6_000);
        assertEquals(List.of(a1, a3), c.nextBatch(Cancellation.NONE));
        c.finalizeBatch(List.of(a1, a3), List.of());
        assertTrue(persisted(broker, "acct-1").upToDate());

        MessageContext<String> a5 = broker.publish(TOPIC, "acct-1", "a5");
        assertEquals(List.of(a5), c.nextBatch(Cancellation.NONE));
        c.finalizeBatch(List.of(a5), List.of());

        assertNull(persisted(broker, "acct-1"));
        assertEquals(0, c.trackedStreamCount());
        assertEquals(0, broker.backlog("billing", TOPIC));
    }

    @Test
    void failing_replay_counts_the_retry_and_unrelated_keys_keep_flowing() {
        OrderGuaranteedConsumer<String> c = consumer(broker, "c1");
        MessageContext<String> a1 = broker.publish(TOPIC, "acct-1", "a1");
        c.nextBatch(Cancellation.NONE);
        c.finalizeBatch(List.of(), List.of(a1));

        time.set(6_000);
        assertEquals(List.of(a1), c.nextBatch(Cancellation.NONE));
        c.finalizeBatch(List.of(), List.of(a1));
        TopicState again = persisted(broker, "acct-1");
        assertEquals(1, again.timesRetried());
        assertEquals(a1.publishTime() + 5_000, again.nextRetry());

        MessageContext<String> b2 = broker.publish(TOPIC, "acct-2", "b2");
        assertEquals(List.of(b2), c.nextBatch(Cancellation.NONE));
        c.finalizeBatch(List.of(b2), List.of());
        assertEquals(1, c.trackedStreamCount());
    }

    @Test
    @DisplayName("only the owner of a key's hash range replays it")
    void replay_is_confined_to_the_owner() {
        KeyHasher hasher = key -> key.startsWith("low") ? 10 : 150;
        InMemoryBroker<String> shared = new InMemoryBroker<>(time, 200, hasher);
        OrderGuaranteedConsumer<String> c1 = consumer(shared, "c1");
        OrderGuaranteedConsumer<String> c2 = consumer(shared, "c2");

        assertTrue(c1.nextBatch(Cancellation.NONE).isEmpty());
        assertTrue(c2.nextBatch(Cancellation.NONE).isEmpty());

        MessageContext<String> low = shared.publish(TOPIC, "low-1", "x");
        MessageContext<String> high = shared.publish(TOPIC, "high-1", "y");
        assertEquals(List.of(high), c2.nextBatch(Cancellation.NONE));
        c2.finalizeBatch(List.of(high), List.of());

        // c1 refreshes its ranges after a minute and now owns [0,100) only
        time.set(61_000);
        List<MessageContext<String>> first = c1.nextBatch(Cancellation.NONE);
        assertEquals(List.of(low), first);
        c1.finalizeBatch(List.of(), first);

        time.set(200_000);
        for (int i = 0; i < 4; i++) {
            assertTrue(c2.nextBatch(Cancellation.NONE).isEmpty(), "c2 must never replay low-1");
        }
        List<MessageContext<String>> replay = c1.nextBatch(Cancellation.NONE);
        if (replay.isEmpty()) replay = c1.nextBatch(Cancellation.NONE);
        assertEquals(List.of(low), replay);
    }

    @Test
    void failure_state_survives_a_restart() {
        OrderGuaranteedConsumer<String> first = consumer(broker, "c1");
        MessageContext<String> a1 = broker.publish(TOPIC, "acct-1", "a1");
        first.nextBatch(Cancellation.NONE);
        first.finalizeBatch(List.of(), List.of(a1));
        first.close();

        OrderGuaranteedConsumer<String> second = consumer(broker, "c1");
        MessageContext<String> a2 = broker.publish(TOPIC, "acct-1", "a2");
        assertTrue(second.nextBatch(Cancellation.NONE).isEmpty());
        assertEquals(1, second.trackedStreamCount());

        time.set(6_000);
        List<MessageContext<String>> replay = second.nextBatch(Cancellation.NONE);
        if (replay.isEmpty()) replay = second.nextBatch(Cancellation.NONE);
        assertEquals(List.of(a1, a2), replay);
    }

    @Test
    void capped_retries_dead_letter_and_release_the_key() {
        config = config.withMaxRetries(0);
        List<MessageContext<String>> deadLetters = new ArrayList<>();
        Map<String, LongAdder> counters = new ConcurrentHashMap<>();
        OrderGuaranteedConsumer<String> c = OrderGuaranteedConsumer.create(config, "c1", broker.bindings(config), time,
                Metrics.memoryMetrics(counters), (m, retried) -> deadLetters.add(m));
        opened.add(c);
        MessageContext<String> poison = broker.publish(TOPIC, "acct-1", "poison");
        MessageContext<String> next = broker.publish(TOPIC, "acct-1", "next");

        c.nextBatch(Cancellation.NONE);
        c.finalizeBatch(List.of(), List.of(poison, next));

        time.set(6_000);
        assertEquals(List.of(poison, next), c.nextBatch(Cancellation.NONE));
        c.finalizeBatch(List.of(), List.of(poison, next));
        assertEquals(List.of(poison), deadLetters);

        List<MessageContext<String>> after = c.nextBatch(Cancellation.NONE);
        if (after.isEmpty()) after = c.nextBatch(Cancellation.NONE);
        assertEquals(List.of(next), after);
        assertEquals(1, counters.get("failureState.messageFailed").sum());
    }

    @Test
    @DisplayName("with failures and replays mixed into live traffic, every key is processed once and in order")
    void keys_are_processed_in_publish_order() {
        OrderGuaranteedConsumer<String> c = consumer(broker, "c1");
        Map<String, List<Long>> published = new HashMap<>();
        Map<String, List<Long>> processed = new HashMap<>();
        Set<Long> attempted = new HashSet<>();

        // every fifth message fails on its first attempt; later messages of its key in the same batch are nacked too
        StreamConsumer<String> handler = context -> {
            Set<String> failedKeys = new HashSet<>();
            for (MessageContext<String> m : context.messages()) {
                boolean firstAttempt = attempted.add(m.sequenceId());
                if (failedKeys.contains(m.key()) || (firstAttempt && m.sequenceId() % 5 == 0)) {
                    failedKeys.add(m.key());
                    context.nack(m);
                } else {
                    processed.computeIfAbsent(m.key(), k -> new ArrayList<>()).add(m.sequenceId());
                }
            }
        };
        Subscription<String> subscription = new Subscription<>(c, handler, Duration.ZERO);

        for (int i = 0; i < 400 && !processed.equals(published); i++) {
            if (i < 20) {
                for (int j = 0; j < 2; j++) {
                    String key = "acct-" + ((i * 2 + j) % 4);
                    MessageContext<String> m = broker.publish(TOPIC, key, key + "@" + i);
                    published.computeIfAbsent(key, k -> new ArrayList<>()).add(m.sequenceId());
                }
            }
            subscription.runOnce(Cancellation.NONE);
            time.advance(1_000);
        }

        assertEquals(published, processed);
        assertTrue(attempted.size() >= 40);
    }
}
