package com.orderguard.consumer.ordered;

import com.orderguard.common.ITimeService;
import com.orderguard.common.metrics.Metrics;
import com.orderguard.consumer.SubscriptionConfig;
import com.orderguard.consumer.abstraction.AlreadyClosedException;
import com.orderguard.consumer.abstraction.BrokerBindings;
import com.orderguard.consumer.abstraction.BrokerException;
import com.orderguard.consumer.abstraction.Cancellation;
import com.orderguard.consumer.abstraction.KeyHashRangeProvider;
import com.orderguard.consumer.abstraction.KeyHashRanges;
import com.orderguard.consumer.abstraction.MessageContext;
import com.orderguard.consumer.abstraction.TopicConsumer;
import com.orderguard.consumer.failurestate.FailureStateTopic;
import com.orderguard.consumer.failurestate.StreamFailureState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Consumer that keeps per-key order even when messages are nacked.
 * <p>
 * Broker redelivery after a nack can overtake later messages of the same key, so nacks are never handed
 * back to the broker. Instead the failure is recorded per key, the key's live messages are held back, and
 * once the backoff has passed the key is replayed from the failed message by positional read. Calls
 * alternate between a recovery turn and a normal turn; a recovery turn with nothing to replay falls
 * through to the normal source, so live traffic never waits on an idle recovery phase.
 * <p>
 * SINGLE-THREADED: drive {@link #nextBatch} and {@link #finalizeBatch} from one thread.
 */
public final class OrderGuaranteedConsumer<T> implements TopicConsumer<T> {
    private static final Logger LOG = LoggerFactory.getLogger(OrderGuaranteedConsumer.class);

    private final SubscriptionConfig config;
    private final String consumerName;
    private final StreamFailureState failureState;
    private final PrimaryTopicConsumer<T> primary;
    private final FailedMessageRetryHandler<T> retryHandler;
    private final KeyHashRangeProvider keyHashRangeProvider;
    private final OnCheckTimer rangeRefreshTimer;
    private final Metrics metrics;
    private final List<AutoCloseable> ownedResources;
    private final Map<BatchPhase, TopicConsumer<T>> phaseHandlers = new EnumMap<>(BatchPhase.class);

    private BatchPhase phase = BatchPhase.NORMAL;
    private Map<String, KeyHashRanges> keyHashRanges;
    private boolean closed;

    public OrderGuaranteedConsumer(SubscriptionConfig config,
                                   String consumerName,
                                   StreamFailureState failureState,
                                   PrimaryTopicConsumer<T> primary,
                                   FailedMessageRetryHandler<T> retryHandler,
                                   KeyHashRangeProvider keyHashRangeProvider,
                                   ITimeService time,
                                   Metrics metrics,
                                   List<AutoCloseable> ownedResources) {
        this.config = Objects.requireNonNull(config, "config");
        this.consumerName = Objects.requireNonNull(consumerName, "consumerName");
        this.failureState = Objects.requireNonNull(failureState, "failureState");
        this.primary = Objects.requireNonNull(primary, "primary");
        this.retryHandler = Objects.requireNonNull(retryHandler, "retryHandler");
        this.keyHashRangeProvider = Objects.requireNonNull(keyHashRangeProvider, "keyHashRangeProvider");
        this.rangeRefreshTimer = new OnCheckTimer(config.rangeRefreshInterval(), Objects.requireNonNull(time, "time"));
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.ownedResources = List.copyOf(ownedResources);
        phaseHandlers.put(BatchPhase.NORMAL, primary);
        phaseHandlers.put(BatchPhase.FAILURE_RETRY, retryHandler);
    }

    /** Wires a consumer over one broker's bindings. The bindings' control topic and resources become owned. */
    public static <T> OrderGuaranteedConsumer<T> create(SubscriptionConfig config,
                                                        String consumerName,
                                                        BrokerBindings<T> bindings,
                                                        ITimeService time,
                                                        Metrics metrics,
                                                        DeadLetterSink<T> deadLetterSink) {
        StreamFailureState failureState = new StreamFailureState(
                new FailureStateTopic(bindings.controlTopic()), config.retrySchedule(), time, metrics);
        PrimaryTopicConsumer<T> primary = new PrimaryTopicConsumer<>(
                config, consumerName, bindings.consumerFactory(), bindings.topicAdmin(), failureState);
        FailedMessageRetryHandler<T> retryHandler = new FailedMessageRetryHandler<>(
                config, failureState, bindings.readerFactory(), deadLetterSink);
        return new OrderGuaranteedConsumer<>(config, consumerName, failureState, primary, retryHandler,
                bindings.keyHashRangeProvider(), time, metrics, bindings.resources());
    }

    public static <T> OrderGuaranteedConsumer<T> create(SubscriptionConfig config, String consumerName, BrokerBindings<T> bindings) {
        return create(config, consumerName, bindings, ITimeService.real, Metrics.nullMetrics, DeadLetterSink.logging());
    }

    @Override
    public List<MessageContext<T>> nextBatch(Cancellation cancellation) {
        if (closed) throw new AlreadyClosedException("OrderGuaranteedConsumer " + consumerName + " is closed");
        phase = phase.next();

        primary.ensureSubscribed();
        failureState.initialize();

        if (keyHashRanges == null && !cancellation.await(config.rangeStabilizationDelay())) return List.of();
        if (keyHashRanges == null || rangeRefreshTimer.check()) refreshRanges();

        if (phase == BatchPhase.FAILURE_RETRY) {
            List<MessageContext<T>> replayed;
            try {
                replayed = retryHandler.nextBatch(cancellation);
            } catch (RuntimeException e) {
                LOG.error("{} error on failure phase batch retrieval", consumerName, e);
                throw e;
            }
            if (!replayed.isEmpty()) {
                LOG.info("{} failure retry processing: got {} messages in batch", consumerName, replayed.size());
                metrics.histogram("orderedConsumer.retryBatch", replayed.size());
                return replayed;
            }
            phase = phase.afterRetryAttempt(true);
        }

        List<MessageContext<T>> batch = primary.nextBatch(cancellation);
        if (!batch.isEmpty()) metrics.histogram("orderedConsumer.normalBatch", batch.size());
        return batch;
    }

    private void refreshRanges() {
        Map<String, KeyHashRanges> ranges = new HashMap<>();
        for (String topic : config.topics()) {
            KeyHashRanges owned = keyHashRangeProvider.getOwnedRanges(topic, config.subscriptionName(), consumerName);
            if (keyHashRanges == null || !owned.equals(keyHashRanges.get(topic)))
                LOG.info("{} owns key hash ranges {} of {}", consumerName, owned.ranges(), topic);
            ranges.put(topic, owned);
        }
        keyHashRanges = ranges;
        retryHandler.setKeyHashRanges(ranges);
    }

    @Override
    public void finalizeBatch(List<MessageContext<T>> acks, List<MessageContext<T>> nacks) {
        phaseHandlers.get(phase).finalizeBatch(acks, nacks);
    }

    public BatchPhase phase() {
        return phase;
    }

    public int trackedStreamCount() {
        return failureState.trackedStreamCount();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        List<AutoCloseable> closeables = new ArrayList<>();
        closeables.add(primary);
        closeables.add(retryHandler);
        closeables.add(failureState);
        closeables.addAll(ownedResources);
        BrokerException failure = null;
        for (AutoCloseable c : closeables) {
            try {
                c.close();
            } catch (Exception e) {
                if (failure == null) failure = new BrokerException("Failed to close " + consumerName, e);
                else failure.addSuppressed(e);
            }
        }
        LOG.info("{} closed", consumerName);
        if (failure != null) throw failure;
    }
}
