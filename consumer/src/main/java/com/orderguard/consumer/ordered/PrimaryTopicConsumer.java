package com.orderguard.consumer.ordered;

import com.orderguard.consumer.SubscriptionConfig;
import com.orderguard.consumer.abstraction.AlreadyClosedException;
import com.orderguard.consumer.abstraction.BrokerConsumer;
import com.orderguard.consumer.abstraction.BrokerConsumerFactory;
import com.orderguard.consumer.abstraction.Cancellation;
import com.orderguard.consumer.abstraction.MessageContext;
import com.orderguard.consumer.abstraction.TopicAdmin;
import com.orderguard.consumer.abstraction.TopicConsumer;
import com.orderguard.consumer.abstraction.TransientBrokerException;
import com.orderguard.consumer.failurestate.StreamFailureState;
import com.orderguard.consumer.failurestate.TopicState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Normal phase: live messages from the subscription, minus those of keys that recovery owns.
 * <p>
 * Every received message is acknowledged at the broker on finalize, delivered or not. From then on the
 * failure state is what brings a failed key's messages back, by positional replay.
 * <p>
 * SINGLE-THREADED.
 */
public final class PrimaryTopicConsumer<T> implements TopicConsumer<T> {
    private static final Logger LOG = LoggerFactory.getLogger(PrimaryTopicConsumer.class);

    private final SubscriptionConfig config;
    private final String consumerName;
    private final BrokerConsumerFactory<T> consumerFactory;
    private final TopicAdmin topicAdmin;
    private final StreamFailureState failureState;

    private BrokerConsumer<T> consumer;
    private List<MessageContext<T>> received = List.of();
    private boolean closed;

    public PrimaryTopicConsumer(SubscriptionConfig config,
                                String consumerName,
                                BrokerConsumerFactory<T> consumerFactory,
                                TopicAdmin topicAdmin,
                                StreamFailureState failureState) {
        this.config = Objects.requireNonNull(config, "config");
        this.consumerName = Objects.requireNonNull(consumerName, "consumerName");
        this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory");
        this.topicAdmin = Objects.requireNonNull(topicAdmin, "topicAdmin");
        this.failureState = Objects.requireNonNull(failureState, "failureState");
    }

    /** Creates missing topics and subscribes, once. Failures propagate and leave it unsubscribed. */
    public void ensureSubscribed() {
        if (consumer != null) return;
        if (closed) throw new AlreadyClosedException("PrimaryTopicConsumer " + consumerName + " is closed");
        for (String topic : config.topics()) topicAdmin.ensureTopicExists(topic);
        consumer = consumerFactory.subscribe(config, consumerName);
        LOG.info("{} subscribed to {} as {}", consumerName, config.topics(), config.subscriptionName());
    }

    @Override
    public List<MessageContext<T>> nextBatch(Cancellation cancellation) {
        ensureSubscribed();
        received = List.of();
        List<MessageContext<T>> messages;
        try {
            messages = consumer.batchReceive(config.batchTimeout(), cancellation);
        } catch (AlreadyClosedException e) {
            LOG.debug("{} receive after close: {}", consumerName, e.getMessage());
            return List.of();
        } catch (TransientBrokerException e) {
            LOG.warn("{} receive failed, will try again: {}", consumerName, e.getMessage(), e);
            return List.of();
        }
        if (messages.isEmpty()) return List.of();
        if (cancellation.isCancelled()) {
            consumer.negativeAcknowledge(messages);
            return List.of();
        }
        List<MessageContext<T>> deliver = new ArrayList<>(messages.size());
        for (MessageContext<T> m : messages) {
            if (deliverable(m)) deliver.add(m);
        }
        if (deliver.size() < messages.size())
            LOG.debug("{} withheld {} of {} messages for keys under recovery", consumerName, messages.size() - deliver.size(), messages.size());
        // an empty batch is never finalized, so a fully withheld batch is acknowledged here
        if (deliver.isEmpty()) {
            acknowledge(messages);
            return List.of();
        }
        received = messages;
        return deliver;
    }

    private boolean deliverable(MessageContext<T> m) {
        Optional<TopicState> state = failureState.find(m.topicStream());
        if (state.isEmpty()) return true;
        TopicState ts = state.get();
        return ts.upToDate() && m.sequenceId() > ts.lastSequenceId();
    }

    @Override
    public void finalizeBatch(List<MessageContext<T>> acks, List<MessageContext<T>> nacks) {
        if (received.isEmpty()) return;
        List<MessageContext<T>> batch = received;
        received = List.of();
        try {
            for (BatchOutcomes.Outcome<T> outcome : BatchOutcomes.group(acks, nacks)) {
                if (outcome.failed()) {
                    failureState.messageFailed(outcome.firstNack());
                    continue;
                }
                Optional<TopicState> tracked = failureState.find(outcome.topicStream());
                if (tracked.isEmpty()) continue;
                failureState.messageSucceeded(outcome.lastLeadingAck());
                if (tracked.get().upToDate())
                    failureState.streamTopicsResolved(outcome.topicStream().streamId(), List.of(outcome.topicStream().topic()));
            }
        } catch (RuntimeException e) {
            LOG.error("{} could not record failure state; returning {} messages to the broker", consumerName, batch.size(), e);
            consumer.negativeAcknowledge(batch);
            throw e;
        }
        acknowledge(batch);
    }

    /** Failure state is already persisted, so a lost acknowledgement only means redelivery. */
    private void acknowledge(List<MessageContext<T>> messages) {
        try {
            consumer.acknowledge(messages);
        } catch (AlreadyClosedException e) {
            LOG.debug("{} acknowledge after close: {}", consumerName, e.getMessage());
        } catch (TransientBrokerException e) {
            LOG.warn("{} could not acknowledge {} messages; they will be redelivered: {}", consumerName, messages.size(), e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (consumer != null) consumer.close();
    }
}
