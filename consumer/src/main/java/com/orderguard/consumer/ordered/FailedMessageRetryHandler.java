package com.orderguard.consumer.ordered;

import com.orderguard.consumer.SubscriptionConfig;
import com.orderguard.consumer.abstraction.BrokerException;
import com.orderguard.consumer.abstraction.Cancellation;
import com.orderguard.consumer.abstraction.KeyHashRanges;
import com.orderguard.consumer.abstraction.MessageContext;
import com.orderguard.consumer.abstraction.TopicConsumer;
import com.orderguard.consumer.abstraction.TopicReader;
import com.orderguard.consumer.abstraction.TopicReaderFactory;
import com.orderguard.consumer.abstraction.TopicStream;
import com.orderguard.consumer.failurestate.StreamFailureState;
import com.orderguard.consumer.failurestate.StreamState;
import com.orderguard.consumer.failurestate.TopicState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Recovery phase: re-reads the history of failed keys whose backoff has elapsed, from the failed message
 * onward, by positional read. Positional reads ignore acknowledgement state, so a key comes back in the
 * order it was published.
 * <p>
 * A (topic, key) is replayed only when the key falls in the ranges owned on that topic. The broker assigns
 * each topic separately, so one key can belong to different consumers on different topics. Until ranges
 * are pushed in nothing is replayed.
 * <p>
 * SINGLE-THREADED.
 */
public final class FailedMessageRetryHandler<T> implements TopicConsumer<T> {
    private static final Logger LOG = LoggerFactory.getLogger(FailedMessageRetryHandler.class);

    private final SubscriptionConfig config;
    private final StreamFailureState failureState;
    private final TopicReaderFactory<T> readerFactory;
    private final DeadLetterSink<T> deadLetterSink;

    private Map<String, KeyHashRanges> keyHashRanges;
    /** For each (topic, key) in the last batch: did the read reach the head. */
    private final Map<TopicStream, Boolean> reachedHead = new HashMap<>();

    public FailedMessageRetryHandler(SubscriptionConfig config,
                                     StreamFailureState failureState,
                                     TopicReaderFactory<T> readerFactory,
                                     DeadLetterSink<T> deadLetterSink) {
        this.config = Objects.requireNonNull(config, "config");
        this.failureState = Objects.requireNonNull(failureState, "failureState");
        this.readerFactory = Objects.requireNonNull(readerFactory, "readerFactory");
        this.deadLetterSink = Objects.requireNonNull(deadLetterSink, "deadLetterSink");
    }

    /** Owned ranges by topic. A topic missing from the map is owned nowhere. */
    public void setKeyHashRanges(Map<String, KeyHashRanges> keyHashRanges) {
        this.keyHashRanges = Map.copyOf(keyHashRanges);
    }

    private boolean owns(String topic, String key) {
        KeyHashRanges ranges = keyHashRanges.get(topic);
        return ranges != null && ranges.ownsKey(key);
    }

    @Override
    public List<MessageContext<T>> nextBatch(Cancellation cancellation) {
        reachedHead.clear();
        if (keyHashRanges == null) return List.of();

        List<MessageContext<T>> batch = new ArrayList<>();
        Map<TopicStream, Boolean> progress = new HashMap<>();
        List<TopicStream> nothingToReplay = new ArrayList<>();
        try {
            outer:
            for (StreamState stream : failureState.streamsForRetry()) {
                for (TopicState ts : stream.topics().values()) {
                    if (batch.size() >= config.replayBatchSize()) break outer;
                    if (!owns(ts.topicName(), stream.streamId())) continue;
                    if (cancellation.isCancelled()) return List.of();
                    TopicStream topicStream = new TopicStream(ts.topicName(), stream.streamId());
                    List<MessageContext<T>> found = new ArrayList<>();
                    Optional<Boolean> head = replay(topicStream, ts.replayFrom(), batch.size(), found, cancellation);
                    if (head.isEmpty()) return List.of();
                    if (!found.isEmpty()) {
                        batch.addAll(found);
                        progress.put(topicStream, head.get());
                    } else if (head.get()) {
                        if (ts.failurePending())
                            LOG.warn("{} failed at {} but nothing is readable from there; will look again after backoff", topicStream, ts.replayFrom());
                        else
                            nothingToReplay.add(topicStream);
                    }
                }
            }
        } catch (BrokerException e) {
            LOG.error("Replay of failed streams failed", e);
            throw e;
        }

        for (TopicStream ts : nothingToReplay)
            failureState.streamTopicsUpToDate(ts.streamId(), List.of(ts.topic()));
        reachedHead.putAll(progress);
        return batch;
    }

    /**
     * Reads {@code topicStream.streamId()}'s messages from {@code from} into {@code found}.
     *
     * @return whether the head was reached; empty if cancelled
     */
    private Optional<Boolean> replay(TopicStream topicStream, long from, int alreadyInBatch,
                                     List<MessageContext<T>> found, Cancellation cancellation) {
        try (TopicReader<T> reader = readerFactory.createReader(topicStream.topic(), topicStream.streamId())) {
            reader.seek(from);
            while (alreadyInBatch + found.size() < config.replayBatchSize()) {
                if (cancellation.isCancelled()) return Optional.empty();
                if (!reader.hasMoreAvailable()) return Optional.of(true);
                Optional<MessageContext<T>> next = reader.readNext(config.readTimeout());
                if (next.isEmpty()) return Optional.of(false);
                MessageContext<T> m = next.get();
                if (m.key().equals(topicStream.streamId()) && m.sequenceId() >= from) found.add(m);
            }
            return Optional.of(!reader.hasMoreAvailable());
        }
    }

    @Override
    public void finalizeBatch(List<MessageContext<T>> acks, List<MessageContext<T>> nacks) {
        for (BatchOutcomes.Outcome<T> outcome : BatchOutcomes.group(acks, nacks)) {
            TopicStream ts = outcome.topicStream();
            if (outcome.lastLeadingAck() != null) failureState.messageSucceeded(outcome.lastLeadingAck());
            if (outcome.failed()) {
                failed(outcome.firstNack());
            } else if (reachedHead.getOrDefault(ts, false)) {
                failureState.streamTopicsUpToDate(ts.streamId(), List.of(ts.topic()));
            }
        }
        reachedHead.clear();
    }

    private void failed(MessageContext<T> message) {
        if (config.retriesCapped()) {
            Optional<TopicState> state = failureState.find(message.topicStream());
            if (state.isPresent() && state.get().failurePending()
                    && state.get().lastSequenceId() == message.sequenceId()
                    && state.get().timesRetried() >= config.maxRetries()) {
                deadLetterSink.deadLetter(message, state.get().timesRetried());
                failureState.messageSucceeded(message);
                return;
            }
        }
        failureState.messageFailed(message);
    }

    @Override
    public void close() {
        reachedHead.clear();
    }
}
