package com.orderguard.consumer.failurestate;

import com.orderguard.common.ITimeService;
import com.orderguard.common.metrics.Metrics;
import com.orderguard.consumer.abstraction.MessageContext;
import com.orderguard.consumer.abstraction.TopicStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-key failure index of a subscription, persisted through a {@link FailureStateTopic}.
 * <p>
 * A key enters the index on its first failure and leaves it when every topic it failed on has been
 * replayed up to the head and resolved. Every command that changes a key publishes the key's full state.
 * <p>
 * Not thread safe: owned by the single thread driving the consumer.
 */
public final class StreamFailureState implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(StreamFailureState.class);

    private final FailureStateTopic topic;
    private final RetrySchedule schedule;
    private final ITimeService time;
    private final Metrics metrics;

    public StreamFailureState(FailureStateTopic topic, RetrySchedule schedule, ITimeService time, Metrics metrics) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.time = Objects.requireNonNull(time, "time");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /** Catch the index up with the control topic. Safe to call before every batch. */
    public void initialize() {
        topic.initialize();
    }

    /** Tracked keys restricted to the topics that are due now. Keys with nothing due are left out. */
    public List<StreamState> streamsForRetry() {
        long now = time.currentTimeMillis();
        List<StreamState> result = new ArrayList<>();
        for (StreamState s : topic.all()) {
            StreamState due = s.restrictTo(ts -> ts.isDueForRetry(now));
            if (!due.tracksNothing()) result.add(due);
        }
        return result;
    }

    public List<StreamTopicState> findTopicStreams(Set<TopicStream> topicStreams) {
        List<StreamTopicState> result = new ArrayList<>();
        for (TopicStream ts : topicStreams) {
            find(ts).ifPresent(state -> result.add(new StreamTopicState(ts.streamId(), state)));
        }
        return result;
    }

    public Optional<TopicState> find(TopicStream topicStream) {
        return topic.get(topicStream.streamId()).flatMap(s -> s.topic(topicStream.topic()));
    }

    public boolean isTracked(String streamId) {
        return topic.get(streamId).isPresent();
    }

    /** Marks the named topics caught up, skipping any with a failure still pending. Publishes only on change. */
    public void streamTopicsUpToDate(String streamId, Collection<String> topicNames) {
        Optional<StreamState> existing = topic.get(streamId);
        if (existing.isEmpty()) return;
        StreamState state = existing.get();
        StreamState updated = state;
        for (String name : topicNames) {
            Optional<TopicState> ts = updated.topic(name);
            if (ts.isPresent() && !ts.get().failurePending() && !ts.get().upToDate()) {
                updated = updated.withTopic(ts.get().withUpToDate(true));
                metrics.increment("failureState.upToDate");
            }
        }
        if (updated != state) {
            LOG.debug("{} up to date on {}", streamId, topicNames);
            topic.put(updated);
        }
    }

    /**
     * Drops the named topics that are up to date and persists the key's resulting state, even when nothing
     * was dropped. A key with no topics left leaves the index.
     */
    public void streamTopicsResolved(String streamId, Collection<String> topicNames) {
        Optional<StreamState> existing = topic.get(streamId);
        if (existing.isEmpty()) return;
        StreamState state = existing.get();
        List<String> resolved = new ArrayList<>();
        for (String name : topicNames) {
            state.topic(name).filter(TopicState::upToDate).ifPresent(ts -> resolved.add(name));
        }
        StreamState updated = state.withoutTopics(resolved);
        if (!resolved.isEmpty()) {
            metrics.increment("failureState.resolved");
            LOG.debug("{} resolved on {}; {} topics still tracked", streamId, resolved, updated.topics().size());
        }
        topic.put(updated);
    }

    public <T> void messageFailed(MessageContext<T> message) {
        StreamState state = stateFor(message.key());
        TopicState ts = state.topic(message.topic())
                .map(t -> t.withPosition(message.sequenceId(), message.publishTime()))
                .orElseGet(() -> TopicState.initial(message.topic(), message.sequenceId(), message.publishTime()));
        int retried = ts.failurePending() ? ts.timesRetried() + 1 : ts.timesRetried();
        long nextRetry = message.publishTime() + schedule.nextInterval(retried).toMillis();
        TopicState failed = ts.withFailure(retried, nextRetry);
        metrics.increment("failureState.messageFailed");
        LOG.info("Message {} failed (times retried {}); next retry at {}", message, retried, nextRetry);
        topic.put(state.withTopic(failed));
    }

    public <T> void messageSucceeded(MessageContext<T> message) {
        StreamState state = stateFor(message.key());
        TopicState ts = state.topic(message.topic())
                .map(t -> t.withPosition(message.sequenceId(), message.publishTime()))
                .orElseGet(() -> TopicState.initial(message.topic(), message.sequenceId(), message.publishTime()));
        metrics.increment("failureState.messageSucceeded");
        topic.put(state.withTopic(ts.withSuccess()));
    }

    /** Number of keys with unresolved failure state. A count that keeps growing means keys are stuck. */
    public int trackedStreamCount() {
        return topic.size();
    }

    private StreamState stateFor(String streamId) {
        return topic.get(streamId).orElseGet(() -> new StreamState(streamId, null));
    }

    @Override
    public void close() {
        topic.close();
    }
}
