package com.orderguard.consumer.failurestate;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Failure state of one key on one topic.
 *
 * @param topicName              topic this entry belongs to
 * @param lastSequenceId         sequence id of the last outcome recorded for the key on this topic
 * @param lastMessagePublishTime publish time of that message, epoch millis
 * @param timesRetried           consecutive failures since the last success
 * @param nextRetry              epoch millis the failure may be replayed at; null when no failure is pending
 * @param upToDate               replay has caught the key up to the head of the topic
 */
public record TopicState(
        String topicName,
        long lastSequenceId,
        long lastMessagePublishTime,
        int timesRetried,
        @Nullable Long nextRetry,
        boolean upToDate
) {

    public TopicState {
        Objects.requireNonNull(topicName, "topicName");
        if (timesRetried < 0) throw new IllegalArgumentException("timesRetried must be >= 0 but was " + timesRetried);
    }

    public static TopicState initial(String topicName, long sequenceId, long publishTime) {
        return new TopicState(topicName, sequenceId, publishTime, 0, null, false);
    }

    public TopicState withPosition(long sequenceId, long publishTime) {
        return new TopicState(topicName, sequenceId, publishTime, timesRetried, nextRetry, upToDate);
    }

    public TopicState withFailure(int retried, long retryAt) {
        return new TopicState(topicName, lastSequenceId, lastMessagePublishTime, retried, retryAt, false);
    }

    public TopicState withSuccess() {
        return new TopicState(topicName, lastSequenceId, lastMessagePublishTime, 0, null, upToDate);
    }

    public TopicState withUpToDate(boolean flag) {
        return new TopicState(topicName, lastSequenceId, lastMessagePublishTime, timesRetried, nextRetry, flag);
    }

    public boolean failurePending() {
        return nextRetry != null;
    }

    /** Eligible for a recovery read: not caught up, and any pending failure has waited out its backoff. */
    public boolean isDueForRetry(long now) {
        return !upToDate && (nextRetry == null || now >= nextRetry);
    }

    /** First sequence id recovery should read: the failed message itself while its failure is pending, else the one after it. */
    public long replayFrom() {
        return nextRetry != null ? lastSequenceId : lastSequenceId + 1;
    }
}
