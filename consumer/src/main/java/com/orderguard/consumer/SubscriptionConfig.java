package com.orderguard.consumer;

import com.orderguard.common.config.PropertyReader;
import com.orderguard.consumer.failurestate.RetrySchedule;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for one order-guaranteed subscription.
 *
 * @param topics                   topics consumed; the first one is queried for key hash range ownership
 * @param subscriptionName         shared by every co-consumer of the subscription
 * @param batchSize                maximum messages per normal-phase batch
 * @param batchTimeout             how long a normal-phase receive waits for messages
 * @param noBatchDelay             pause of the subscription loop after an empty batch
 * @param retryBackoff             backoff policy, see {@link RetrySchedule}; empty means the default schedule
 * @param maxRetries               replay failures tolerated before a message is dead-lettered; -1 means never
 * @param replayBatchSize          maximum messages per recovery-phase batch
 * @param readTimeout              how long a positional read waits for the next message
 * @param rangeRefreshInterval     how often owned key hash ranges are re-queried
 * @param rangeStabilizationDelay  pause before the first range query, letting the broker settle assignment
 */
public record SubscriptionConfig(
        List<String> topics,
        String subscriptionName,
        int batchSize,
        Duration batchTimeout,
        Duration noBatchDelay,
        List<Duration> retryBackoff,
        int maxRetries,
        int replayBatchSize,
        Duration readTimeout,
        Duration rangeRefreshInterval,
        Duration rangeStabilizationDelay
) {

    public static final String PREFIX = "subscription.";

    public SubscriptionConfig {
        topics = List.copyOf(Objects.requireNonNull(topics, "topics"));
        if (topics.isEmpty()) throw new IllegalArgumentException("at least one topic is required");
        Objects.requireNonNull(subscriptionName, "subscriptionName");
        if (subscriptionName.isBlank()) throw new IllegalArgumentException("subscriptionName must be non-blank");
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        if (replayBatchSize < 1) throw new IllegalArgumentException("replayBatchSize must be >= 1");
        if (maxRetries < -1) throw new IllegalArgumentException("maxRetries must be >= -1");
        retryBackoff = List.copyOf(Objects.requireNonNull(retryBackoff, "retryBackoff"));
        Objects.requireNonNull(batchTimeout, "batchTimeout");
        Objects.requireNonNull(noBatchDelay, "noBatchDelay");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(rangeRefreshInterval, "rangeRefreshInterval");
        Objects.requireNonNull(rangeStabilizationDelay, "rangeStabilizationDelay");
    }

    public static SubscriptionConfig defaults(List<String> topics, String subscriptionName) {
        return new SubscriptionConfig(topics, subscriptionName,
                500,
                Duration.ofMillis(500),
                Duration.ofMillis(200),
                List.of(),
                -1,
                500,
                Duration.ofMillis(500),
                Duration.ofMinutes(1),
                Duration.ofSeconds(1));
    }

    /**
     * Keys (all prefixed {@code subscription.}): {@code topics}, {@code name}, {@code batch.size},
     * {@code batch.timeout}, {@code no.batch.delay}, {@code retry.backoff}, {@code retry.max},
     * {@code replay.batch.size}, {@code read.timeout}, {@code ranges.refresh.interval},
     * {@code ranges.stabilization.delay}.
     */
    public static SubscriptionConfig fromProperties(Properties props) {
        PropertyReader r = new PropertyReader(props);
        List<String> topics = r.getList(PREFIX + "topics", List.of());
        String name = r.getString(PREFIX + "name", null);
        if (topics.isEmpty()) throw new IllegalArgumentException(PREFIX + "topics is required");
        if (name == null) throw new IllegalArgumentException(PREFIX + "name is required");
        SubscriptionConfig d = defaults(topics, name);
        return new SubscriptionConfig(topics, name,
                r.getInt(PREFIX + "batch.size", d.batchSize()),
                r.getDuration(PREFIX + "batch.timeout", d.batchTimeout()),
                r.getDuration(PREFIX + "no.batch.delay", d.noBatchDelay()),
                r.getDurations(PREFIX + "retry.backoff", d.retryBackoff()),
                r.getInt(PREFIX + "retry.max", d.maxRetries()),
                r.getInt(PREFIX + "replay.batch.size", d.replayBatchSize()),
                r.getDuration(PREFIX + "read.timeout", d.readTimeout()),
                r.getDuration(PREFIX + "ranges.refresh.interval", d.rangeRefreshInterval()),
                r.getDuration(PREFIX + "ranges.stabilization.delay", d.rangeStabilizationDelay()));
    }

    public static SubscriptionConfig fromClasspath(String resource) {
        return fromProperties(PropertyReader.loadFromClasspath(resource));
    }

    public RetrySchedule retrySchedule() {
        return retryBackoff.isEmpty() ? RetrySchedule.defaultSchedule() : new RetrySchedule(retryBackoff);
    }

    public String primaryTopic() {
        return topics.get(0);
    }

    /** Control topic holding per-key failure state, shared by every consumer of this subscription. */
    public String failureStateTopic() {
        return primaryTopic() + "-" + subscriptionName + "-failure-state";
    }

    public boolean retriesCapped() {
        return maxRetries >= 0;
    }

    public SubscriptionConfig withRetryBackoff(List<Duration> backoff) {
        return new SubscriptionConfig(topics, subscriptionName, batchSize, batchTimeout, noBatchDelay, backoff,
                maxRetries, replayBatchSize, readTimeout, rangeRefreshInterval, rangeStabilizationDelay);
    }

    public SubscriptionConfig withMaxRetries(int max) {
        return new SubscriptionConfig(topics, subscriptionName, batchSize, batchTimeout, noBatchDelay, retryBackoff,
                max, replayBatchSize, readTimeout, rangeRefreshInterval, rangeStabilizationDelay);
    }

    public SubscriptionConfig withBatchSizes(int batch, int replayBatch) {
        return new SubscriptionConfig(topics, subscriptionName, batch, batchTimeout, noBatchDelay, retryBackoff,
                maxRetries, replayBatch, readTimeout, rangeRefreshInterval, rangeStabilizationDelay);
    }

    /** Zero waits everywhere; used by in-memory runs and tests. */
    public SubscriptionConfig withoutWaits() {
        return new SubscriptionConfig(topics, subscriptionName, batchSize, Duration.ZERO, Duration.ZERO, retryBackoff,
                maxRetries, replayBatchSize, Duration.ZERO, rangeRefreshInterval, Duration.ZERO);
    }
}
