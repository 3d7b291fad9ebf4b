package com.orderguard.consumer.failurestate;

import com.orderguard.common.config.PropertyReader;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Backoff ladder: attempt {@code n} waits {@code intervals[n]}; attempts past the end reuse the last step.
 * <p>
 * Steps must be non-decreasing, so {@code nextInterval(n) <= nextInterval(n + 1)} for every n.
 */
public final class RetrySchedule {

    private static final RetrySchedule DEFAULT = new RetrySchedule(List.of(Duration.ofSeconds(5)));

    private final List<Duration> intervals;

    public RetrySchedule(List<Duration> intervals) {
        Objects.requireNonNull(intervals, "intervals");
        if (intervals.isEmpty()) throw new IllegalArgumentException("intervals must be non-empty");
        for (int i = 0; i < intervals.size(); i++) {
            Duration d = Objects.requireNonNull(intervals.get(i), "intervals[" + i + "]");
            if (d.isNegative()) throw new IllegalArgumentException("intervals[" + i + "] must be >= 0 but was " + d);
            if (i > 0 && d.compareTo(intervals.get(i - 1)) < 0)
                throw new IllegalArgumentException("intervals must be non-decreasing but " + intervals.get(i - 1) + " > " + d);
        }
        this.intervals = List.copyOf(intervals);
    }

    public static RetrySchedule of(Duration... intervals) {
        return new RetrySchedule(Arrays.asList(intervals));
    }

    /** Single fixed five second backoff. */
    public static RetrySchedule defaultSchedule() {
        return DEFAULT;
    }

    /** Parses {@code 500ms,5s,1m,1h}. */
    public static RetrySchedule parse(String policy) {
        return new RetrySchedule(Arrays.stream(Objects.requireNonNull(policy, "policy").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(PropertyReader::parseDuration)
                .toList());
    }

    public Duration nextInterval(int attemptCount) {
        int index = Math.min(Math.max(attemptCount, 0), intervals.size() - 1);
        return intervals.get(index);
    }

    public List<Duration> intervals() {
        return intervals;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RetrySchedule other && intervals.equals(other.intervals);
    }

    @Override
    public int hashCode() {
        return intervals.hashCode();
    }

    @Override
    public String toString() {
        return "RetrySchedule" + intervals;
    }
}
