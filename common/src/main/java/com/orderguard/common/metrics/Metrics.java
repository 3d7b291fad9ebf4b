package com.orderguard.common.metrics;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Minimal façade for emitting numeric metrics.
 * <p>Counters and histograms share the same low-cardinality naming space.</p>
 * Implementations must be thread-safe.
 */
public interface Metrics {

    /** Increment a named counter by 1. */
    void increment(String name);

    /** Record a value (batch size, duration in ms) in a histogram. */
    void histogram(String name, long value);

    Metrics nullMetrics = new NullMetrics();

    /** Counts increments into the supplied map; histogram values are summed under {@code name}. */
    static Metrics memoryMetrics(Map<String, LongAdder> counters) {
        Objects.requireNonNull(counters, "counters");
        return new Metrics() {
            @Override
            public void increment(String name) {
                Objects.requireNonNull(name);
                counters.computeIfAbsent(name, k -> new LongAdder()).increment();
            }

            @Override
            public void histogram(String name, long value) {
                Objects.requireNonNull(name);
                counters.computeIfAbsent(name, k -> new LongAdder()).add(value);
            }
        };
    }

    static Metrics memoryMetrics() {
        return memoryMetrics(new ConcurrentHashMap<>());
    }
}

class NullMetrics implements Metrics {

    @Override
    public void increment(String name) {
    }

    @Override
    public void histogram(String name, long value) {
    }
}
