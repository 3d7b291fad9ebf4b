package com.orderguard.common.metrics;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MetricsTest {

    @Test
    void memoryMetricsCountsAndSums() {
        var counters = new ConcurrentHashMap<String, LongAdder>();
        Metrics m = Metrics.memoryMetrics(counters);
        m.increment("a");
        m.increment("a");
        m.histogram("batch", 5);
        m.histogram("batch", 7);

        assertEquals(2, counters.get("a").sum());
        assertEquals(12, counters.get("batch").sum());
    }

    @Test
    void nullMetricsIgnoresEverything() {
        Metrics.nullMetrics.increment("a");
        Metrics.nullMetrics.histogram("b", 1);
    }
}
