package com.orderguard.consumer.ordered;

import com.orderguard.common.ITimeService;

import java.time.Duration;
import java.util.Objects;

/** Fires on the first {@link #check()} after each interval has elapsed. Polled, never scheduled. */
public final class OnCheckTimer {
    private final long intervalMs;
    private final ITimeService time;
    private long lastFired;

    public OnCheckTimer(Duration interval, ITimeService time) {
        Objects.requireNonNull(interval, "interval");
        this.time = Objects.requireNonNull(time, "time");
        if (interval.isNegative()) throw new IllegalArgumentException("interval must be >= 0 but was " + interval);
        this.intervalMs = interval.toMillis();
        this.lastFired = time.currentTimeMillis();
    }

    public boolean check() {
        long now = time.currentTimeMillis();
        if (now - lastFired < intervalMs) return false;
        lastFired = now;
        return true;
    }
}
