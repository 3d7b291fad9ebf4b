package com.orderguard.common;

/**
 * Clock seam. Every component that compares against "now" reads it from here so tests can drive time.
 */
public interface ITimeService {
    long currentTimeMillis();

    ITimeService real = System::currentTimeMillis;

    static ITimeService fixed(long fixedTimeMillis) {
        return () -> fixedTimeMillis;
    }
}
