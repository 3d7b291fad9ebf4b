package com.orderguard.consumer.abstraction;

import java.time.Duration;

/** Cooperative cancellation signal observed by every broker wait. */
@FunctionalInterface
public interface Cancellation {

    boolean isCancelled();

    Cancellation NONE = () -> false;

    /**
     * Sleep for {@code duration} unless cancelled first.
     *
     * @return false if cancelled or interrupted before the duration elapsed
     */
    default boolean await(Duration duration) {
        long remaining = duration.toMillis();
        while (remaining > 0) {
            if (isCancelled()) return false;
            long slice = Math.min(remaining, 50);
            try {
                Thread.sleep(slice);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            remaining -= slice;
        }
        return !isCancelled();
    }
}
