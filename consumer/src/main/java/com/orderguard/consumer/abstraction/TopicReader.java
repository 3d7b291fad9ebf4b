package com.orderguard.consumer.abstraction;

import java.time.Duration;
import java.util.Optional;

/**
 * Positional reader over one topic. Unlike a subscription it has no acknowledgement state: what it
 * returns depends only on where it was seeked to, which makes replay order deterministic.
 */
public interface TopicReader<T> extends AutoCloseable {

    /** The next {@link #readNext} returns the first message with {@code sequenceId >= sequenceId}. */
    void seek(long sequenceId);

    /** Empty when nothing arrived within the timeout. */
    Optional<MessageContext<T>> readNext(Duration timeout);

    /** True while messages exist between the read position and the head captured at the last seek. */
    boolean hasMoreAvailable();

    @Override
    void close();
}
