package com.orderguard.consumer.abstraction;

import java.util.List;

/**
 * Batch source driven by a single consumption loop.
 * <p>
 * SINGLE-THREADED: {@link #nextBatch} and {@link #finalizeBatch} alternate on one thread, and every batch
 * returned by {@code nextBatch} is finalized exactly once before the next call.
 */
public interface TopicConsumer<T> extends AutoCloseable {

    /** Next ordered batch, possibly empty. Never null. */
    List<MessageContext<T>> nextBatch(Cancellation cancellation);

    /** Report the outcome of the previous batch. Every message appears in exactly one of the lists. */
    void finalizeBatch(List<MessageContext<T>> acks, List<MessageContext<T>> nacks);

    /** Release broker resources. Safe to call more than once. */
    @Override
    void close();
}
