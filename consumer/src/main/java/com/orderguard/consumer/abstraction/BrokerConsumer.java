package com.orderguard.consumer.abstraction;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * A subscribed broker consumer. Implementations translate their client's failures into the
 * {@link BrokerException} hierarchy: {@link TransientBrokerException} for timeouts and retriable
 * disconnects, {@link AlreadyClosedException} for use after close.
 */
public interface BrokerConsumer<T> extends AutoCloseable {

    /** Waits at most {@code timeout} for messages. A timeout is an empty list, not an error. */
    List<MessageContext<T>> batchReceive(Duration timeout, Cancellation cancellation);

    void acknowledge(Collection<MessageContext<T>> messages);

    /** Ask the broker to deliver these messages again. */
    void negativeAcknowledge(Collection<MessageContext<T>> messages);

    @Override
    void close();
}
