package com.orderguard.consumer.subscription;

/**
 * User code run for each batch. Messages it does not {@link SubscriptionContext#nack nack} count as
 * handled; throwing nacks the whole batch.
 */
@FunctionalInterface
public interface StreamConsumer<T> {
    void onBatch(SubscriptionContext<T> context) throws Exception;
}
