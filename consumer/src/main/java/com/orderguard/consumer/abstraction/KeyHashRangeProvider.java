package com.orderguard.consumer.abstraction;

/**
 * Reports which key hash ranges the broker currently assigns to a named consumer of a subscription.
 * Assignment changes at runtime; callers poll.
 */
@FunctionalInterface
public interface KeyHashRangeProvider {
    KeyHashRanges getOwnedRanges(String topic, String subscriptionName, String consumerName);
}
