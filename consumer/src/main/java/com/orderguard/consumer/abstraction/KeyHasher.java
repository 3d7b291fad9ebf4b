package com.orderguard.consumer.abstraction;

/** Maps a key into the hash space the broker assigns to consumers. */
@FunctionalInterface
public interface KeyHasher {
    int hash(String key);
}
