package com.orderguard.consumer.abstraction;

import java.util.Objects;
import java.util.Set;

/**
 * The key hash ranges a consumer owns, together with the hasher that places keys in them.
 * An empty set owns nothing.
 */
public record KeyHashRanges(Set<KeyHashRange> ranges, KeyHasher hasher) {

    public KeyHashRanges {
        ranges = Set.copyOf(Objects.requireNonNull(ranges, "ranges"));
        Objects.requireNonNull(hasher, "hasher");
    }

    public static KeyHashRanges none(KeyHasher hasher) {
        return new KeyHashRanges(Set.of(), hasher);
    }

    public boolean ownsKey(String key) {
        if (ranges.isEmpty()) return false;
        int hash = hasher.hash(key);
        for (KeyHashRange r : ranges) {
            if (r.contains(hash)) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }
}
