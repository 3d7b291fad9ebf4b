package com.orderguard.consumer.abstraction;

/** Half-open slice {@code [start, endExclusive)} of the key hash space. */
public record KeyHashRange(int start, int endExclusive) {
    public KeyHashRange {
        if (start < 0) throw new IllegalArgumentException("start must be >= 0 but was " + start);
        if (endExclusive <= start)
            throw new IllegalArgumentException("endExclusive must be > start but was [" + start + "," + endExclusive + ")");
    }

    public boolean contains(int hash) {
        return hash >= start && hash < endExclusive;
    }

    @Override
    public String toString() {
        return "[" + start + "," + endExclusive + ")";
    }
}
