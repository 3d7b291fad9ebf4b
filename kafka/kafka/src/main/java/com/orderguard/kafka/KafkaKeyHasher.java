package com.orderguard.kafka;

import com.orderguard.consumer.abstraction.KeyHasher;
import org.apache.kafka.common.utils.Utils;

import java.nio.charset.StandardCharsets;

/**
 * The default producer partitioner's placement of a UTF-8 string key: murmur2, made positive, modulo the
 * partition count. The hash space is the partitions themselves, so partition {@code p} is the range
 * {@code [p, p+1)}.
 */
public final class KafkaKeyHasher implements KeyHasher {
    private final int partitions;

    public KafkaKeyHasher(int partitions) {
        if (partitions < 1) throw new IllegalArgumentException("partitions must be >= 1, was " + partitions);
        this.partitions = partitions;
    }

    @Override
    public int hash(String key) {
        return Utils.toPositive(Utils.murmur2(key.getBytes(StandardCharsets.UTF_8))) % partitions;
    }

    public int partitions() {
        return partitions;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof KafkaKeyHasher other && other.partitions == partitions;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(partitions);
    }

    @Override
    public String toString() {
        return "KafkaKeyHasher[" + partitions + "]";
    }
}
