package com.orderguard.kafka;

import org.apache.kafka.clients.producer.internals.BuiltInPartitioner;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class KafkaKeyHasherTest {

    @Test
    void places_keys_where_the_default_producer_partitioner_does() {
        for (int partitions : new int[]{1, 3, 12, 64}) {
            KafkaKeyHasher hasher = new KafkaKeyHasher(partitions);
            for (int i = 0; i < 200; i++) {
                String key = "acct-" + i;
                assertEquals(BuiltInPartitioner.partitionForKey(key.getBytes(StandardCharsets.UTF_8), partitions),
                        hasher.hash(key), key + " over " + partitions);
            }
        }
    }

    @Test
    void hashers_with_the_same_partition_count_are_equal() {
        assertEquals(new KafkaKeyHasher(6), new KafkaKeyHasher(6));
        assertNotEquals(new KafkaKeyHasher(6), new KafkaKeyHasher(7));
        assertThrows(IllegalArgumentException.class, () -> new KafkaKeyHasher(0));
    }
}
