package com.orderguard.kafka;

import com.orderguard.consumer.abstraction.AlreadyClosedException;
import com.orderguard.consumer.abstraction.MessageContext;
import com.orderguard.consumer.abstraction.TopicReader;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class KafkaTopicReaderFactoryTest {

    private static final String TOPIC = "accounts";
    private static final String KEY = "acct-1";
    private static final Duration WAIT = Duration.ofMillis(10);

    private MockConsumer<String, String> mock;
    private KafkaTopicReaderFactory<String> factory;
    private TopicPartition tp;

    @BeforeEach
    void setUp() {
        mock = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        Node node = new Node(0, "localhost", 9092);
        mock.updatePartitions(TOPIC, IntStream.range(0, 4)
                .mapToObj(p -> new PartitionInfo(TOPIC, p, node, new Node[]{node}, new Node[]{node}))
                .toList());
        factory = new KafkaTopicReaderFactory<>(mock);
        tp = new TopicPartition(TOPIC, new KafkaKeyHasher(4).hash(KEY));
        mock.updateBeginningOffsets(Map.of(tp, 0L));
        mock.updateEndOffsets(Map.of(tp, 5L));
    }

    private void add(long offset, String key) {
        mock.addRecord(new ConsumerRecord<>(TOPIC, tp.partition(), offset, key, "v" + offset));
    }

    @Test
    void reads_the_keys_partition_from_the_seek_offset_to_the_head() {
        TopicReader<String> reader = factory.createReader(TOPIC, KEY);
        reader.seek(3);
        add(2, KEY);
        add(3, KEY);
        add(4, "other");

        assertTrue(reader.hasMoreAvailable());
        MessageContext<String> first = reader.readNext(WAIT).orElseThrow();
        assertEquals(3, first.sequenceId());
        assertEquals(tp.partition(), first.partition());
        assertTrue(reader.hasMoreAvailable());
        assertEquals("other", reader.readNext(WAIT).orElseThrow().key());
        assertFalse(reader.hasMoreAvailable());
        assertTrue(reader.readNext(WAIT).isEmpty());
        reader.close();
    }

    @Test
    void one_reader_at_a_time_and_closing_it_releases_the_consumer() {
        TopicReader<String> reader = factory.createReader(TOPIC, KEY);
        assertThrows(IllegalStateException.class, () -> factory.createReader(TOPIC, KEY));
        reader.seek(0);
        reader.close();

        assertTrue(mock.assignment().isEmpty());
        assertThrows(AlreadyClosedException.class, () -> reader.seek(0));
        factory.createReader(TOPIC, KEY).close();
    }

    @Test
    void closed_factory_closes_the_consumer_and_opens_no_readers() {
        factory.close();
        factory.close();

        assertTrue(mock.closed());
        assertThrows(AlreadyClosedException.class, () -> factory.createReader(TOPIC, KEY));
    }
}
