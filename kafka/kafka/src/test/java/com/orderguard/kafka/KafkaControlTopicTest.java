package com.orderguard.kafka;

import com.orderguard.common.ITimeService;
import com.orderguard.common.codec.JacksonTypedJsonCodec;
import com.orderguard.consumer.abstraction.BrokerException;
import com.orderguard.consumer.failurestate.StreamState;
import com.orderguard.consumer.failurestate.TopicState;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KafkaControlTopicTest {

    private static final String TOPIC = "accounts-billing-failure-state";
    private static final TopicPartition TP = new TopicPartition(TOPIC, 0);

    private MockProducer<String, String> producer;
    private MockConsumer<String, String> consumer;
    private KafkaControlTopic controlTopic;

    private final StreamState failed = new StreamState("acct-1", Map.of())
            .withTopic(TopicState.initial("accounts", 7, 1_000).withFailure(0, 6_000));

    @BeforeEach
    void setUp() {
        producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        Node node = new Node(0, "localhost", 9092);
        consumer.updatePartitions(TOPIC, List.of(new PartitionInfo(TOPIC, 0, node, new Node[]{node}, new Node[]{node})));
        consumer.updateBeginningOffsets(Map.of(TP, 0L));
        controlTopic = new KafkaControlTopic(TOPIC, producer, consumer, Duration.ofSeconds(5), Duration.ofMillis(10), ITimeService.real);
    }

    private String json(StreamState state) {
        return new JacksonTypedJsonCodec<>(StreamState.class).encode(state).valueOrThrow(IllegalStateException::new);
    }

    @Test
    void publishes_json_keyed_by_stream_and_null_for_an_empty_state() {
        controlTopic.publish(failed);
        controlTopic.publish(StreamState.tombstone("acct-1"));

        List<ProducerRecord<String, String>> sent = producer.history();
        assertEquals(2, sent.size());
        assertEquals("acct-1", sent.get(0).key());
        assertEquals(failed, new JacksonTypedJsonCodec<>(StreamState.class).decode(sent.get(0).value()).valueOrThrow(IllegalStateException::new));
        assertNull(sent.get(1).value());
    }

    @Test
    void replays_from_the_beginning_then_only_what_is_new() {
        consumer.updateEndOffsets(Map.of(TP, 2L));
        consumer.schedulePollTask(() -> {
            consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0, "acct-1", json(failed)));
            consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 1, "acct-2", null));
        });

        List<StreamState> first = controlTopic.replayToHead();
        assertEquals(List.of(failed, StreamState.tombstone("acct-2")), first);
        assertTrue(controlTopic.replayToHead().isEmpty());

        consumer.updateEndOffsets(Map.of(TP, 3L));
        consumer.schedulePollTask(() -> consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 2, "acct-1", null)));
        assertEquals(List.of(StreamState.tombstone("acct-1")), controlTopic.replayToHead());
    }

    @Test
    void undecodable_state_is_an_error() {
        consumer.updateEndOffsets(Map.of(TP, 1L));
        consumer.schedulePollTask(() -> consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0, "acct-1", "{not json")));

        assertThrows(BrokerException.class, () -> controlTopic.replayToHead());
    }

    @Test
    void close_closes_both_clients_once() {
        controlTopic.close();
        controlTopic.close();

        assertTrue(producer.closed());
        assertTrue(consumer.closed());
    }
}
