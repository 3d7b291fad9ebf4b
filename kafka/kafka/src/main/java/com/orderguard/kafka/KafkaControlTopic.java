package com.orderguard.kafka;

import com.orderguard.common.ITimeService;
import com.orderguard.common.codec.Codec;
import com.orderguard.common.codec.JacksonTypedJsonCodec;
import com.orderguard.consumer.abstraction.BrokerException;
import com.orderguard.consumer.abstraction.TransientBrokerException;
import com.orderguard.consumer.failurestate.ControlTopic;
import com.orderguard.consumer.failurestate.StreamState;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Failure state on a compacted topic: key = stream id, value = the state as JSON, null value = tombstone.
 * <p>
 * Reads go through an assign-only consumer that starts at the beginning of every partition and, on each
 * {@link #replayToHead()}, catches up to the end offsets taken at the start of the call.
 */
public final class KafkaControlTopic implements ControlTopic {
    private static final Logger LOG = LoggerFactory.getLogger(KafkaControlTopic.class);

    private final String topic;
    private final Producer<String, String> producer;
    private final Consumer<String, String> consumer;
    private final Duration timeout;
    private final Duration pollTimeout;
    private final ITimeService time;
    private final Codec<StreamState, String> codec = new JacksonTypedJsonCodec<>(StreamState.class);

    private List<TopicPartition> partitions;
    private boolean closed;

    public KafkaControlTopic(String topic,
                             Producer<String, String> producer,
                             Consumer<String, String> consumer,
                             Duration timeout,
                             Duration pollTimeout,
                             ITimeService time) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.producer = Objects.requireNonNull(producer, "producer");
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
        this.time = Objects.requireNonNull(time, "time");
    }

    @Override
    public void publish(StreamState state) {
        String value = state.tracksNothing()
                ? null
                : codec.encode(state).addPrefixIfError("Cannot encode state of " + state.streamId()).valueOrThrow(BrokerException::new);
        KafkaFutures.get(producer.send(new ProducerRecord<>(topic, state.streamId(), value)), timeout,
                "publish " + state.streamId() + " to " + topic);
    }

    @Override
    public List<StreamState> replayToHead() {
        try {
            if (partitions == null) assignFromBeginning();
            Map<TopicPartition, Long> head = consumer.endOffsets(partitions);
            List<StreamState> states = new ArrayList<>();
            long deadline = time.currentTimeMillis() + timeout.toMillis();
            while (!reached(head)) {
                if (time.currentTimeMillis() > deadline)
                    throw new TransientBrokerException("Control topic " + topic + " did not reach " + head + " within " + timeout, null);
                for (ConsumerRecord<String, String> r : consumer.poll(pollTimeout)) states.add(decode(r));
            }
            if (!states.isEmpty()) LOG.debug("Read {} states from {}", states.size(), topic);
            return states;
        } catch (KafkaException e) {
            throw KafkaFutures.translate("replay of " + topic, e);
        }
    }

    private void assignFromBeginning() {
        List<PartitionInfo> infos = consumer.partitionsFor(topic);
        if (infos == null || infos.isEmpty()) throw new BrokerException("Control topic " + topic + " has no partitions");
        List<TopicPartition> tps = infos.stream().map(i -> new TopicPartition(i.topic(), i.partition())).toList();
        consumer.assign(tps);
        consumer.seekToBeginning(tps);
        partitions = tps;
        LOG.info("Replaying control topic {} from the beginning of {} partitions", topic, tps.size());
    }

    private boolean reached(Map<TopicPartition, Long> head) {
        for (TopicPartition tp : partitions) {
            if (consumer.position(tp) < head.getOrDefault(tp, 0L)) return false;
        }
        return true;
    }

    private StreamState decode(ConsumerRecord<String, String> r) {
        if (r.value() == null) return StreamState.tombstone(r.key());
        return codec.decode(r.value())
                .addPrefixIfError("Cannot decode " + topic + "/" + r.partition() + "@" + r.offset())
                .valueOrThrow(BrokerException::new);
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            producer.close(timeout);
        } finally {
            consumer.close();
        }
    }
}
