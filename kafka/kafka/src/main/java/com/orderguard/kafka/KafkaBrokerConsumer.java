package com.orderguard.kafka;

import com.orderguard.consumer.abstraction.AlreadyClosedException;
import com.orderguard.consumer.abstraction.BrokerConsumer;
import com.orderguard.consumer.abstraction.BrokerException;
import com.orderguard.consumer.abstraction.Cancellation;
import com.orderguard.consumer.abstraction.MessageContext;
import com.orderguard.consumer.abstraction.TransientBrokerException;
import org.apache.kafka.clients.consumer.CommitFailedException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.RebalanceInProgressException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A group-subscribed Kafka consumer with auto commit off. Acknowledging commits past the highest acknowledged
 * offset of each partition; a negative acknowledgement seeks the partition back to the lowest one.
 * <p>
 * SINGLE-THREADED: like the {@link Consumer} it wraps.
 */
public final class KafkaBrokerConsumer<T> implements BrokerConsumer<T> {
    private static final Logger LOG = LoggerFactory.getLogger(KafkaBrokerConsumer.class);

    private final Consumer<String, T> consumer;
    private final String consumerName;
    private boolean closed;

    public KafkaBrokerConsumer(Consumer<String, T> consumer, String consumerName) {
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.consumerName = Objects.requireNonNull(consumerName, "consumerName");
    }

    /** Subscribes {@code consumer} to {@code topics} and wraps it. */
    public static <T> KafkaBrokerConsumer<T> subscribe(Consumer<String, T> consumer, String consumerName, List<String> topics) {
        KafkaBrokerConsumer<T> result = new KafkaBrokerConsumer<>(consumer, consumerName);
        consumer.subscribe(topics, result.rebalanceListener());
        return result;
    }

    ConsumerRebalanceListener rebalanceListener() {
        return new ConsumerRebalanceListener() {
            @Override
            public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
                if (!partitions.isEmpty()) LOG.info("{} revoked {}", consumerName, partitions);
            }

            @Override
            public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
                if (!partitions.isEmpty()) LOG.info("{} assigned {}", consumerName, partitions);
            }
        };
    }

    @Override
    public List<MessageContext<T>> batchReceive(Duration timeout, Cancellation cancellation) {
        ensureOpen();
        if (cancellation.isCancelled()) return List.of();
        ConsumerRecords<String, T> records;
        try {
            records = consumer.poll(timeout);
        } catch (WakeupException e) {
            throw new TransientBrokerException(consumerName + " poll woken up", e);
        } catch (InterruptException e) {
            throw new BrokerException(consumerName + " poll interrupted", e);
        } catch (RetriableException e) {
            throw new TransientBrokerException(consumerName + " poll failed: " + e.getMessage(), e);
        } catch (KafkaException e) {
            throw new BrokerException(consumerName + " poll failed: " + e.getMessage(), e);
        }
        if (records.isEmpty()) return List.of();
        List<MessageContext<T>> out = new ArrayList<>(records.count());
        for (ConsumerRecord<String, T> r : records) out.add(toMessage(r));
        return out;
    }

    static <T> MessageContext<T> toMessage(ConsumerRecord<String, T> r) {
        return new MessageContext<>(r.topic(), r.partition(), r.key() == null ? "" : r.key(), r.offset(), r.timestamp(), r.value());
    }

    @Override
    public void acknowledge(Collection<MessageContext<T>> messages) {
        ensureOpen();
        Map<TopicPartition, OffsetAndMetadata> commits = new HashMap<>();
        for (MessageContext<T> m : messages) {
            TopicPartition tp = new TopicPartition(m.topic(), m.partition());
            OffsetAndMetadata next = new OffsetAndMetadata(m.sequenceId() + 1);
            commits.merge(tp, next, (a, b) -> a.offset() >= b.offset() ? a : b);
        }
        if (commits.isEmpty()) return;
        try {
            consumer.commitSync(commits);
        } catch (InterruptException e) {
            throw new BrokerException(consumerName + " commit interrupted", e);
        } catch (RebalanceInProgressException | CommitFailedException e) {
            // the group moved on; the partitions' new owner redelivers from the last committed offset
            throw new TransientBrokerException(consumerName + " commit rejected by rebalance: " + e.getMessage(), e);
        } catch (RetriableException e) {
            throw new TransientBrokerException(consumerName + " commit failed: " + e.getMessage(), e);
        } catch (KafkaException e) {
            throw new BrokerException(consumerName + " commit failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void negativeAcknowledge(Collection<MessageContext<T>> messages) {
        ensureOpen();
        Map<TopicPartition, Long> rewind = new HashMap<>();
        for (MessageContext<T> m : messages) {
            rewind.merge(new TopicPartition(m.topic(), m.partition()), m.sequenceId(), Math::min);
        }
        for (Map.Entry<TopicPartition, Long> e : rewind.entrySet()) {
            if (!consumer.assignment().contains(e.getKey())) {
                LOG.debug("{} no longer owns {}; its new owner will redeliver from the committed offset", consumerName, e.getKey());
                continue;
            }
            consumer.seek(e.getKey(), e.getValue());
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        consumer.close();
    }

    private void ensureOpen() {
        if (closed) throw new AlreadyClosedException("KafkaBrokerConsumer " + consumerName + " is closed");
    }
}
