package com.orderguard.kafka;

import com.orderguard.consumer.abstraction.AlreadyClosedException;
import com.orderguard.consumer.abstraction.BrokerException;
import com.orderguard.consumer.abstraction.MessageContext;
import com.orderguard.consumer.abstraction.TopicReader;
import com.orderguard.consumer.abstraction.TopicReaderFactory;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Readers over one assign-only {@link Consumer}. A reader is narrowed to the partition its key hashes to,
 * and sequence ids are that partition's offsets.
 * <p>
 * One reader at a time: opening a reader while another is open throws. SINGLE-THREADED.
 */
public final class KafkaTopicReaderFactory<T> implements TopicReaderFactory<T>, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(KafkaTopicReaderFactory.class);

    private final Consumer<String, T> consumer;
    private final Map<String, KafkaKeyHasher> hashers = new HashMap<>();
    private Reader open;
    private boolean closed;

    public KafkaTopicReaderFactory(Consumer<String, T> consumer) {
        this.consumer = Objects.requireNonNull(consumer, "consumer");
    }

    @Override
    public TopicReader<T> createReader(String topic, String key) {
        if (closed) throw new AlreadyClosedException("KafkaTopicReaderFactory is closed");
        if (open != null) throw new IllegalStateException("A reader over " + open.partition + " is still open");
        open = new Reader(new TopicPartition(topic, hasherFor(topic).hash(key)));
        return open;
    }

    KafkaKeyHasher hasherFor(String topic) {
        KafkaKeyHasher hasher = hashers.get(topic);
        if (hasher != null) return hasher;
        List<PartitionInfo> partitions = consumer.partitionsFor(topic);
        if (partitions == null || partitions.isEmpty()) throw new BrokerException("Topic " + topic + " has no partitions");
        hasher = new KafkaKeyHasher(partitions.size());
        hashers.put(topic, hasher);
        return hasher;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        consumer.close();
    }

    private final class Reader implements TopicReader<T> {
        private final TopicPartition partition;
        private final Deque<ConsumerRecord<String, T>> buffer = new ArrayDeque<>();
        private long head;
        private boolean readerClosed;

        Reader(TopicPartition partition) {
            this.partition = partition;
        }

        @Override
        public void seek(long sequenceId) {
            ensureOpen();
            buffer.clear();
            try {
                consumer.assign(List.of(partition));
                head = consumer.endOffsets(List.of(partition)).getOrDefault(partition, 0L);
                consumer.seek(partition, Math.max(0, sequenceId));
            } catch (KafkaException e) {
                throw KafkaFutures.translate("seek " + partition + " to " + sequenceId, e);
            }
            LOG.debug("Reading {} from {} up to {}", partition, sequenceId, head);
        }

        @Override
        public Optional<MessageContext<T>> readNext(Duration timeout) {
            ensureOpen();
            if (buffer.isEmpty()) {
                try {
                    for (ConsumerRecord<String, T> r : consumer.poll(timeout).records(partition)) buffer.add(r);
                } catch (KafkaException e) {
                    throw KafkaFutures.translate("read " + partition, e);
                }
            }
            ConsumerRecord<String, T> next = buffer.poll();
            return next == null ? Optional.empty() : Optional.of(KafkaBrokerConsumer.toMessage(next));
        }

        @Override
        public boolean hasMoreAvailable() {
            ensureOpen();
            if (!buffer.isEmpty()) return true;
            try {
                return consumer.position(partition) < head;
            } catch (KafkaException e) {
                throw KafkaFutures.translate("position of " + partition, e);
            }
        }

        @Override
        public void close() {
            if (readerClosed) return;
            readerClosed = true;
            buffer.clear();
            open = null;
            if (!closed) consumer.unsubscribe();
        }

        private void ensureOpen() {
            if (readerClosed || closed) throw new AlreadyClosedException("Reader over " + partition + " is closed");
        }
    }
}
