package com.orderguard.inmemory;

import com.orderguard.consumer.abstraction.AlreadyClosedException;
import com.orderguard.consumer.abstraction.MessageContext;
import com.orderguard.consumer.abstraction.TopicReader;
import com.orderguard.consumer.abstraction.TopicReaderFactory;

import java.time.Duration;
import java.util.Optional;

/** Readers ignore the key hint: an in-memory topic has a single shard. */
public final class InMemoryTopicReaderFactory<T> implements TopicReaderFactory<T> {
    private final InMemoryBroker<T> broker;

    public InMemoryTopicReaderFactory(InMemoryBroker<T> broker) {
        this.broker = broker;
    }

    @Override
    public TopicReader<T> createReader(String topic, String key) {
        return new Reader<>(broker, topic);
    }

    private static final class Reader<T> implements TopicReader<T> {
        private final InMemoryBroker<T> broker;
        private final String topic;
        private int position;
        private int head;
        private boolean closed;

        Reader(InMemoryBroker<T> broker, String topic) {
            this.broker = broker;
            this.topic = topic;
            this.head = broker.size(topic);
        }

        @Override
        public void seek(long sequenceId) {
            checkOpen();
            position = InMemoryTopic.indexOf(sequenceId);
            head = broker.size(topic);
        }

        @Override
        public Optional<MessageContext<T>> readNext(Duration timeout) {
            checkOpen();
            Optional<MessageContext<T>> m = broker.read(topic, position, timeout);
            if (m.isPresent()) position++;
            return m;
        }

        @Override
        public boolean hasMoreAvailable() {
            return position < head;
        }

        private void checkOpen() {
            if (closed) throw new AlreadyClosedException("Reader on " + topic + " is closed");
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
