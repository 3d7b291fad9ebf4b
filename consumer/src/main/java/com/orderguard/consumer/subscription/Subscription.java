package com.orderguard.consumer.subscription;

import com.orderguard.consumer.abstraction.Cancellation;
import com.orderguard.consumer.abstraction.MessageContext;
import com.orderguard.consumer.abstraction.TopicConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * The consumption loop: next batch, hand it to the {@link StreamConsumer}, finalize, repeat.
 * Runs on the calling thread until {@link #stop()} or the cancellation fires. Exceptions from the
 * topic consumer end the loop and propagate out of {@link #run}.
 */
public final class Subscription<T> implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(Subscription.class);

    private final TopicConsumer<T> topicConsumer;
    private final StreamConsumer<T> streamConsumer;
    private final Duration noBatchDelay;
    private volatile boolean stopped;

    public Subscription(TopicConsumer<T> topicConsumer, StreamConsumer<T> streamConsumer, Duration noBatchDelay) {
        this.topicConsumer = Objects.requireNonNull(topicConsumer, "topicConsumer");
        this.streamConsumer = Objects.requireNonNull(streamConsumer, "streamConsumer");
        this.noBatchDelay = Objects.requireNonNull(noBatchDelay, "noBatchDelay");
    }

    public void run(Cancellation external) {
        Cancellation cancellation = () -> stopped || external.isCancelled();
        while (!cancellation.isCancelled()) {
            if (!runOnce(cancellation)) cancellation.await(noBatchDelay);
        }
        LOG.info("Subscription stopped");
    }

    /** One batch, start to finish. False if there was nothing to do. */
    public boolean runOnce(Cancellation cancellation) {
        List<MessageContext<T>> batch = topicConsumer.nextBatch(cancellation);
        if (batch.isEmpty()) return false;
        SubscriptionContext<T> context = new SubscriptionContext<>(batch);
        try {
            streamConsumer.onBatch(context);
        } catch (Exception e) {
            LOG.warn("Stream consumer failed on a batch of {}; nacking all of it", batch.size(), e);
            context.nackAll();
        }
        topicConsumer.finalizeBatch(context.acks(), context.nacks());
        return true;
    }

    public void stop() {
        stopped = true;
    }

    @Override
    public void close() {
        stop();
        topicConsumer.close();
    }
}
