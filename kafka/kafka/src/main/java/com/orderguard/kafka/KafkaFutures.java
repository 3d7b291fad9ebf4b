package com.orderguard.kafka;

import com.orderguard.consumer.abstraction.BrokerException;
import com.orderguard.consumer.abstraction.TransientBrokerException;
import org.apache.kafka.common.errors.RetriableException;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/** Blocking waits on Kafka client futures, translated into the {@link BrokerException} hierarchy. */
final class KafkaFutures {

    private KafkaFutures() {
    }

    static <V> V get(Future<V> future, Duration timeout, String what) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException(what + " interrupted", e);
        } catch (TimeoutException e) {
            throw new TransientBrokerException(what + " timed out after " + timeout, e);
        } catch (ExecutionException e) {
            throw translate(what, e.getCause() == null ? e : e.getCause());
        }
    }

    static BrokerException translate(String what, Throwable cause) {
        if (cause instanceof BrokerException be) return be;
        if (cause instanceof RetriableException)
            return new TransientBrokerException(what + " failed: " + cause.getMessage(), cause);
        return new BrokerException(what + " failed: " + cause.getMessage(), cause);
    }
}
