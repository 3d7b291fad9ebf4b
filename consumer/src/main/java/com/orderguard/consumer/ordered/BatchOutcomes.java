package com.orderguard.consumer.ordered;

import com.orderguard.consumer.abstraction.MessageContext;
import com.orderguard.consumer.abstraction.TopicStream;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Acks and nacks of one batch folded per (topic, key) in sequence order.
 * <p>
 * Only what precedes the first nack of a key counts as done: later acks of that key will be read again
 * when the key is replayed from the nack.
 */
final class BatchOutcomes {

    record Outcome<T>(TopicStream topicStream, @Nullable MessageContext<T> lastLeadingAck, @Nullable MessageContext<T> firstNack) {
        boolean failed() {
            return firstNack != null;
        }
    }

    private record Entry<T>(MessageContext<T> message, boolean acked) {
    }

    private BatchOutcomes() {
    }

    static <T> List<Outcome<T>> group(List<MessageContext<T>> acks, List<MessageContext<T>> nacks) {
        Map<TopicStream, List<Entry<T>>> byStream = new LinkedHashMap<>();
        for (MessageContext<T> m : acks) byStream.computeIfAbsent(m.topicStream(), k -> new ArrayList<>()).add(new Entry<>(m, true));
        for (MessageContext<T> m : nacks) byStream.computeIfAbsent(m.topicStream(), k -> new ArrayList<>()).add(new Entry<>(m, false));

        List<Outcome<T>> out = new ArrayList<>(byStream.size());
        byStream.forEach((ts, entries) -> {
            entries.sort(Comparator.comparingLong(e -> e.message().sequenceId()));
            MessageContext<T> lastAck = null;
            MessageContext<T> nack = null;
            for (Entry<T> e : entries) {
                if (!e.acked()) {
                    nack = e.message();
                    break;
                }
                lastAck = e.message();
            }
            out.add(new Outcome<>(ts, lastAck, nack));
        });
        return out;
    }
}
