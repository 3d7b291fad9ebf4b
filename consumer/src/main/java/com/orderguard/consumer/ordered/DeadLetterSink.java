package com.orderguard.consumer.ordered;

import com.orderguard.consumer.abstraction.MessageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Receives replayed messages that used up their retries. The key then moves past them. */
@FunctionalInterface
public interface DeadLetterSink<T> {

    void deadLetter(MessageContext<T> message, int timesRetried);

    static <T> DeadLetterSink<T> logging() {
        Logger log = LoggerFactory.getLogger(DeadLetterSink.class);
        return (message, timesRetried) ->
                log.error("Giving up on {} after {} retries; payload {}", message, timesRetried, message.payload());
    }
}
