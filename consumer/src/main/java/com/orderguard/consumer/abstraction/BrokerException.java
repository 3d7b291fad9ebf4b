package com.orderguard.consumer.abstraction;

/** Failure talking to the broker. Unless a subclass says otherwise, fatal for the consumer instance. */
public class BrokerException extends RuntimeException {
    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
