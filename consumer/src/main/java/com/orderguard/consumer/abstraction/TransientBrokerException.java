package com.orderguard.consumer.abstraction;

/** Timeout or temporary disconnect. The caller may simply try again. */
public class TransientBrokerException extends BrokerException {
    public TransientBrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
