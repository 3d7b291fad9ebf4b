package com.orderguard.consumer.abstraction;

/** The underlying client was closed, usually by a shutdown racing the consumption loop. */
public class AlreadyClosedException extends BrokerException {
    public AlreadyClosedException(String message) {
        super(message);
    }

    public AlreadyClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
