package com.orderguard.consumer.abstraction;

public final class CancellationSource implements Cancellation {
    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }
}
