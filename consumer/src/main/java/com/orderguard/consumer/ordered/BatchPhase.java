package com.orderguard.consumer.ordered;

/** The two phases the ordered consumer alternates between. */
public enum BatchPhase {
    /** New messages from the subscribed topics, minus keys under recovery. */
    NORMAL,
    /** Replay of keys that failed, read back from their failure position. */
    FAILURE_RETRY;

    public BatchPhase next() {
        return this == NORMAL ? FAILURE_RETRY : NORMAL;
    }

    /** A retry turn that found nothing hands the same call over to the normal phase. */
    public BatchPhase afterRetryAttempt(boolean retryBatchEmpty) {
        if (this != FAILURE_RETRY) return this;
        return retryBatchEmpty ? NORMAL : FAILURE_RETRY;
    }
}
