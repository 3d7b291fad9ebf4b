package com.orderguard.consumer.failurestate;

import java.util.List;

/**
 * Durable, key-compacted log of {@link StreamState}s keyed by stream id. Latest write per key wins;
 * an empty state deletes the key.
 */
public interface ControlTopic extends AutoCloseable {

    /** Synchronous: returns once the broker has the write. */
    void publish(StreamState state);

    /**
     * States published since the previous call, read up to the head as it was when this call began.
     * The first call reads from the beginning of the log. Tombstones come back as empty states.
     */
    List<StreamState> replayToHead();

    @Override
    void close();
}
