package com.orderguard.consumer.failurestate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Write-behind cache over a {@link ControlTopic}. The in-memory index is updated first and the full
 * state of the key is then published. {@link #initialize()} folds in everything published since the
 * last call, including writes from other consumers of the subscription.
 * <p>
 * Not thread safe.
 */
public final class FailureStateTopic implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(FailureStateTopic.class);

    private final ControlTopic controlTopic;
    private final Map<String, StreamState> index = new LinkedHashMap<>();
    private boolean initialized;

    public FailureStateTopic(ControlTopic controlTopic) {
        this.controlTopic = Objects.requireNonNull(controlTopic, "controlTopic");
    }

    public void initialize() {
        List<StreamState> replayed = controlTopic.replayToHead();
        for (StreamState s : replayed) apply(s);
        if (!initialized) {
            LOG.info("Failure state loaded: {} states replayed, {} keys tracked", replayed.size(), index.size());
            initialized = true;
        } else if (!replayed.isEmpty()) {
            LOG.debug("Failure state caught up: {} states replayed, {} keys tracked", replayed.size(), index.size());
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    public Optional<StreamState> get(String streamId) {
        checkInitialized();
        return Optional.ofNullable(index.get(streamId));
    }

    /** Insertion ordered view. */
    public Collection<StreamState> all() {
        checkInitialized();
        return Collections.unmodifiableCollection(index.values());
    }

    public int size() {
        checkInitialized();
        return index.size();
    }

    public void put(StreamState state) {
        checkInitialized();
        apply(state);
        controlTopic.publish(state);
    }

    private void apply(StreamState state) {
        if (state.tracksNothing()) index.remove(state.streamId());
        else index.put(state.streamId(), state);
    }

    private void checkInitialized() {
        if (!initialized) throw new IllegalStateException("FailureStateTopic used before initialize()");
    }

    @Override
    public void close() {
        controlTopic.close();
    }
}
