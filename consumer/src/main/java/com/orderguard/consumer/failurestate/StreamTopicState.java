package com.orderguard.consumer.failurestate;

import com.orderguard.consumer.abstraction.TopicStream;

/** Answer to a point lookup: the failure state of one key on one topic. */
public record StreamTopicState(String streamId, TopicState state) {

    public TopicStream topicStream() {
        return new TopicStream(state.topicName(), streamId);
    }
}
