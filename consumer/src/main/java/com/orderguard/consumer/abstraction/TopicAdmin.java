package com.orderguard.consumer.abstraction;

public interface TopicAdmin {
    /** Create the topic if it does not exist. Existing topics are left alone. */
    void ensureTopicExists(String topic);

    /** Delete the topic. Deleting a missing topic is not an error. */
    void deleteTopic(String topic);
}
