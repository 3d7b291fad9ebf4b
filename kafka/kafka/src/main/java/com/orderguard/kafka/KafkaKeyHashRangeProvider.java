package com.orderguard.kafka;

import com.orderguard.consumer.abstraction.BrokerException;
import com.orderguard.consumer.abstraction.KeyHashRange;
import com.orderguard.consumer.abstraction.KeyHashRangeProvider;
import com.orderguard.consumer.abstraction.KeyHashRanges;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.ConsumerGroupDescription;
import org.apache.kafka.clients.admin.MemberDescription;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.common.TopicPartition;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Owned ranges from the group's current assignment: partition {@code p} of the topic assigned to the member
 * whose client id is the consumer name is the range {@code [p, p+1)}. A consumer the group does not know
 * (not joined yet, or rebalancing) owns nothing.
 */
public final class KafkaKeyHashRangeProvider implements KeyHashRangeProvider {
    private final Admin admin;
    private final Duration timeout;

    public KafkaKeyHashRangeProvider(Admin admin, Duration timeout) {
        this.admin = Objects.requireNonNull(admin, "admin");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public KeyHashRanges getOwnedRanges(String topic, String subscriptionName, String consumerName) {
        KafkaKeyHasher hasher = new KafkaKeyHasher(partitionCount(topic));
        ConsumerGroupDescription group = KafkaFutures.get(
                admin.describeConsumerGroups(List.of(subscriptionName)).describedGroups().get(subscriptionName),
                timeout, "describeConsumerGroups(" + subscriptionName + ")");
        Set<KeyHashRange> ranges = new LinkedHashSet<>();
        for (MemberDescription member : group.members()) {
            if (!consumerName.equals(member.clientId())) continue;
            for (TopicPartition tp : member.assignment().topicPartitions()) {
                if (tp.topic().equals(topic)) ranges.add(new KeyHashRange(tp.partition(), tp.partition() + 1));
            }
        }
        return new KeyHashRanges(ranges, hasher);
    }

    private int partitionCount(String topic) {
        TopicDescription description = KafkaFutures.get(admin.describeTopics(List.of(topic)).allTopicNames(),
                timeout, "describeTopics(" + topic + ")").get(topic);
        if (description == null) throw new BrokerException("Topic " + topic + " not described");
        return description.partitions().size();
    }
}
