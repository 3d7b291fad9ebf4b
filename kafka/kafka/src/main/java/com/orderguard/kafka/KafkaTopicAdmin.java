package com.orderguard.kafka;

import com.orderguard.common.errorsor.ErrorsOr;
import com.orderguard.consumer.abstraction.BrokerException;
import com.orderguard.consumer.abstraction.TopicAdmin;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class KafkaTopicAdmin implements TopicAdmin {
    private static final Logger LOG = LoggerFactory.getLogger(KafkaTopicAdmin.class);

    private final Admin admin;
    private final int partitions;
    private final short replicationFactor;
    private final Duration timeout;

    public KafkaTopicAdmin(Admin admin, int partitions, short replicationFactor, Duration timeout) {
        this.admin = Objects.requireNonNull(admin, "admin");
        this.partitions = partitions;
        this.replicationFactor = replicationFactor;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public void ensureTopicExists(String topic) {
        ensure(newTopic(topic, Map.of()), topic);
    }

    /** Like {@link #ensureTopicExists} but the topic keeps only the latest value per key. */
    public void ensureCompactedTopicExists(String topic) {
        ensure(newTopic(topic, Map.of(TopicConfig.CLEANUP_POLICY_CONFIG, TopicConfig.CLEANUP_POLICY_COMPACT)), topic);
    }

    private void ensure(ErrorsOr<NewTopic> validated, String topic) {
        NewTopic newTopic = validated.addPrefixIfError("ensureTopicExists(" + topic + ")").valueOrThrow(BrokerException::new);
        if (ensureTopics(List.of(newTopic)))
            LOG.info("Created topic {} with {} partitions", topic, partitions);
    }

    /** Validates the topic settings before any call reaches the cluster. */
    ErrorsOr<NewTopic> newTopic(String topic, Map<String, String> configs) {
        List<String> errs = new ArrayList<>();
        if (topic == null || topic.isBlank())
            errs.add("topic must be non-empty");
        if (partitions < 1)
            errs.add("partitions must be >= 1");
        if (replicationFactor < 1)
            errs.add("replicationFactor must be >= 1");
        if (!errs.isEmpty()) return ErrorsOr.errors(errs);
        return ErrorsOr.lift(new NewTopic(topic, partitions, replicationFactor).configs(configs));
    }

    /** Creates the topics that are missing. True if anything was created; a concurrent create counts as existing. */
    private boolean ensureTopics(List<NewTopic> topics) {
        Set<String> existing = KafkaFutures.get(admin.listTopics().names(), timeout, "listTopics");
        List<NewTopic> toCreate = topics.stream().filter(t -> !existing.contains(t.name())).toList();
        if (toCreate.isEmpty()) return false;
        try {
            KafkaFutures.get(admin.createTopics(toCreate).all(), timeout, "createTopics");
        } catch (BrokerException e) {
            if (!(e.getCause() instanceof TopicExistsException)) throw e;
            LOG.debug("Topics {} created concurrently", toCreate);
            return false;
        }
        return true;
    }

    @Override
    public void deleteTopic(String topic) {
        try {
            KafkaFutures.get(admin.deleteTopics(List.of(topic)).all(), timeout, "deleteTopics");
            LOG.info("Deleted topic {}", topic);
        } catch (BrokerException e) {
            if (!(e.getCause() instanceof UnknownTopicOrPartitionException)) throw e;
        }
    }
}
