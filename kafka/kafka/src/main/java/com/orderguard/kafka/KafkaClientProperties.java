package com.orderguard.kafka;

import com.orderguard.kafkaconfig.KafkaConfig;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;

import java.util.Properties;

/** Client settings for each role. Extra properties from the config go in first so the role's settings win. */
public final class KafkaClientProperties {

    private KafkaClientProperties() {
    }

    public static Properties admin(KafkaConfig cfg) {
        Properties p = cfg.clientProperties();
        p.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, cfg.bootstrapServer());
        p.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, (int) cfg.requestTimeout().toMillis());
        return p;
    }

    /** Group member of {@code groupId}; {@code clientId} is how the group reports the member's assignment. */
    public static Properties groupConsumer(KafkaConfig cfg, String groupId, String clientId, int maxPollRecords) {
        Properties p = cfg.clientProperties();
        p.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, cfg.bootstrapServer());
        p.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        p.put(ConsumerConfig.CLIENT_ID_CONFIG, clientId);
        p.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        p.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, cfg.startingOffsets());
        p.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, maxPollRecords);
        return p;
    }

    /** Assign-only consumer for positional reads: no group, nothing committed. */
    public static Properties reader(KafkaConfig cfg, String clientId) {
        Properties p = cfg.clientProperties();
        p.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, cfg.bootstrapServer());
        p.put(ConsumerConfig.CLIENT_ID_CONFIG, clientId);
        p.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        p.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        p.put(ConsumerConfig.ISOLATION_LEVEL_CONFIG, "read_committed");
        return p;
    }

    public static Properties producer(KafkaConfig cfg, String clientId) {
        Properties p = cfg.clientProperties();
        p.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, cfg.bootstrapServer());
        p.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);
        p.put(ProducerConfig.ACKS_CONFIG, "all");
        p.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        return p;
    }
}
