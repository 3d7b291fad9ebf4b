package com.orderguard.consumer;

import com.orderguard.consumer.failurestate.RetrySchedule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionConfigTest {

    @Test
    @DisplayName("defaults: unlimited retries, 5s backoff, 1m range refresh, 1s stabilization")
    void defaults() {
        SubscriptionConfig c = SubscriptionConfig.defaults(List.of("accounts"), "billing");
        assertEquals(-1, c.maxRetries());
        assertFalse(c.retriesCapped());
        assertEquals(RetrySchedule.defaultSchedule(), c.retrySchedule());
        assertEquals(Duration.ofMinutes(1), c.rangeRefreshInterval());
        assertEquals(Duration.ofSeconds(1), c.rangeStabilizationDelay());
        assertEquals(Duration.ofMillis(200), c.noBatchDelay());
    }

    @Test
    void failure_state_topic_is_named_after_the_first_topic_and_subscription() {
        SubscriptionConfig c = SubscriptionConfig.defaults(List.of("accounts", "ledger"), "billing");
        assertEquals("accounts-billing-failure-state", c.failureStateTopic());
        assertEquals("accounts", c.primaryTopic());
    }

    @Test
    void loads_from_classpath_with_defaults_for_missing_keys() {
        SubscriptionConfig c = SubscriptionConfig.fromClasspath("subscription-test.properties");

        assertEquals(List.of("accounts", "ledger"), c.topics());
        assertEquals("billing", c.subscriptionName());
        assertEquals(50, c.batchSize());
        assertEquals(RetrySchedule.of(Duration.ofMillis(500), Duration.ofSeconds(5), Duration.ofMinutes(1)), c.retrySchedule());
        assertEquals(3, c.maxRetries());
        assertEquals(Duration.ofSeconds(30), c.rangeRefreshInterval());
        assertEquals(500, c.replayBatchSize());
    }

    @Test
    void topics_and_name_are_required() {
        Properties p = new Properties();
        p.setProperty("subscription.name", "billing");
        assertThrows(IllegalArgumentException.class, () -> SubscriptionConfig.fromProperties(p));

        Properties q = new Properties();
        q.setProperty("subscription.topics", "accounts");
        assertThrows(IllegalArgumentException.class, () -> SubscriptionConfig.fromProperties(q));
    }

    @Test
    void invalid_values_are_rejected() {
        SubscriptionConfig c = SubscriptionConfig.defaults(List.of("accounts"), "billing");
        assertThrows(IllegalArgumentException.class, () -> c.withBatchSizes(0, 10));
        assertThrows(IllegalArgumentException.class, () -> c.withMaxRetries(-2));
        assertThrows(IllegalArgumentException.class, () -> SubscriptionConfig.defaults(List.of(), "billing"));
    }
}
