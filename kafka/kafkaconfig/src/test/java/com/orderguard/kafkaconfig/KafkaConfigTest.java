package com.orderguard.kafkaconfig;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class KafkaConfigTest {

    @AfterEach
    void clearSysProps() {
        System.clearProperty("kafka.bootstrap");
        System.clearProperty("kafka.starting.offsets");
    }

    @Test
    void defaultsWithEmptyProperties() {
        KafkaConfig cfg = KafkaConfig.fromProperties(new Properties());

        assertEquals("localhost:9092", cfg.bootstrapServer());
        assertEquals("earliest", cfg.startingOffsets());
        assertEquals(12, cfg.partitions());
        assertEquals(1, cfg.replicationFactor());
        assertEquals(Duration.ofSeconds(30), cfg.requestTimeout());
        assertTrue(cfg.properties().isEmpty());
    }

    @Test
    void overridesAllProperties() {
        Properties p = new Properties();
        p.setProperty("kafka.bootstrap", "broker1:9092,broker2:9092");
        p.setProperty("kafka.starting.offsets", "LATEST");
        p.setProperty("kafka.partitions", "6");
        p.setProperty("kafka.replication.factor", "3");
        p.setProperty("kafka.request.timeout", "5s");

        KafkaConfig cfg = KafkaConfig.fromProperties(p);

        assertEquals("broker1:9092,broker2:9092", cfg.bootstrapServer());
        assertEquals("latest", cfg.startingOffsets());
        assertEquals(6, cfg.partitions());
        assertEquals(3, cfg.replicationFactor());
        assertEquals(Duration.ofSeconds(5), cfg.requestTimeout());
    }

    @Test
    void clientPropertiesArePassedThroughWithoutThePrefix() {
        Properties p = new Properties();
        p.setProperty("kafka.client.security.protocol", "SASL_SSL");
        p.setProperty("kafka.client.", "ignored");
        p.setProperty("kafka.partitions", "2");

        KafkaConfig cfg = KafkaConfig.fromProperties(p);

        assertEquals("SASL_SSL", cfg.properties().getProperty("security.protocol"));
        assertEquals(1, cfg.properties().size());

        Properties copy = cfg.clientProperties();
        copy.setProperty("client.id", "x");
        assertNull(cfg.properties().getProperty("client.id"), "clientProperties must not leak into the config");
    }

    @Test
    void invalidStartingOffsetsFallsBackToEarliest() {
        Properties p = new Properties();
        p.setProperty("kafka.starting.offsets", "INVALID_VALUE");

        assertEquals("earliest", KafkaConfig.fromProperties(p).startingOffsets());
    }

    @Test
    void invalidValuesAreRejected() {
        Properties p = new Properties();
        p.setProperty("kafka.partitions", "0");
        assertThrows(IllegalArgumentException.class, () -> KafkaConfig.fromProperties(p));

        assertThrows(IllegalArgumentException.class,
                () -> new KafkaConfig(" ", "earliest", 1, (short) 1, Duration.ofSeconds(1), null));
    }

    @Test
    void fromSystemPropsReadsSystemProperties() {
        System.setProperty("kafka.bootstrap", "sys:9092");
        System.setProperty("kafka.starting.offsets", "latest");

        KafkaConfig cfg = KafkaConfig.fromSystemProps();

        assertEquals("sys:9092", cfg.bootstrapServer());
        assertEquals("latest", cfg.startingOffsets());
    }
}
