package com.orderguard.kafkaconfig;

import com.orderguard.common.config.PropertyReader;

import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Connection settings shared by every Kafka client the consumer creates.
 *
 * @param bootstrapServer   {@code host:port[,host:port]}
 * @param startingOffsets   "earliest" or "latest"; where a new subscription starts
 * @param partitions        partitions for topics this process creates
 * @param replicationFactor replication for topics this process creates
 * @param requestTimeout    bound on admin calls, sends and control topic catch-up
 * @param properties        extra client properties ({@code kafka.client.*} with the prefix removed)
 */
public record KafkaConfig(
        String bootstrapServer,
        String startingOffsets,
        int partitions,
        short replicationFactor,
        Duration requestTimeout,
        Properties properties
) {
    public static final String PREFIX = "kafka.";
    private static final String CLIENT_PREFIX = PREFIX + "client.";

    public KafkaConfig {
        if (bootstrapServer == null || bootstrapServer.isBlank())
            throw new IllegalArgumentException("bootstrapServer must be non-empty");
        if (partitions < 1) throw new IllegalArgumentException("partitions must be >= 1");
        if (replicationFactor < 1) throw new IllegalArgumentException("replicationFactor must be >= 1");
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero())
            throw new IllegalArgumentException("requestTimeout must be positive");
        properties = copy(properties);
    }

    public static KafkaConfig fromSystemProps() {
        return fromProperties(System.getProperties());
    }

    public static KafkaConfig fromProperties(Properties p) {
        PropertyReader r = new PropertyReader(p);
        String offsets = r.getString(PREFIX + "starting.offsets", "earliest").toLowerCase(Locale.ROOT);
        if (!offsets.equals("earliest") && !offsets.equals("latest")) {
            offsets = "earliest"; // fallback
        }

        Properties extra = new Properties();
        for (String name : p.stringPropertyNames()) {
            if (name.startsWith(CLIENT_PREFIX) && name.length() > CLIENT_PREFIX.length())
                extra.setProperty(name.substring(CLIENT_PREFIX.length()), p.getProperty(name));
        }

        return new KafkaConfig(
                r.getString(PREFIX + "bootstrap", "localhost:9092"),
                offsets,
                r.getInt(PREFIX + "partitions", 12),
                (short) r.getInt(PREFIX + "replication.factor", 1),
                r.getDuration(PREFIX + "request.timeout", Duration.ofSeconds(30)),
                extra
        );
    }

    /** A fresh copy of the extra client properties, safe for the caller to add to. */
    public Properties clientProperties() {
        return copy(properties);
    }

    private static Properties copy(Properties source) {
        Properties out = new Properties();
        if (source != null) out.putAll(source);
        return out;
    }
}
