package com.orderguard.common.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed access to {@link Properties} with defaults. Durations accept {@code 250ms}, {@code 5s},
 * {@code 2m}, {@code 1h}, {@code 1d} or ISO-8601 ({@code PT5S}).
 */
public final class PropertyReader {
    private final Properties props;

    public PropertyReader(Properties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    /** Load a properties file from the classpath; missing resources are an error. */
    public static Properties loadFromClasspath(String resource) {
        Properties props = new Properties();
        try (InputStream is = PropertyReader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) throw new IllegalStateException(resource + " not found on classpath");
            props.load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resource, e);
        }
        return props;
    }

    public Properties properties() {
        return props;
    }

    public String getString(String key, String def) {
        String v = props.getProperty(key);
        return v == null || v.isBlank() ? def : v.trim();
    }

    public int getInt(String key, int def) {
        String v = props.getProperty(key);
        return v == null || v.isBlank() ? def : Integer.parseInt(v.trim());
    }

    public long getLong(String key, long def) {
        String v = props.getProperty(key);
        return v == null || v.isBlank() ? def : Long.parseLong(v.trim());
    }

    public Duration getDuration(String key, Duration def) {
        String v = props.getProperty(key);
        return v == null || v.isBlank() ? def : parseDuration(v);
    }

    /** Comma separated list, blanks dropped. */
    public List<String> getList(String key, List<String> def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        List<String> out = new ArrayList<>();
        for (String part : v.split(",")) {
            if (!part.isBlank()) out.add(part.trim());
        }
        return out;
    }

    public List<Duration> getDurations(String key, List<Duration> def) {
        List<String> raw = getList(key, null);
        if (raw == null) return def;
        return raw.stream().map(PropertyReader::parseDuration).toList();
    }

    public static Duration parseDuration(String raw) {
        String s = Objects.requireNonNull(raw, "raw").trim().toLowerCase(Locale.ROOT);
        if (s.startsWith("pt") || s.startsWith("p")) return Duration.parse(s.toUpperCase(Locale.ROOT));
        try {
            if (s.endsWith("ms")) return Duration.ofMillis(Long.parseLong(s.substring(0, s.length() - 2).trim()));
            if (s.endsWith("s")) return Duration.ofSeconds(Long.parseLong(s.substring(0, s.length() - 1).trim()));
            if (s.endsWith("m")) return Duration.ofMinutes(Long.parseLong(s.substring(0, s.length() - 1).trim()));
            if (s.endsWith("h")) return Duration.ofHours(Long.parseLong(s.substring(0, s.length() - 1).trim()));
            if (s.endsWith("d")) return Duration.ofDays(Long.parseLong(s.substring(0, s.length() - 1).trim()));
            return Duration.ofMillis(Long.parseLong(s));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cannot parse duration: " + raw, e);
        }
    }
}
