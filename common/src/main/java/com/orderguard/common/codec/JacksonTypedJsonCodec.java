package com.orderguard.common.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderguard.common.errorsor.ErrorsOr;

import java.util.Objects;

/**
 * JSON codec for a single concrete type. Unknown properties are ignored on decode so older readers
 * tolerate state written by newer writers.
 */
public final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private final ObjectMapper mapper;
    private final Class<T> klass;

    public JacksonTypedJsonCodec(Class<T> klass) {
        this(new ObjectMapper(), klass);
    }

    public JacksonTypedJsonCodec(ObjectMapper baseMapper, Class<T> klass) {
        this.mapper = Objects.requireNonNull(baseMapper).copy();
        this.mapper.findAndRegisterModules();
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.klass = Objects.requireNonNull(klass);
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        return ErrorsOr.trying(() -> mapper.writeValueAsString(value),
                e -> "Failed to encode " + klass.getSimpleName() + " to JSON: " + e.getMessage());
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        if (json == null) return ErrorsOr.error("Cannot decode null JSON into " + klass.getSimpleName());
        return ErrorsOr.trying(() -> mapper.readValue(json, klass),
                e -> "Failed to decode " + klass.getSimpleName() + " from JSON: " + e.getMessage());
    }
}
