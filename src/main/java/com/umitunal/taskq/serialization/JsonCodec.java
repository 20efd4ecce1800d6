package com.umitunal.taskq.serialization;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.util.Map;

/**
 * JSON codec using Jackson.
 *
 * @param <T> the type to serialize
 */
public class JsonCodec<T> implements PayloadCodec<T> {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final JavaType type;

    public JsonCodec(Class<T> type) {
        this(type, createDefaultMapper());
    }

    public JsonCodec(Class<T> type, ObjectMapper mapper) {
        this.mapper = mapper;
        this.type = mapper.constructType(type);
    }

    public JsonCodec(TypeReference<T> type) {
        this(type, createDefaultMapper());
    }

    public JsonCodec(TypeReference<T> type, ObjectMapper mapper) {
        this.mapper = mapper;
        this.type = mapper.constructType(type);
    }

    /**
     * Codec for free-form JSON objects.
     */
    public static JsonCodec<Map<String, Object>> forMap() {
        return new JsonCodec<>(MAP_TYPE);
    }

    @Override
    public byte[] encode(T payload) {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new CodecException("Failed to serialize to JSON", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new CodecException("Failed to deserialize from JSON", e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
