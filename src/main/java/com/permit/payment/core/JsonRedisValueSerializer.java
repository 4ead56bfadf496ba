package com.permit.payment.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;

/**
 * Serializes one cached value type to/from JSON for Redis. No polymorphic type
 * (@class) in the stored JSON, so entries survive class renames and are readable
 * by other tools.
 */
public class JsonRedisValueSerializer<T> implements RedisSerializer<T> {

    private final ObjectMapper mapper;
    private final Class<T> type;

    public JsonRedisValueSerializer(Class<T> type) {
        this.type = type;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public byte[] serialize(T value) throws SerializationException {
        if (value == null) return null;
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new SerializationException("Could not serialize " + type.getSimpleName(), e);
        }
    }

    @Override
    public T deserialize(byte[] bytes) throws SerializationException {
        if (bytes == null || bytes.length == 0) return null;
        try {
            return mapper.readValue(bytes, type);
        } catch (Exception e) {
            throw new SerializationException("Could not deserialize " + type.getSimpleName(), e);
        }
    }
}
