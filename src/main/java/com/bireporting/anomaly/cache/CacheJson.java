package com.bireporting.anomaly.cache;

import com.bireporting.anomaly.exception.CacheAccessException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON encoding shared by the cache implementations.
 */
final class CacheJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private CacheJson() {}

    static String write(String key, Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (Exception e) {
            throw new CacheAccessException("Failed to serialize cache value for key " + key, e);
        }
    }

    static <T> T read(String key, String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (Exception e) {
            throw new CacheAccessException("Failed to deserialize cache value for key " + key, e);
        }
    }
}
