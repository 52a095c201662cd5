package com.bireporting.anomaly.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Expiring key/value store shared by the alert cooldown, persisted configuration and model
 * metadata. Values are stored as JSON, so a read returns a detached copy.
 */
public interface CacheService {

    /**
     * @return the live value for the key, or empty if absent or expired
     * @throws com.bireporting.anomaly.exception.CacheAccessException if the store fails
     */
    <T> Optional<T> get(String key, Class<T> type);

    /**
     * Store a value that expires after {@code ttl}.
     *
     * @throws com.bireporting.anomaly.exception.CacheAccessException if the store fails
     */
    void set(String key, Object value, Duration ttl);

    /**
     * @return true if a live entry was removed
     */
    boolean remove(String key);
}
