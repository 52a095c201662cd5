package com.bireporting.anomaly.cache;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cache for development and tests. Expired entries are dropped lazily on read.
 */
@Service
@ConditionalOnProperty(prefix = "anomaly.cache", name = "type", havingValue = "memory")
public class InMemoryCacheService implements CacheService {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCacheService(Clock clock) {
        this.clock = clock;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = entries.get(key);
        if (entry == null) return Optional.empty();
        if (!entry.expiresAt().isAfter(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(CacheJson.read(key, entry.json(), type));
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        entries.put(key, new Entry(CacheJson.write(key, value), clock.instant().plus(ttl)));
    }

    @Override
    public boolean remove(String key) {
        Entry removed = entries.remove(key);
        return removed != null && removed.expiresAt().isAfter(clock.instant());
    }

    private record Entry(String json, Instant expiresAt) {}
}
