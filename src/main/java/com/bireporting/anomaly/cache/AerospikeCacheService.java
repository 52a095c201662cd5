package com.bireporting.anomaly.cache;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.bireporting.anomaly.config.AerospikeConfig;
import com.bireporting.anomaly.exception.CacheAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache entries live in the {@code bi_cache} set; expiry is delegated to the record TTL.
 */
@Service
@ConditionalOnProperty(prefix = "anomaly.cache", name = "type", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeCacheService implements CacheService {

    private static final Logger log = LoggerFactory.getLogger(AerospikeCacheService.class);

    private static final String BIN_VALUE = "value";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeCacheService(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Record record;
        try {
            record = client.get(readPolicy, key(key));
        } catch (AerospikeException e) {
            throw new CacheAccessException("Failed to read cache key " + key, e);
        }
        if (record == null) return Optional.empty();

        String json = record.getString(BIN_VALUE);
        if (json == null) return Optional.empty();
        return Optional.of(CacheJson.read(key, json, type));
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        WritePolicy policy = new WritePolicy(writePolicy);
        // Aerospike treats 0 as "namespace default" and -1 as "never expire"
        policy.expiration = (int) Math.max(1, Math.min(Integer.MAX_VALUE, ttl.toSeconds()));

        try {
            client.put(policy, key(key), new Bin(BIN_VALUE, CacheJson.write(key, value)));
        } catch (AerospikeException e) {
            throw new CacheAccessException("Failed to write cache key " + key, e);
        }
        log.debug("Cached {} for {}", key, ttl);
    }

    @Override
    public boolean remove(String key) {
        try {
            return client.delete(writePolicy, key(key));
        } catch (AerospikeException e) {
            throw new CacheAccessException("Failed to remove cache key " + key, e);
        }
    }

    private Key key(String key) {
        return new Key(namespace, AerospikeConfig.SET_CACHE, key);
    }
}
