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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AerospikeCacheServiceTest {

    @Mock private AerospikeClient client;

    private AerospikeCacheService cache;

    @BeforeEach
    void setUp() {
        cache = new AerospikeCacheService(client, "bireporting", new WritePolicy(), new Policy());
    }

    @Test
    void set_writesJsonWithRecordTtl() {
        cache.set("anomaly_alert:STATISTICAL:Revenue:u1", 1740823200000L, Duration.ofMinutes(30));

        ArgumentCaptor<WritePolicy> policy = ArgumentCaptor.forClass(WritePolicy.class);
        ArgumentCaptor<Key> key = ArgumentCaptor.forClass(Key.class);
        ArgumentCaptor<Bin> bin = ArgumentCaptor.forClass(Bin.class);
        verify(client).put(policy.capture(), key.capture(), bin.capture());

        assertThat(policy.getValue().expiration).isEqualTo(1800);
        assertThat(key.getValue().namespace).isEqualTo("bireporting");
        assertThat(key.getValue().setName).isEqualTo(AerospikeConfig.SET_CACHE);
        assertThat(bin.getValue().name).isEqualTo("value");
        assertThat(bin.getValue().value.toString()).isEqualTo("1740823200000");
    }

    @Test
    void set_subSecondTtl_isRoundedUpToOneSecond() {
        cache.set("k", "v", Duration.ofMillis(200));

        ArgumentCaptor<WritePolicy> policy = ArgumentCaptor.forClass(WritePolicy.class);
        verify(client).put(policy.capture(), any(Key.class), any(Bin.class));
        assertThat(policy.getValue().expiration).isEqualTo(1);
    }

    @Test
    void get_decodesStoredJson() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(new Record(Map.of("value", "42"), 1, 0));

        assertThat(cache.get("k", Long.class)).contains(42L);
    }

    @Test
    void get_missingRecord_isEmpty() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(null);

        assertThat(cache.get("k", Long.class)).isEmpty();
    }

    @Test
    void storeFailures_areWrapped() {
        when(client.get(any(Policy.class), any(Key.class))).thenThrow(new AerospikeException("timeout"));
        when(client.delete(any(WritePolicy.class), any(Key.class))).thenThrow(new AerospikeException("timeout"));

        assertThatThrownBy(() -> cache.get("k", Long.class)).isInstanceOf(CacheAccessException.class);
        assertThatThrownBy(() -> cache.remove("k")).isInstanceOf(CacheAccessException.class);
    }

    @Test
    void remove_delegatesToDelete() {
        when(client.delete(any(WritePolicy.class), any(Key.class))).thenReturn(true);

        assertThat(cache.remove("k")).isTrue();
    }
}
