package com.bireporting.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bireporting.anomaly.config.AerospikeConfig;
import com.bireporting.anomaly.model.Anomaly;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * One record per detection run in the {@code anomaly_history} set, holding the run's
 * ranked anomalies as JSON. Read back for trend analysis.
 */
@Repository
public class AnomalyHistoryRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyHistoryRepository.class);

    private static final String ANONYMOUS = "anonymous";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public AnomalyHistoryRepository(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public void save(String userId, List<Anomaly> anomalies, Instant detectedAt) {
        if (anomalies.isEmpty()) return;

        String runId = UUID.randomUUID().toString();
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_HISTORY, runId);

        client.put(writePolicy, key,
                new Bin("runId", runId),
                new Bin("userId", userId != null ? userId : ANONYMOUS),
                new Bin("detectedAt", detectedAt.toEpochMilli()),
                new Bin("count", anomalies.size()),
                new Bin("anomalies", serializeAnomalies(anomalies)));
    }

    /**
     * Anomalies from runs at or after {@code from}, optionally restricted to one user.
     */
    public List<Anomaly> findSince(Instant from, String userId) {
        List<Anomaly> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        long fromMillis = from.toEpochMilli();

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALY_HISTORY,
                (key, record) -> {
                    if (record.getLong("detectedAt") < fromMillis) return;
                    if (userId != null && !userId.equals(record.getString("userId"))) return;

                    List<Anomaly> anomalies = deserializeAnomalies(record);
                    synchronized (results) {
                        results.addAll(anomalies);
                    }
                });

        return results;
    }

    private String serializeAnomalies(List<Anomaly> anomalies) {
        try {
            return objectMapper.writeValueAsString(anomalies);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize anomalies", e);
        }
    }

    private List<Anomaly> deserializeAnomalies(Record record) {
        String json = record.getString("anomalies");
        if (json == null || json.isEmpty()) return Collections.emptyList();
        try {
            return objectMapper.readValue(json, new TypeReference<List<Anomaly>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize anomaly history run {}", record.getString("runId"), e);
            return Collections.emptyList();
        }
    }
}
