package com.ops.alertdecision.audit;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ops.alertdecision.config.AerospikeConfig;
import com.ops.alertdecision.exception.StoreException;
import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.AuditEntry;
import com.ops.alertdecision.model.DecisionAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Durable audit log. One record per entry, keyed by entry id; the alert snapshot
 * and degraded steps are stored as JSON strings.
 */
@Repository
@ConditionalOnProperty(name = "audit.store", havingValue = "aerospike")
public class AerospikeAuditLogRepository implements AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AerospikeAuditLogRepository.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public AerospikeAuditLogRepository(AerospikeClient client,
                                       @Qualifier("aerospikeNamespace") String namespace,
                                       @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                       ObjectMapper objectMapper) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(AuditEntry entry) {
        Key key = new Key(namespace, AerospikeConfig.SET_AUDIT_LOG, entry.getEntryId());
        try {
            client.put(writePolicy, key,
                    new Bin("entryId", entry.getEntryId()),
                    new Bin("alertId", entry.getAlertId()),
                    new Bin("recordedAt", entry.getRecordedAt().toEpochMilli()),
                    new Bin(AerospikeConfig.BIN_ACTION, entry.getAction().getAuditKey()),
                    new Bin("reason", entry.getReason()),
                    new Bin("confidence", entry.getConfidence()),
                    new Bin("alert", objectMapper.writeValueAsString(entry.getAlert())),
                    new Bin("degradedSteps", objectMapper.writeValueAsString(entry.getDegradedSteps())));
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize audit entry " + entry.getEntryId(), e);
        } catch (AerospikeException e) {
            throw new StoreException("Failed to write audit entry " + entry.getEntryId(), e);
        }
    }

    @Override
    public List<AuditEntry> find(DecisionAction action, int limit) {
        List<AuditEntry> results = scan(action);
        results.sort(Comparator.comparing(AuditEntry::getRecordedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    @Override
    public List<AuditEntry> findAll() {
        return scan(null);
    }

    private List<AuditEntry> scan(DecisionAction action) {
        List<AuditEntry> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUDIT_LOG, (key, record) -> {
                if (action != null && !action.getAuditKey().equals(record.getString(AerospikeConfig.BIN_ACTION))) {
                    return;
                }
                AuditEntry entry = mapRecord(record);
                synchronized (results) {
                    results.add(entry);
                }
            });
        } catch (AerospikeException e) {
            throw new StoreException("Audit log scan failed", e);
        }
        return results;
    }

    private AuditEntry mapRecord(Record record) {
        return AuditEntry.builder()
                .entryId(record.getString("entryId"))
                .alertId(record.getString("alertId"))
                .recordedAt(Instant.ofEpochMilli(record.getLong("recordedAt")))
                .action(DecisionAction.fromAuditKey(record.getString(AerospikeConfig.BIN_ACTION)))
                .reason(record.getString("reason"))
                .confidence(record.getDouble("confidence"))
                .alert(readJson(record.getString("alert"), Alert.class))
                .degradedSteps(readDegradedSteps(record.getString("degradedSteps")))
                .build();
    }

    private <T> T readJson(String json, Class<T> type) {
        if (json == null) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize audit field: {}", e.getMessage());
            return null;
        }
    }

    private List<String> readDegradedSteps(String json) {
        if (json == null) return List.of();
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize degraded steps: {}", e.getMessage());
            return List.of();
        }
    }
}
