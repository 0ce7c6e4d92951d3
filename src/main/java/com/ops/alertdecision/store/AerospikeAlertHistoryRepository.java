package com.ops.alertdecision.store;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.exp.Exp;
import com.aerospike.client.query.Filter;
import com.aerospike.client.query.IndexType;
import com.aerospike.client.query.RecordSet;
import com.aerospike.client.query.Statement;
import com.aerospike.client.policy.QueryPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.aerospike.client.task.IndexTask;
import com.ops.alertdecision.config.AerospikeConfig;
import com.ops.alertdecision.exception.StoreException;
import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.AlertSource;
import com.ops.alertdecision.model.Severity;
import com.ops.alertdecision.model.TimeWindow;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Repository
public class AerospikeAlertHistoryRepository implements HistoricalAlertStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeAlertHistoryRepository.class);

    private static final String BIN_CREATED_AT = "createdAt";
    private static final String BIN_SEVERITY = "severity";
    private static final String BIN_TITLE = "title";

    private final AerospikeClient client;
    private final String namespace;
    private final QueryPolicy queryPolicy;
    private final WritePolicy writePolicy;

    public AerospikeAlertHistoryRepository(AerospikeClient client,
                                           @Qualifier("aerospikeNamespace") String namespace,
                                           @Qualifier("defaultQueryPolicy") QueryPolicy queryPolicy,
                                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.queryPolicy = queryPolicy;
        this.writePolicy = writePolicy;
    }

    @PostConstruct
    public void ensureIndexes() {
        createIndex("idx_history_pattern", AerospikeConfig.BIN_PATTERN_KEY);
        createIndex("idx_history_host", AerospikeConfig.BIN_HOST);
    }

    @Override
    public List<Alert> query(String host, String title, Severity severity, TimeWindow window) {
        Statement stmt = statement(Filter.equal(AerospikeConfig.BIN_PATTERN_KEY, Alert.patternKey(host, title)));

        // the joined key is ambiguous when host or title contain the separator
        Exp samePattern = Exp.and(
                Exp.eq(Exp.stringBin(AerospikeConfig.BIN_HOST), Exp.val(host)),
                Exp.eq(Exp.stringBin(BIN_TITLE), Exp.val(title)));
        Exp filter = severity != null
                ? Exp.and(createdWithin(window), samePattern,
                        Exp.eq(Exp.stringBin(BIN_SEVERITY), Exp.val(severity.name())))
                : Exp.and(createdWithin(window), samePattern);

        List<Alert> results = runQuery(stmt, filter, "pattern " + Alert.patternKey(host, title));
        results.removeIf(a -> !host.equals(a.getHost()) || !title.equals(a.getTitle())
                || (severity != null && severity != a.getSeverity()));
        return results;
    }

    @Override
    public List<Alert> queryByHost(String host, TimeWindow window) {
        Statement stmt = statement(Filter.equal(AerospikeConfig.BIN_HOST, host));
        return runQuery(stmt, createdWithin(window), "host " + host);
    }

    @Override
    public void append(Alert alert) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERT_HISTORY, UUID.randomUUID().toString());
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin(AerospikeConfig.BIN_PATTERN_KEY, alert.getPatternKey()),
                new Bin(AerospikeConfig.BIN_HOST, alert.getHost()),
                new Bin(BIN_TITLE, alert.getTitle()),
                new Bin("source", alert.getSource().name()),
                new Bin(BIN_SEVERITY, alert.getSeverity().name()),
                new Bin(BIN_CREATED_AT, alert.getCreatedAt().toEpochMilli())));

        if (alert.getAlertId() != null) {
            bins.add(new Bin("alertId", alert.getAlertId()));
        }
        if (alert.getStatus() != null) {
            bins.add(new Bin("status", alert.getStatus()));
        }
        if (alert.getResolvedAt() != null) {
            bins.add(new Bin("resolvedAt", alert.getResolvedAt().toEpochMilli()));
        }
        if (alert.getDecisionReason() != null) {
            bins.add(new Bin("decisionReason", alert.getDecisionReason()));
        }

        try {
            client.put(writePolicy, key, bins.toArray(new Bin[0]));
        } catch (AerospikeException e) {
            throw new StoreException("Failed to append alert to history for pattern " + alert.getPatternKey(), e);
        }
    }

    private Statement statement(Filter filter) {
        Statement stmt = new Statement();
        stmt.setNamespace(namespace);
        stmt.setSetName(AerospikeConfig.SET_ALERT_HISTORY);
        stmt.setFilter(filter);
        return stmt;
    }

    private static Exp createdWithin(TimeWindow window) {
        return Exp.and(
                Exp.ge(Exp.intBin(BIN_CREATED_AT), Exp.val(window.from().toEpochMilli())),
                Exp.le(Exp.intBin(BIN_CREATED_AT), Exp.val(window.to().toEpochMilli())));
    }

    private List<Alert> runQuery(Statement stmt, Exp filter, String target) {
        QueryPolicy policy = new QueryPolicy(queryPolicy);
        policy.filterExp = Exp.build(filter);

        List<Alert> results = new ArrayList<>();
        try (RecordSet rs = client.query(policy, stmt)) {
            while (rs.next()) {
                results.add(mapRecord(rs.getRecord()));
            }
        } catch (AerospikeException e) {
            throw new StoreException("History query failed for " + target, e);
        }

        results.sort(Comparator.comparing(Alert::getCreatedAt));
        return results;
    }

    private Alert mapRecord(Record record) {
        return Alert.builder()
                .alertId(record.getString("alertId"))
                .source(AlertSource.fromString(record.getString("source")))
                .host(record.getString(AerospikeConfig.BIN_HOST))
                .title(record.getString(BIN_TITLE))
                .severity(Severity.valueOf(record.getString(BIN_SEVERITY)))
                .status(record.getString("status"))
                .createdAt(Instant.ofEpochMilli(record.getLong(BIN_CREATED_AT)))
                .resolvedAt(record.getValue("resolvedAt") != null
                        ? Instant.ofEpochMilli(record.getLong("resolvedAt")) : null)
                .decisionReason(record.getString("decisionReason"))
                .build();
    }

    private void createIndex(String indexName, String bin) {
        try {
            IndexTask task = client.createIndex(null, namespace, AerospikeConfig.SET_ALERT_HISTORY,
                    indexName, bin, IndexType.STRING);
            if (task != null) {
                task.waitTillComplete();
            }
            log.info("Created secondary index {} on {}.{}", indexName, AerospikeConfig.SET_ALERT_HISTORY, bin);
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.INDEX_ALREADY_EXISTS) {
                log.debug("Secondary index {} already exists", indexName);
            } else {
                log.warn("Could not create secondary index {}: {}", indexName, e.getMessage());
            }
        }
    }
}
