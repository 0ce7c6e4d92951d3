package com.ops.alertdecision.store;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.QueryPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.aerospike.client.query.RecordSet;
import com.aerospike.client.query.Statement;
import com.ops.alertdecision.exception.StoreException;
import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.DecisionReasons;
import com.ops.alertdecision.model.Severity;
import com.ops.alertdecision.model.TimeWindow;
import com.ops.alertdecision.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static com.ops.alertdecision.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AerospikeAlertHistoryRepositoryTest {

    private AerospikeClient client;
    private AerospikeAlertHistoryRepository repository;

    private final TimeWindow lastHour = TimeWindow.lookback(NOW, Duration.ofHours(1));

    @BeforeEach
    void setUp() {
        client = mock(AerospikeClient.class);
        repository = new AerospikeAlertHistoryRepository(client, "test", new QueryPolicy(), new WritePolicy());
    }

    private static Record row(String alertId, long createdAtMillis, String status) {
        return row(alertId, "web-01", "High CPU", createdAtMillis, status);
    }

    private static Record row(String alertId, String host, String title, long createdAtMillis, String status) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("alertId", alertId);
        bins.put("source", "PAGERDUTY");
        bins.put("host", host);
        bins.put("title", title);
        bins.put("patternKey", Alert.patternKey(host, title));
        bins.put("severity", "SEV2");
        bins.put("status", status);
        bins.put("createdAt", createdAtMillis);
        return new Record(bins, 1, 0);
    }

    @Test
    void append_writesAlertBins() {
        AtomicReference<Bin[]> written = new AtomicReference<>();
        doAnswer(inv -> {
            written.set((Bin[]) inv.getRawArguments()[2]);
            return null;
        }).when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        Alert alert = TestDataFactory.createAlert("PD-1").withDecisionReason(DecisionReasons.DUPLICATE_ALERT);
        repository.append(alert);

        Map<String, Object> bins = Arrays.stream(written.get())
                .collect(Collectors.toMap(b -> b.name, b -> b.value.getObject()));
        assertThat(bins)
                .containsEntry("patternKey", "web-01|High CPU")
                .containsEntry("severity", "SEV2")
                .containsEntry("createdAt", NOW.toEpochMilli())
                .containsEntry("alertId", "PD-1")
                .containsEntry("decisionReason", "duplicate_alert")
                .doesNotContainKey("resolvedAt");
    }

    @Test
    void append_clientFailure_throwsStoreException() {
        doThrow(new AerospikeException(ResultCode.TIMEOUT, "timeout"))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.append(TestDataFactory.createAlert("PD-1")))
                .isInstanceOf(StoreException.class)
                .hasCauseInstanceOf(AerospikeException.class);
    }

    @Test
    void query_mapsRecordsOldestFirst() {
        RecordSet rs = mock(RecordSet.class);
        when(rs.next()).thenReturn(true, true, false);
        when(rs.getRecord()).thenReturn(
                row("B", NOW.minusSeconds(60).toEpochMilli(), "resolved"),
                row("A", NOW.minusSeconds(600).toEpochMilli(), "triggered"));
        when(client.query(any(QueryPolicy.class), any(Statement.class))).thenReturn(rs);

        List<Alert> alerts = repository.query("web-01", "High CPU", Severity.SEV2, lastHour);

        assertThat(alerts).extracting(Alert::getAlertId).containsExactly("A", "B");
        assertThat(alerts.get(0).getSeverity()).isEqualTo(Severity.SEV2);
        assertThat(alerts.get(0).getResolvedAt()).isNull();
        verify(rs).close();
    }

    @Test
    void query_collidingPatternKey_excludesOtherHostAndTitle() {
        // ("a|b", "c") and ("a", "b|c") share the key "a|b|c"
        RecordSet rs = mock(RecordSet.class);
        when(rs.next()).thenReturn(true, true, false);
        when(rs.getRecord()).thenReturn(
                row("OTHER", "a", "b|c", NOW.minusSeconds(60).toEpochMilli(), "triggered"),
                row("SAME", "a|b", "c", NOW.minusSeconds(120).toEpochMilli(), "triggered"));
        when(client.query(any(QueryPolicy.class), any(Statement.class))).thenReturn(rs);

        List<Alert> alerts = repository.query("a|b", "c", Severity.SEV2, lastHour);

        assertThat(alerts).extracting(Alert::getAlertId).containsExactly("SAME");
    }

    @Test
    void query_clientFailure_throwsStoreException() {
        when(client.query(any(QueryPolicy.class), any(Statement.class)))
                .thenThrow(new AerospikeException(ResultCode.TIMEOUT, "timeout"));

        assertThatThrownBy(() -> repository.queryByHost("web-01", lastHour))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("web-01");
    }

    @Test
    void ensureIndexes_existingIndex_isIgnored() {
        when(client.createIndex(any(), any(), any(), any(), any(), any()))
                .thenThrow(new AerospikeException(ResultCode.INDEX_ALREADY_EXISTS, "exists"));

        repository.ensureIndexes();

        verify(client, times(2)).createIndex(any(), any(), any(), any(), any(), any());
    }
}
