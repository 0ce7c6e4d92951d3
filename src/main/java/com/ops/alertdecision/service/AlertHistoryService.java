package com.ops.alertdecision.service;

import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.DecisionReasons;
import com.ops.alertdecision.model.HostHistorySummary;
import com.ops.alertdecision.model.TimeWindow;
import com.ops.alertdecision.store.HistoricalAlertStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only views over the historical alert store.
 */
@Service
public class AlertHistoryService {

    static final int LOOKBACK_DAYS = 7;

    private final HistoricalAlertStore store;
    private final Clock clock;

    public AlertHistoryService(HistoricalAlertStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Most recent alerts of a (host, title) pattern over the lookback, newest first.
     */
    public List<Alert> recentAlerts(String host, String title, int limit) {
        List<Alert> alerts = new ArrayList<>(store.query(host, title, null, lookback()));
        Collections.reverse(alerts);
        return alerts.size() > limit ? new ArrayList<>(alerts.subList(0, limit)) : alerts;
    }

    public HostHistorySummary hostSummary(String host) {
        List<Alert> alerts = store.queryByHost(host, lookback());

        long days = alerts.stream()
                .map(a -> a.getCreatedAt().atZone(ZoneOffset.UTC).toLocalDate())
                .distinct()
                .count();
        long decided = alerts.stream().filter(a -> a.getDecisionReason() != null).count();
        long suppressed = alerts.stream().filter(a -> DecisionReasons.isSuppression(a.getDecisionReason())).count();

        return HostHistorySummary.builder()
                .host(host)
                .lookbackDays(LOOKBACK_DAYS)
                .totalAlerts(alerts.size())
                .daysWithAlerts(days)
                .suppressionRate(decided > 0 ? (double) suppressed / decided : 0.0)
                .lastAlertAt(alerts.isEmpty() ? null : alerts.get(alerts.size() - 1).getCreatedAt())
                .build();
    }

    private TimeWindow lookback() {
        return TimeWindow.lookback(clock.instant(), Duration.ofDays(LOOKBACK_DAYS));
    }
}
