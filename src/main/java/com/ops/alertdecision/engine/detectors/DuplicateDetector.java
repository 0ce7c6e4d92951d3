package com.ops.alertdecision.engine.detectors;

import com.ops.alertdecision.config.AlertSettings;
import com.ops.alertdecision.engine.AlertDetector;
import com.ops.alertdecision.exception.StoreException;
import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.DetectionStatus;
import com.ops.alertdecision.model.DuplicateResult;
import com.ops.alertdecision.model.TimeWindow;
import com.ops.alertdecision.store.HistoricalAlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flags an alert whose host, title and severity all match an alert raised
 * within the last {@code duplicateWindowMinutes}.
 */
@Component
public class DuplicateDetector implements AlertDetector<DuplicateResult> {

    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    static final int MAX_RECENT_ALERTS = 10;

    private final AlertSettings settings;
    private final HistoricalAlertStore store;

    public DuplicateDetector(AlertSettings settings, HistoricalAlertStore store) {
        this.settings = settings;
        this.store = store;
    }

    @Override
    public String getName() {
        return "duplicate_check";
    }

    @Override
    public DuplicateResult detect(Alert alert, Instant now) {
        int windowMinutes = settings.getDuplicateWindowMinutes();
        TimeWindow window = TimeWindow.lookback(now, Duration.ofMinutes(windowMinutes));

        List<Alert> matches;
        try {
            matches = store.query(alert.getHost(), alert.getTitle(), alert.getSeverity(), window);
        } catch (StoreException e) {
            log.warn("Duplicate check failed for {}: {}", alert.getPatternKey(), e.getMessage());
            return failed(e.getMessage());
        }

        if (matches.isEmpty()) {
            return DuplicateResult.noHistory(windowMinutes);
        }

        List<Alert> newestFirst = new ArrayList<>(matches);
        Collections.reverse(newestFirst);
        List<Alert> recent = List.copyOf(newestFirst.subList(0, Math.min(MAX_RECENT_ALERTS, newestFirst.size())));

        return DuplicateResult.builder()
                .duplicate(true)
                .duplicateCount(recent.size())
                .recentAlerts(recent)
                .windowMinutes(windowMinutes)
                .confidence(1.0)
                .status(DetectionStatus.EVALUATED)
                .message(String.format("Found %d similar alerts in the last %d minutes", recent.size(), windowMinutes))
                .build();
    }

    @Override
    public DuplicateResult failed(String error) {
        return DuplicateResult.failed(settings.getDuplicateWindowMinutes(), error);
    }
}
