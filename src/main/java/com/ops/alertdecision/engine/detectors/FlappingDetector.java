package com.ops.alertdecision.engine.detectors;

import com.ops.alertdecision.config.AlertSettings;
import com.ops.alertdecision.engine.AlertDetector;
import com.ops.alertdecision.exception.StoreException;
import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.DetectionStatus;
import com.ops.alertdecision.model.FlappingResult;
import com.ops.alertdecision.model.TimeWindow;
import com.ops.alertdecision.store.HistoricalAlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Detects a (host, title) pattern that keeps toggling status.
 *
 * Logic: order the pattern's alerts in the flapping window by creation time and count adjacent
 * pairs whose statuses are both known and differ. The pattern is flapping when that count reaches
 * {@code flappingThreshold} and the window holds more than one alert.
 * Confidence is min(transitions / threshold, 1.0).
 *
 * Example: statuses triggered, resolved, triggered, resolved, triggered with threshold 3 give
 * 4 transitions, so flapping with confidence 1.0.
 */
@Component
public class FlappingDetector implements AlertDetector<FlappingResult> {

    private static final Logger log = LoggerFactory.getLogger(FlappingDetector.class);

    private final AlertSettings settings;
    private final HistoricalAlertStore store;

    public FlappingDetector(AlertSettings settings, HistoricalAlertStore store) {
        this.settings = settings;
        this.store = store;
    }

    @Override
    public String getName() {
        return "flapping_check";
    }

    @Override
    public FlappingResult detect(Alert alert, Instant now) {
        int threshold = settings.getFlappingThreshold();
        int windowMinutes = settings.getFlappingWindowMinutes();
        TimeWindow window = TimeWindow.lookback(now, Duration.ofMinutes(windowMinutes));

        List<Alert> history;
        try {
            history = new ArrayList<>(store.query(alert.getHost(), alert.getTitle(), null, window));
        } catch (StoreException e) {
            log.warn("Flapping check failed for {}: {}", alert.getPatternKey(), e.getMessage());
            return failed(e.getMessage());
        }

        if (history.isEmpty()) {
            return FlappingResult.noHistory(threshold, windowMinutes);
        }
        history.sort(Comparator.comparing(Alert::getCreatedAt));

        int transitions = countTransitions(history);
        int total = history.size();
        boolean flapping = transitions >= threshold && total > 1;
        double confidence = threshold > 0 ? Math.min((double) transitions / threshold, 1.0) : 0.0;

        int days = (int) history.stream()
                .map(a -> a.getCreatedAt().atZone(ZoneOffset.UTC).toLocalDate())
                .distinct()
                .count();

        return FlappingResult.builder()
                .flapping(flapping)
                .confidence(confidence)
                .transitionCount(transitions)
                .totalAlerts(total)
                .threshold(threshold)
                .windowMinutes(windowMinutes)
                .firstAlertAt(history.get(0).getCreatedAt())
                .lastAlertAt(history.get(total - 1).getCreatedAt())
                .daysWithAlerts(days)
                .status(DetectionStatus.EVALUATED)
                .message(String.format("Alert has %d state transitions across %d alerts in the last %d minutes",
                        transitions, total, windowMinutes))
                .build();
    }

    @Override
    public FlappingResult failed(String error) {
        return FlappingResult.failed(settings.getFlappingThreshold(), settings.getFlappingWindowMinutes(), error);
    }

    static int countTransitions(List<Alert> ordered) {
        int transitions = 0;
        for (int i = 1; i < ordered.size(); i++) {
            String previous = ordered.get(i - 1).getStatus();
            String current = ordered.get(i).getStatus();
            if (previous != null && current != null && !previous.equals(current)) {
                transitions++;
            }
        }
        return transitions;
    }
}
