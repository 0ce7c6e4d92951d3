package com.ops.alertdecision.engine.detectors;

import com.ops.alertdecision.config.AlertSettings;
import com.ops.alertdecision.engine.AlertDetector;
import com.ops.alertdecision.exception.StoreException;
import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.DetectionStatus;
import com.ops.alertdecision.model.ResolutionStats;
import com.ops.alertdecision.model.SelfResolutionResult;
import com.ops.alertdecision.model.TimeWindow;
import com.ops.alertdecision.store.HistoricalAlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Detects a (host, title) pattern that historically clears itself quickly.
 *
 * Logic: over the last 7 days, take every resolved alert of the pattern and its resolution
 * time in whole minutes. A resolution is quick when it took at most
 * {@code selfResolveThresholdMinutes}. The pattern is self-resolving when at least
 * {@code minResolutionCount} resolutions exist and at least 70% of them were quick.
 */
@Component
public class SelfResolutionDetector implements AlertDetector<SelfResolutionResult> {

    private static final Logger log = LoggerFactory.getLogger(SelfResolutionDetector.class);

    static final Duration LOOKBACK = Duration.ofDays(7);
    static final int QUICK_RESOLUTION_PCT = 70;

    private final AlertSettings settings;
    private final HistoricalAlertStore store;

    public SelfResolutionDetector(AlertSettings settings, HistoricalAlertStore store) {
        this.settings = settings;
        this.store = store;
    }

    @Override
    public String getName() {
        return "self_resolution_check";
    }

    @Override
    public SelfResolutionResult detect(Alert alert, Instant now) {
        int thresholdMinutes = settings.getSelfResolveThresholdMinutes();
        int minCount = settings.getMinResolutionCount();

        List<Alert> history;
        try {
            history = store.query(alert.getHost(), alert.getTitle(), null, TimeWindow.lookback(now, LOOKBACK));
        } catch (StoreException e) {
            log.warn("Self-resolution check failed for {}: {}", alert.getPatternKey(), e.getMessage());
            return failed(e.getMessage());
        }

        long[] minutes = history.stream()
                .filter(a -> a.getResolvedAt() != null && !a.getResolvedAt().isBefore(a.getCreatedAt()))
                .mapToLong(a -> Duration.between(a.getCreatedAt(), a.getResolvedAt()).toMinutes())
                .toArray();

        int total = minutes.length;
        if (total == 0) {
            return SelfResolutionResult.noHistory(thresholdMinutes, minCount);
        }

        int quick = 0;
        for (long m : minutes) {
            if (m <= thresholdMinutes) quick++;
        }

        boolean selfResolving = total >= minCount && (long) quick * 100 >= (long) total * QUICK_RESOLUTION_PCT;
        double confidence = (double) quick / total;

        return SelfResolutionResult.builder()
                .selfResolving(selfResolving)
                .confidence(confidence)
                .totalResolved(total)
                .quickCount(quick)
                .thresholdMinutes(thresholdMinutes)
                .minResolutionCount(minCount)
                .stats(stats(minutes))
                .status(DetectionStatus.EVALUATED)
                .message(String.format("%d of %d alerts resolved within %d minutes",
                        quick, total, thresholdMinutes))
                .build();
    }

    @Override
    public SelfResolutionResult failed(String error) {
        return SelfResolutionResult.failed(settings.getSelfResolveThresholdMinutes(),
                settings.getMinResolutionCount(), error);
    }

    static ResolutionStats stats(long[] minutes) {
        int n = minutes.length;
        if (n == 0) return ResolutionStats.EMPTY;

        double sum = 0;
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (long m : minutes) {
            sum += m;
            min = Math.min(min, m);
            max = Math.max(max, m);
        }
        double mean = sum / n;

        // sample standard deviation
        double stddev = 0.0;
        if (n > 1) {
            double sq = 0;
            for (long m : minutes) {
                sq += (m - mean) * (m - mean);
            }
            stddev = Math.sqrt(sq / (n - 1));
        }

        return ResolutionStats.builder()
                .meanMinutes(mean)
                .minMinutes(min)
                .maxMinutes(max)
                .stddevMinutes(stddev)
                .build();
    }
}
