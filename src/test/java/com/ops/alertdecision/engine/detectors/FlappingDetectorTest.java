package com.ops.alertdecision.engine.detectors;

import com.ops.alertdecision.config.AlertSettings;
import com.ops.alertdecision.exception.StoreException;
import com.ops.alertdecision.model.*;
import com.ops.alertdecision.store.HistoricalAlertStore;
import com.ops.alertdecision.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static com.ops.alertdecision.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FlappingDetectorTest {

    @Mock private HistoricalAlertStore store;

    private FlappingDetector detector;

    @BeforeEach
    void setUp() {
        detector = new FlappingDetector(AlertSettings.defaults(), store);
    }

    private static List<Alert> withStatuses(String... statuses) {
        List<Alert> alerts = new ArrayList<>();
        for (int i = 0; i < statuses.length; i++) {
            alerts.add(TestDataFactory.historical("web-01", "High CPU", statuses[i],
                    NOW.minusSeconds((statuses.length - i) * 60L)));
        }
        return alerts;
    }

    @Test
    void detect_fourTransitions_flappingWithFullConfidence() {
        when(store.query(eq("web-01"), eq("High CPU"), isNull(), any()))
                .thenReturn(withStatuses("triggered", "resolved", "triggered", "resolved", "triggered"));

        FlappingResult result = detector.detect(TestDataFactory.createAlert("A-1"), NOW);

        assertThat(result.isFlapping()).isTrue();
        assertThat(result.getTransitionCount()).isEqualTo(4);
        assertThat(result.getTotalAlerts()).isEqualTo(5);
        assertThat(result.getConfidence()).isEqualTo(1.0);
        assertThat(result.getDaysWithAlerts()).isEqualTo(1);
        assertThat(result.getFirstAlertAt()).isEqualTo(NOW.minusSeconds(300));
        assertThat(result.getLastAlertAt()).isEqualTo(NOW.minusSeconds(60));
    }

    @Test
    void detect_belowThreshold_notFlappingWithPartialConfidence() {
        when(store.query(anyString(), anyString(), isNull(), any()))
                .thenReturn(withStatuses("triggered", "resolved", "triggered"));

        FlappingResult result = detector.detect(TestDataFactory.createAlert("A-1"), NOW);

        assertThat(result.isFlapping()).isFalse();
        assertThat(result.getTransitionCount()).isEqualTo(2);
        assertThat(result.getConfidence()).isCloseTo(2.0 / 3.0, org.assertj.core.data.Offset.offset(1e-9));
    }

    @Test
    void detect_nullStatuses_neverCountAsTransitions() {
        when(store.query(anyString(), anyString(), isNull(), any()))
                .thenReturn(withStatuses("triggered", null, "resolved", null, "triggered"));

        FlappingResult result = detector.detect(TestDataFactory.createAlert("A-1"), NOW);

        assertThat(result.getTransitionCount()).isZero();
        assertThat(result.isFlapping()).isFalse();
    }

    @Test
    void detect_unorderedHistory_isSortedBeforeCounting() {
        List<Alert> history = new ArrayList<>(withStatuses("triggered", "triggered", "resolved", "resolved"));
        java.util.Collections.reverse(history);
        when(store.query(anyString(), anyString(), isNull(), any())).thenReturn(history);

        FlappingResult result = detector.detect(TestDataFactory.createAlert("A-1"), NOW);

        assertThat(result.getTransitionCount()).isEqualTo(1);
    }

    @Test
    void detect_singleAlert_neverFlapping() {
        AlertSettings zeroThreshold = AlertSettings.builder().flappingThreshold(0).build();
        detector = new FlappingDetector(zeroThreshold, store);
        when(store.query(anyString(), anyString(), isNull(), any())).thenReturn(withStatuses("triggered"));

        FlappingResult result = detector.detect(TestDataFactory.createAlert("A-1"), NOW);

        assertThat(result.isFlapping()).isFalse();
        assertThat(result.getConfidence()).isEqualTo(0.0);
    }

    @Test
    void detect_noHistory_negative() {
        when(store.query(anyString(), anyString(), isNull(), any())).thenReturn(List.of());

        FlappingResult result = detector.detect(TestDataFactory.createAlert("A-1"), NOW);

        assertThat(result.isFlapping()).isFalse();
        assertThat(result.getStatus()).isEqualTo(DetectionStatus.NO_HISTORY);
    }

    @Test
    void detect_storeFailure_failsOpen() {
        when(store.query(anyString(), anyString(), isNull(), any())).thenThrow(new StoreException("down"));

        FlappingResult result = detector.detect(TestDataFactory.createAlert("A-1"), NOW);

        assertThat(result.isFlapping()).isFalse();
        assertThat(result.getConfidence()).isEqualTo(0.0);
        assertThat(result.getStatus()).isEqualTo(DetectionStatus.ERROR);
    }

    @Test
    void confidence_isMonotonicInTransitionCount() {
        double previous = -1.0;
        for (int n = 2; n <= 8; n++) {
            String[] statuses = new String[n];
            for (int i = 0; i < n; i++) statuses[i] = i % 2 == 0 ? "triggered" : "resolved";
            reset(store);
            when(store.query(anyString(), anyString(), isNull(), any())).thenReturn(withStatuses(statuses));

            double confidence = detector.detect(TestDataFactory.createAlert("A-1"), NOW).getConfidence();

            assertThat(confidence).isGreaterThanOrEqualTo(previous).isBetween(0.0, 1.0);
            previous = confidence;
        }
    }
}
