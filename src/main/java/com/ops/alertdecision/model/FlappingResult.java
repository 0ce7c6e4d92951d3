package com.ops.alertdecision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@Schema(description = "Outcome of the flapping check for one (host, title) pattern")
public class FlappingResult implements DetectionResult {

    @Schema(description = "Whether the pattern toggles status often enough to count as flapping", example = "true")
    boolean flapping;

    @Schema(description = "min(transitions / threshold, 1.0)", example = "1.0")
    double confidence;

    @Schema(description = "Status changes between adjacent alerts in the window", example = "4")
    int transitionCount;

    @Schema(description = "Alerts in the window", example = "5")
    int totalAlerts;

    @Schema(description = "Transition threshold applied", example = "3")
    int threshold;

    @Schema(description = "Lookback window used, in minutes", example = "30")
    int windowMinutes;

    Instant firstAlertAt;

    Instant lastAlertAt;

    @Schema(description = "Distinct UTC days with alerts in the window", example = "1")
    int daysWithAlerts;

    DetectionStatus status;

    String message;

    @Override
    public boolean isPositive() {
        return flapping;
    }

    public static FlappingResult noHistory(int threshold, int windowMinutes) {
        return FlappingResult.builder()
                .threshold(threshold)
                .windowMinutes(windowMinutes)
                .status(DetectionStatus.NO_HISTORY)
                .message("No historical data found for flapping analysis")
                .build();
    }

    public static FlappingResult failed(int threshold, int windowMinutes, String error) {
        return FlappingResult.builder()
                .threshold(threshold)
                .windowMinutes(windowMinutes)
                .status(DetectionStatus.ERROR)
                .message("Error detecting flapping alerts: " + error)
                .build();
    }
}
