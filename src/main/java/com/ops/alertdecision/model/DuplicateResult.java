package com.ops.alertdecision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Outcome of the duplicate check for one alert")
public class DuplicateResult implements DetectionResult {

    @Schema(description = "Whether a matching alert was raised inside the duplicate window", example = "true")
    boolean duplicate;

    @Schema(description = "Number of matching prior alerts (capped)", example = "2")
    int duplicateCount;

    @Schema(description = "Matching prior alerts, newest first, at most 10")
    @Builder.Default
    List<Alert> recentAlerts = List.of();

    @Schema(description = "Lookback window used, in minutes", example = "5")
    int windowMinutes;

    @Schema(description = "1.0 for a duplicate, 0.0 otherwise", example = "1.0")
    double confidence;

    DetectionStatus status;

    String message;

    @Override
    public boolean isPositive() {
        return duplicate;
    }

    public static DuplicateResult noHistory(int windowMinutes) {
        return DuplicateResult.builder()
                .windowMinutes(windowMinutes)
                .status(DetectionStatus.NO_HISTORY)
                .message("No matching alert within the last " + windowMinutes + " minutes")
                .build();
    }

    public static DuplicateResult failed(int windowMinutes, String error) {
        return DuplicateResult.builder()
                .windowMinutes(windowMinutes)
                .status(DetectionStatus.ERROR)
                .message("Error checking duplicates: " + error)
                .build();
    }
}
