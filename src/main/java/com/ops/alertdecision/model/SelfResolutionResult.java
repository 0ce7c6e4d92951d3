package com.ops.alertdecision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Outcome of the self-resolution check for one (host, title) pattern")
public class SelfResolutionResult implements DetectionResult {

    @Schema(description = "Whether the pattern historically clears itself quickly", example = "true")
    boolean selfResolving;

    @Schema(description = "quick / total resolved", example = "0.8")
    double confidence;

    @Schema(description = "Resolved alerts in the 7-day lookback", example = "5")
    int totalResolved;

    @Schema(description = "Resolved alerts that cleared within the threshold", example = "4")
    int quickCount;

    @Schema(description = "Quick-resolution threshold in minutes", example = "15")
    int thresholdMinutes;

    @Schema(description = "Minimum resolved samples required for a positive verdict", example = "3")
    int minResolutionCount;

    @Builder.Default
    ResolutionStats stats = ResolutionStats.EMPTY;

    DetectionStatus status;

    String message;

    @Override
    public boolean isPositive() {
        return selfResolving;
    }

    public static SelfResolutionResult noHistory(int thresholdMinutes, int minResolutionCount) {
        return SelfResolutionResult.builder()
                .thresholdMinutes(thresholdMinutes)
                .minResolutionCount(minResolutionCount)
                .status(DetectionStatus.NO_HISTORY)
                .message("No resolution history found for self-resolving analysis")
                .build();
    }

    public static SelfResolutionResult failed(int thresholdMinutes, int minResolutionCount, String error) {
        return SelfResolutionResult.builder()
                .thresholdMinutes(thresholdMinutes)
                .minResolutionCount(minResolutionCount)
                .status(DetectionStatus.ERROR)
                .message("Error detecting self-resolving alerts: " + error)
                .build();
    }
}
