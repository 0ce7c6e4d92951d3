package com.ops.alertdecision.config;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only decision settings, loaded once at startup and handed to every detector and the policy.
 */
@Value
@Builder
@Schema(description = "Effective decision settings")
public class AlertSettings {

    @Schema(example = "0.8")
    @Builder.Default
    double suppressionThreshold = 0.8;

    @Schema(example = "5")
    @Builder.Default
    int duplicateWindowMinutes = 5;

    @Schema(example = "true")
    @Builder.Default
    boolean criticalAlwaysForward = true;

    @Schema(example = "30")
    @Builder.Default
    int flappingWindowMinutes = 30;

    @Schema(example = "3")
    @Builder.Default
    int flappingThreshold = 3;

    @Schema(example = "15")
    @Builder.Default
    int selfResolveThresholdMinutes = 15;

    @Schema(example = "3")
    @Builder.Default
    int minResolutionCount = 3;

    public static AlertSettings defaults() {
        return AlertSettings.builder().build();
    }
}
