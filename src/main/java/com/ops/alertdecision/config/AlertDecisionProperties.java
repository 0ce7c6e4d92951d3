package com.ops.alertdecision.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "alert-decision")
public class AlertDecisionProperties {

    // Classifier probability at or above which a predicted suppression is honoured
    private double suppressionThreshold = 0.8;

    // Same host/title/severity inside this window is a duplicate
    private int duplicateWindowMinutes = 5;

    // SEV1 alerts bypass the classifier and are forwarded (after the pattern checks)
    private boolean criticalAlwaysForward = true;

    private int flappingWindowMinutes = 30;

    // Status transitions needed inside the flapping window
    private int flappingThreshold = 3;

    // A resolution at or under this many minutes counts as quick
    private int selfResolveThresholdMinutes = 15;

    // Resolved samples required before the self-resolution verdict can be positive
    private int minResolutionCount = 3;

    private Worker worker = new Worker();

    @Data
    public static class Worker {
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 500;
        private int awaitTerminationSeconds = 30;
    }

    /**
     * Validate and freeze the decision settings.
     *
     * @throws IllegalStateException if a value is out of range
     */
    public AlertSettings toSettings() {
        if (suppressionThreshold < 0.0 || suppressionThreshold > 1.0) {
            throw new IllegalStateException("alert-decision.suppression-threshold must be in [0, 1]");
        }
        requireNonNegative(duplicateWindowMinutes, "duplicate-window-minutes");
        requireNonNegative(flappingWindowMinutes, "flapping-window-minutes");
        requireNonNegative(flappingThreshold, "flapping-threshold");
        requireNonNegative(selfResolveThresholdMinutes, "self-resolve-threshold-minutes");
        requireNonNegative(minResolutionCount, "min-resolution-count");

        return AlertSettings.builder()
                .suppressionThreshold(suppressionThreshold)
                .duplicateWindowMinutes(duplicateWindowMinutes)
                .criticalAlwaysForward(criticalAlwaysForward)
                .flappingWindowMinutes(flappingWindowMinutes)
                .flappingThreshold(flappingThreshold)
                .selfResolveThresholdMinutes(selfResolveThresholdMinutes)
                .minResolutionCount(minResolutionCount)
                .build();
    }

    private static void requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalStateException("alert-decision." + name + " must be >= 0");
        }
    }
}
