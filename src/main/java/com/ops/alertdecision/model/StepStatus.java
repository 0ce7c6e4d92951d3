package com.ops.alertdecision.model;

public enum StepStatus {
    COMPLETED,
    // reached its fallback value after a collaborator failed
    DEGRADED,
    SKIPPED
}
