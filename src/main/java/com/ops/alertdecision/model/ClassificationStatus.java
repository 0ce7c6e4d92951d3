package com.ops.alertdecision.model;

public enum ClassificationStatus {
    PREDICTED,
    FAILED,
    SKIPPED
}
