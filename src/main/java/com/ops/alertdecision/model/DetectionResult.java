package com.ops.alertdecision.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Common view over the three pattern detector results.
 */
public interface DetectionResult {

    /**
     * Whether the detector signals suppression.
     */
    @JsonIgnore
    boolean isPositive();

    /**
     * Confidence in [0,1]; 0 whenever the verdict was computed without historical samples.
     */
    double getConfidence();

    DetectionStatus getStatus();

    String getMessage();

    @JsonIgnore
    default boolean isDegraded() {
        return getStatus() == DetectionStatus.ERROR;
    }
}
