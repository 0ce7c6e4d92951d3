package com.ops.alertdecision.model;

/**
 * How a detector arrived at its verdict. NO_HISTORY and ERROR both carry a negative
 * verdict with zero confidence but must not be read as negative evidence. ERROR covers a
 * failed or timed-out store query.
 */
public enum DetectionStatus {
    EVALUATED,
    NO_HISTORY,
    ERROR
}
