package com.ops.alertdecision.engine;

import com.ops.alertdecision.model.Alert;
import com.ops.alertdecision.model.DetectionResult;

import java.time.Instant;

/**
 * Interface for the history-based noise detectors.
 * Implementations never throw on store failure; they return {@link #failed(String)} instead.
 */
public interface AlertDetector<R extends DetectionResult> {

    /**
     * Step name used in spans, metrics and degraded-step lists.
     */
    String getName();

    /**
     * Evaluate an alert against the history visible at {@code now}.
     *
     * @param alert the incoming alert
     * @param now   snapshot time all lookback windows are anchored on
     */
    R detect(Alert alert, Instant now);

    /**
     * Negative, zero-confidence result carrying an error message.
     */
    R failed(String error);
}
