package com.ops.alertdecision.classifier;

import com.ops.alertdecision.exception.ClassifierException;
import com.ops.alertdecision.model.AlertFeatures;
import com.ops.alertdecision.model.ClassifierPrediction;

/**
 * Seam to the external model that predicts whether an alert is noise.
 * Predictions come back with canonical labels ({@link ClassifierPrediction#SUPPRESS} or
 * {@link ClassifierPrediction#KEEP}).
 */
public interface SuppressionClassifier {

    /**
     * Whether a model is configured at all. When false the classification step is skipped.
     */
    boolean isAvailable();

    /**
     * @throws ClassifierException on timeout, transport failure or a malformed response
     */
    ClassifierPrediction predict(AlertFeatures features);
}
