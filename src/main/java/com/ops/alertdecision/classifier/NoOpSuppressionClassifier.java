package com.ops.alertdecision.classifier;

import com.ops.alertdecision.exception.ClassifierException;
import com.ops.alertdecision.model.AlertFeatures;
import com.ops.alertdecision.model.ClassifierPrediction;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Used when no model is deployed. Decisions then rely on the detectors alone.
 */
@Component
@ConditionalOnProperty(name = "classifier.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpSuppressionClassifier implements SuppressionClassifier {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public ClassifierPrediction predict(AlertFeatures features) {
        throw new ClassifierException("No suppression classifier is configured");
    }
}
