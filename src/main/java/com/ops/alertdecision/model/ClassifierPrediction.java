package com.ops.alertdecision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Label predicted by the suppression classifier, with the probabilities it reported.
 * Probabilities need not cover every label; those present sum to at most 1.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Prediction returned by the suppression classifier")
public class ClassifierPrediction {

    public static final String SUPPRESS = "suppress";
    public static final String KEEP = "keep";

    @Schema(description = "Label the model predicted", example = "suppress")
    String predictedLabel;

    @Schema(description = "Probability per observed label", example = "{\"suppress\": 0.85, \"keep\": 0.15}")
    @Builder.Default
    Map<String, Double> labelProbabilities = Map.of();

    public boolean indicatesSuppression() {
        return SUPPRESS.equals(predictedLabel);
    }

    /**
     * Probability reported for the predicted label, 0 when the model did not report one.
     */
    public double getPredictedProbability() {
        return probabilityOf(predictedLabel);
    }

    public double probabilityOf(String label) {
        if (label == null || labelProbabilities == null) return 0.0;
        Double p = labelProbabilities.get(label);
        return p != null ? p : 0.0;
    }
}
