package com.ops.alertdecision.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

@Value
@Builder
@Schema(description = "Result of the classification step, including skipped and failed calls")
public class ClassificationOutcome {

    public static final String SKIP_DUPLICATE = "duplicate_alert";
    public static final String SKIP_PATTERN = "pattern_suppression";
    public static final String SKIP_UNAVAILABLE = "classifier_unavailable";

    @Schema(description = "Whether the classifier produced a prediction", example = "PREDICTED")
    ClassificationStatus status;

    ClassifierPrediction prediction;

    @Schema(description = "Why the step was skipped", example = "duplicate_alert")
    String skipReason;

    @Schema(description = "Failure message when the call failed")
    String error;

    @JsonIgnore
    public Optional<ClassifierPrediction> usablePrediction() {
        return status == ClassificationStatus.PREDICTED ? Optional.ofNullable(prediction) : Optional.empty();
    }

    public static ClassificationOutcome predicted(ClassifierPrediction prediction) {
        return ClassificationOutcome.builder()
                .status(ClassificationStatus.PREDICTED)
                .prediction(prediction)
                .build();
    }

    public static ClassificationOutcome skipped(String reason) {
        return ClassificationOutcome.builder()
                .status(ClassificationStatus.SKIPPED)
                .skipReason(reason)
                .build();
    }

    public static ClassificationOutcome failed(String error) {
        return ClassificationOutcome.builder()
                .status(ClassificationStatus.FAILED)
                .error(error)
                .build();
    }
}
