package com.ops.alertdecision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Final forward/suppress decision for one alert")
public class Decision {

    @Schema(description = "Action taken", example = "SUPPRESS")
    DecisionAction action;

    @Schema(description = "Reason from the fixed vocabulary", example = "duplicate_alert")
    String reason;

    @Schema(description = "Confidence in [0,1]", example = "1.0")
    double confidence;

    public static Decision suppress(String reason, double confidence) {
        return new Decision(DecisionAction.SUPPRESS, reason, confidence);
    }

    public static Decision forward(String reason, double confidence) {
        return new Decision(DecisionAction.FORWARD, reason, confidence);
    }
}
